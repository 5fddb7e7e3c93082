package com.segcalc.validation.check;

import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.CalculationResult;
import com.segcalc.common.model.CelestialObject;
import com.segcalc.common.model.Regime;
import com.segcalc.common.physics.DualVelocity;
import com.segcalc.common.physics.RedshiftCalculator;
import com.segcalc.common.physics.Schwarzschild;
import com.segcalc.common.physics.SegmentDensity;
import com.segcalc.common.physics.TimeDilation;
import com.segcalc.validation.model.ValidationCategory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Behaviour at and around the Schwarzschild radius, and the weak-field contract.
 */
@Component
@Order(2)
public class PhysicalLimitChecks implements ValidationCheckGroup {

    private static final double[] DUAL_VELOCITY_RADII = {2.0, 5.0, 10.0, 100.0};
    private static final double[] POSITIVITY_RADII = {0.5, 1.0, 2.0, 10.0, 100.0};

    @Override
    public ValidationCategory category() {
        return ValidationCategory.PHYSICAL_LIMIT;
    }

    @Override
    public void run(ValidationContext context, CheckRecorder recorder) {
        RunConfig config = context.config();
        double c = config.constants().speedOfLight();
        double rs = Schwarzschild.radiusForSolarMasses(1.0, config.constants());

        recorder.verify("limit.dilation_identity", "1", "rel 1e-12", () -> {
            double worst = 0.0;
            for (double x : new double[] {0.5, 1.0, 1.5, 2.0, 2.5, 5.0, 50.0, 1e4}) {
                double xi = SegmentDensity.evaluate(x * rs, rs, config);
                worst = Math.max(worst, Math.abs(TimeDilation.ssz(xi) * (1.0 + xi) - 1.0));
            }
            return Evaluation.of(worst <= 1e-12, "max error " + CheckRecorder.format(worst));
        });

        for (double x : DUAL_VELOCITY_RADII) {
            recorder.absolute(String.format(Locale.ROOT, "limit.dual_velocity.%.0f_rs", x), 0.0, 1e-10,
                () -> DualVelocity.productDeviation(x * rs, rs, c));
        }

        recorder.absolute("limit.d_ssz_at_rs", 0.555, 0.001, () -> TimeDilation.ssz(rs, rs, config));
        recorder.absolute("limit.xi_at_rs", 0.802, 0.001, () -> SegmentDensity.evaluate(rs, rs, config));
        recorder.absolute("limit.d_gr_at_rs", 0.0, 0.0, () -> TimeDilation.gr(rs, rs));

        recorder.verify("limit.z_gr_undefined_inside_rs", "NaN", "exact", () -> {
            double atHorizon = RedshiftCalculator.gravitational(rs, rs);
            double inside = RedshiftCalculator.gravitational(0.5 * rs, rs);
            return Evaluation.of(Double.isNaN(atHorizon) && Double.isNaN(inside),
                atHorizon + " / " + inside);
        });

        CelestialObject sun = CelestialObject.of("Sun", 1.0, 696_340.0);
        recorder.equal("limit.weak_field.sun_regime", Regime.WEAK,
            () -> context.calculator().calculate(sun, config).regime());
        recorder.absolute("limit.weak_field.sun_redshift", 0.0, 1e-10, () -> {
            CalculationResult r = context.calculator().calculate(sun, config);
            return Math.abs(r.zSszGrav() - r.zGr()) / r.zGr();
        });
        recorder.absolute("limit.weak_field.sun_correction", 0.0, 0.0,
            () -> context.calculator().calculate(sun, config).correctionPercent());

        for (double x : POSITIVITY_RADII) {
            recorder.verify(String.format(Locale.ROOT, "limit.d_ssz_positive.%s_rs", x), "> 0", "strict", () -> {
                double d = TimeDilation.ssz(x * rs, rs, config);
                return Evaluation.of(d > 0.0 && Double.isFinite(d), CheckRecorder.format(d));
            });
        }
    }
}
