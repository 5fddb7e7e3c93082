package com.segcalc.validation.check;

import com.segcalc.common.config.PhysicalConstants;
import com.segcalc.common.config.RunConfig;
import com.segcalc.common.physics.RedshiftCalculator;
import com.segcalc.common.physics.Schwarzschild;
import com.segcalc.common.physics.SegmentDensity;
import com.segcalc.common.physics.TimeDilation;
import com.segcalc.validation.model.ValidationCategory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Closed-form identities of the basic formulas.
 */
@Component
@Order(1)
public class CoreFormulaChecks implements ValidationCheckGroup {

    static final double M_EARTH = 5.972e24;
    static final double R_EARTH = 6.371e6;

    @Override
    public ValidationCategory category() {
        return ValidationCategory.CORE_FORMULA;
    }

    @Override
    public void run(ValidationContext context, CheckRecorder recorder) {
        RunConfig config = context.config();
        PhysicalConstants k = config.constants();
        double phi = k.phi();

        recorder.absolute("core.golden_ratio", (1.0 + Math.sqrt(5.0)) / 2.0, 1e-15, () -> phi);
        recorder.absolute("core.golden_ratio_identity", 0.0, 1e-15, () -> phi * phi - phi - 1.0);

        recorder.absolute("core.rs_sun", 2953.3, 1.0, () -> Schwarzschild.radiusForSolarMasses(1.0, k));
        recorder.relative("core.rs_linear_scaling", 10.0, 1e-12,
            () -> Schwarzschild.radiusForSolarMasses(10.0, k) / Schwarzschild.radiusForSolarMasses(1.0, k));

        double rsEarth = Schwarzschild.radius(M_EARTH, k);
        recorder.relative("core.xi_weak_earth", rsEarth / (2.0 * R_EARTH), 1e-12,
            () -> SegmentDensity.weak(R_EARTH, rsEarth));

        recorder.relative("core.dilation_from_xi", 1.0 / (1.0 + SegmentDensity.evaluate(5.0, 1.0, config)), 1e-14,
            () -> TimeDilation.ssz(5.0, 1.0, config));

        recorder.verify("core.z_combined_identity", "z", "exact", () -> {
            for (double z : new double[] {0.0, 1e-9, 0.2254, 3.7}) {
                double combined = RedshiftCalculator.combined(z, 0.0);
                if (Math.abs(combined - z) > 1e-15) {
                    return Evaluation.of(false, CheckRecorder.format(combined), "z=" + z);
                }
            }
            return Evaluation.of(true, "z");
        });

        recorder.absolute("core.doppler_zero_velocity", 0.0, 0.0,
            () -> RedshiftCalculator.doppler(0.0, k.speedOfLight()));

        recorder.relative("core.z_from_dilation", RedshiftCalculator.gravitational(4.0, 1.0), 1e-12,
            () -> RedshiftCalculator.fromDilation(TimeDilation.gr(4.0, 1.0)));
    }
}
