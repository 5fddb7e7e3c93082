package com.segcalc.validation.check;

import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.CelestialObject;
import com.segcalc.common.model.Winner;
import com.segcalc.common.physics.RadialSweep;
import com.segcalc.common.physics.Schwarzschild;
import com.segcalc.common.physics.SegmentDensity;
import com.segcalc.validation.model.ValidationCategory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Sweeps over many radii and repeated calls.
 */
@Component
@Order(3)
public class NumericalStabilityChecks implements ValidationCheckGroup {

    private static final int SWEEP_POINTS = 400;
    private static final int REPEATS = 5;

    @Override
    public ValidationCategory category() {
        return ValidationCategory.NUMERICAL_STABILITY;
    }

    @Override
    public void run(ValidationContext context, CheckRecorder recorder) {
        RunConfig config = context.config();
        double rs = Schwarzschild.radiusForSolarMasses(1.0, config.constants());
        double phi = config.constants().phi();
        double xiMax = config.parameters().xiMax();

        RadialSweep sweep = RadialSweep.logSpaced(rs, 0.1, 1e6, SWEEP_POINTS, config);

        recorder.absolute("stability.identity_sweep", 0.0, 1e-10, sweep::maxIdentityError);

        recorder.verify("stability.xi_non_negative_sweep", "Ξ ≥ 0", "exact", () -> {
            for (double xi : sweep.segmentDensities()) {
                if (!(xi >= 0.0)) {
                    return Evaluation.of(false, CheckRecorder.format(xi));
                }
            }
            return Evaluation.of(true, SWEEP_POINTS + " points");
        });

        recorder.verify("stability.d_ssz_range_sweep", "0 < D ≤ 1", "exact", () -> {
            for (double d : sweep.dilationsSsz()) {
                if (!(d > 0.0 && d <= 1.0)) {
                    return Evaluation.of(false, CheckRecorder.format(d));
                }
            }
            return Evaluation.of(true, SWEEP_POINTS + " points");
        });

        recorder.verify("stability.xi_weak_non_increasing", "non-increasing beyond 110 r_s", "exact", () -> {
            double previous = Double.POSITIVE_INFINITY;
            for (int i = 0; i < 200; i++) {
                double r = 110.0 * rs * Math.pow(1.05, i);
                double xi = SegmentDensity.weak(r, rs);
                if (xi > previous) {
                    return Evaluation.of(false, "rose at r/r_s=" + CheckRecorder.format(r / rs));
                }
                previous = xi;
            }
            return Evaluation.of(true, "200 samples");
        });

        recorder.verify("stability.xi_strong_non_decreasing", "non-decreasing toward r_s", "exact", () -> {
            double previous = Double.NEGATIVE_INFINITY;
            for (int i = 1; i <= 100; i++) {
                double xi = SegmentDensity.strong(i * rs / 100.0, rs, phi, xiMax);
                if (xi < previous) {
                    return Evaluation.of(false, "fell at r/r_s=" + i / 100.0);
                }
                previous = xi;
            }
            return Evaluation.of(true, "100 samples");
        });

        double rs10Km = Schwarzschild.radiusForSolarMasses(10.0, config.constants()) / 1000.0;
        CelestialObject repeated = CelestialObject.observed("BH10-repeat", 10.0, 3.0 * rs10Km, 1e4, 0.227);
        recorder.verify("stability.winner_determinism", "identical over " + REPEATS + " calls", "exact", () -> {
            Winner first = context.calculator().calculate(repeated, config).winner();
            for (int i = 1; i < REPEATS; i++) {
                Winner next = context.calculator().calculate(repeated, config).winner();
                if (next != first) {
                    return Evaluation.of(false, first + " then " + next);
                }
            }
            return Evaluation.of(first != null, String.valueOf(first));
        });
    }
}
