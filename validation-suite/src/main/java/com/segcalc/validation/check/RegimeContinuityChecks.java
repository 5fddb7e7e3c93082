package com.segcalc.validation.check;

import com.segcalc.common.classifier.RegimeClassifier;
import com.segcalc.common.config.ModelParameters;
import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.Regime;
import com.segcalc.common.physics.SegmentDensity;
import com.segcalc.validation.model.ValidationCategory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Classifier boundaries and smoothness of the blended Ξ at the blend-zone edges.
 * Works in normalized units (r_s = 1). C² is only required to stay bounded.
 */
@Component
@Order(4)
public class RegimeContinuityChecks implements ValidationCheckGroup {

    private static final double C0_STEP = 1e-9;
    private static final double C0_TOLERANCE = 1e-6;
    private static final double C1_RELATIVE_STEP = 1e-6;
    private static final double C1_TOLERANCE = 1e-4;
    private static final double C2_STEP = 1e-3;
    private static final double C2_BOUND = 10.0;

    @Override
    public ValidationCategory category() {
        return ValidationCategory.REGIME_CONTINUITY;
    }

    @Override
    public void run(ValidationContext context, CheckRecorder recorder) {
        RunConfig config = context.config();
        ModelParameters params = config.parameters();
        double phi = config.constants().phi();
        DoubleUnaryOperator xi = x -> SegmentDensity.blended(x, 1.0, phi, params);

        Map<Double, Regime> boundaries = new LinkedHashMap<>();
        boundaries.put(1.8, Regime.BLENDED);
        boundaries.put(1.79, Regime.VERY_CLOSE);
        boundaries.put(2.2, Regime.BLENDED);
        boundaries.put(2.21, Regime.PHOTON_SPHERE);
        boundaries.put(10.0, Regime.STRONG);
        boundaries.put(10.01, Regime.WEAK);
        boundaries.forEach((x, expected) -> recorder.equal(
            "regime.boundary." + x, expected, () -> RegimeClassifier.classify(x, params)));

        Map<String, Double> edges = new LinkedHashMap<>();
        edges.put("low", params.blendLow());
        edges.put("high", params.blendHigh());

        edges.forEach((name, edge) -> {
            recorder.absolute("regime.c0." + name, 0.0, C0_TOLERANCE,
                () -> xi.applyAsDouble(edge + C0_STEP) - xi.applyAsDouble(edge - C0_STEP));

            recorder.absolute("regime.c1." + name, 0.0, C1_TOLERANCE, () -> {
                double h = C1_RELATIVE_STEP * edge;
                double f0 = xi.applyAsDouble(edge);
                double left = (f0 - xi.applyAsDouble(edge - h)) / h;
                double right = (xi.applyAsDouble(edge + h) - f0) / h;
                return Math.abs(left - right) / Math.max(Math.abs(left), 1e-12);
            });

            recorder.verify("regime.c2." + name, "|Ξ''| < " + C2_BOUND, "bounded", () -> {
                double h = C2_STEP;
                double second = (xi.applyAsDouble(edge + h) - 2.0 * xi.applyAsDouble(edge)
                               + xi.applyAsDouble(edge - h)) / (h * h);
                return Evaluation.of(Double.isFinite(second) && Math.abs(second) < C2_BOUND,
                    CheckRecorder.format(second));
            });
        });

        recorder.verify("regime.blend_envelope", "min(Ξs, Ξw) ≤ Ξ ≤ max(Ξs, Ξw)", "1e-15", () -> {
            int steps = 40;
            for (int i = 0; i <= steps; i++) {
                double x = params.blendLow() + i * params.blendWidth() / steps;
                double s = SegmentDensity.strong(x, 1.0, phi, params.xiMax());
                double w = SegmentDensity.weak(x, 1.0);
                double f = xi.applyAsDouble(x);
                if (f < Math.min(s, w) - 1e-15 || f > Math.max(s, w) + 1e-15) {
                    return Evaluation.of(false, String.format(Locale.ROOT, "x=%.3f Ξ=%.9f", x, f));
                }
            }
            return Evaluation.of(true, (steps + 1) + " samples");
        });
    }
}
