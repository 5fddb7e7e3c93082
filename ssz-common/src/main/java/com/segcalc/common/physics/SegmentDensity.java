package com.segcalc.common.physics;

import com.segcalc.common.config.ModelParameters;
import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.XiMode;

/**
 * Segment density Ξ(r) in its weak, strong and blended forms.
 *
 * <pre>
 *   Ξ_weak   = r_s / (2r)
 *   Ξ_strong = ξ_max · (1 − e^(−φ·r/r_s))
 *   Ξ_blend  = (1 − h(t))·Ξ_strong + h(t)·Ξ_weak,  h(t) = 6t⁵ − 15t⁴ + 10t³
 *              t = (x − x_low) / (x_high − x_low),  x = r / r_s
 * </pre>
 *
 * Below the blend zone the strong form applies, above it the weak form.
 * The blend is continuous in value and in first derivative at both edges; the
 * second derivative is bounded there but not matched.
 *
 * <p>r_s ≤ 0 and r ≤ 0 are rejected with {@link IllegalArgumentException}.
 * No logging. No side-effects.
 */
public final class SegmentDensity {

    private SegmentDensity() {}

    public static double weak(double r, double rs) {
        requireGeometry(r, rs);
        return rs / (2.0 * r);
    }

    public static double strong(double r, double rs, double phi, double xiMax) {
        requireGeometry(r, rs);
        return xiMax * (1.0 - Math.exp(-phi * r / rs));
    }

    /** dΞ_strong/dr = ξ_max · (φ / r_s) · e^(−φ·r/r_s), in 1/m. */
    public static double strongDerivative(double r, double rs, double phi, double xiMax) {
        requireGeometry(r, rs);
        return xiMax * (phi / rs) * Math.exp(-phi * r / rs);
    }

    public static double blended(double r, double rs, double phi, ModelParameters params) {
        requireGeometry(r, rs);
        double x = r / rs;
        if (x <= params.blendLow()) {
            return strong(r, rs, phi, params.xiMax());
        }
        if (x >= params.blendHigh()) {
            return weak(r, rs);
        }
        double h = blendWeight((x - params.blendLow()) / params.blendWidth());
        return (1.0 - h) * strong(r, rs, phi, params.xiMax()) + h * weak(r, rs);
    }

    /** {@link XiMode#AUTO} resolves to the blended form. */
    public static double forMode(XiMode mode, double r, double rs, RunConfig config) {
        double phi = config.constants().phi();
        ModelParameters params = config.parameters();
        return switch (mode) {
            case AUTO   -> blended(r, rs, phi, params);
            case WEAK   -> weak(r, rs);
            case STRONG -> strong(r, rs, phi, params.xiMax());
        };
    }

    /** Ξ with the run's own mode. */
    public static double evaluate(double r, double rs, RunConfig config) {
        return forMode(config.xiMode(), r, rs, config);
    }

    /** Quintic smoothstep h(t), clamped to [0, 1] outside the unit interval. */
    public static double blendWeight(double t) {
        if (t <= 0.0) {
            return 0.0;
        }
        if (t >= 1.0) {
            return 1.0;
        }
        return t * t * t * (t * (6.0 * t - 15.0) + 10.0);
    }

    private static void requireGeometry(double r, double rs) {
        if (!(rs > 0.0)) {
            throw new IllegalArgumentException("Schwarzschild radius must be positive, got " + rs);
        }
        if (!(r > 0.0)) {
            throw new IllegalArgumentException("radius must be positive, got " + r);
        }
    }
}
