package com.segcalc.common.physics;

import com.segcalc.common.config.ModelParameters;
import com.segcalc.common.model.Regime;

/**
 * Mass-dependent correction Δ(M), in percent.
 *
 * <pre>
 *   raw(M)  = A·e^(−α·r_s) + B
 *   norm(M) = clamp((log10 M − lmin) / (lmax − lmin), 0, 1)      M in kg
 *   Δ(M)    = raw(M) · norm(M)
 * </pre>
 *
 * The correction is exactly zero in the {@link Regime#WEAK} regime.
 *
 * <p>No logging. No side-effects.
 */
public final class MassCorrection {

    private MassCorrection() {}

    /** Δ(M) with the weak-field gate applied. */
    public static double percent(Regime regime, double massKg, double rs, ModelParameters params) {
        if (!regime.allowsMassCorrection()) {
            return 0.0;
        }
        return ungated(massKg, rs, params);
    }

    /** Δ(M) ignoring the regime. Used by checks on the formula itself. */
    public static double ungated(double massKg, double rs, ModelParameters params) {
        if (!(massKg > 0.0)) {
            return 0.0;
        }
        return raw(rs, params) * normalization(massKg, params);
    }

    /** A·e^(−α·r_s) + B, before log-mass normalization. */
    public static double raw(double rs, ModelParameters params) {
        return params.deltaA() * Math.exp(-params.deltaAlpha() * rs) + params.deltaB();
    }

    public static double normalization(double massKg, ModelParameters params) {
        double range = params.logMassMax() - params.logMassMin();
        if (range <= 0.0) {
            return 1.0;
        }
        double norm = (Math.log10(massKg) - params.logMassMin()) / range;
        return Math.min(1.0, Math.max(0.0, norm));
    }

    /** z · (1 + Δ/100). */
    public static double apply(double z, double percent) {
        return z * (1.0 + percent / 100.0);
    }
}
