package com.segcalc.common.physics;

import com.segcalc.common.config.ModelParameters;

/**
 * Empirical energy scaling with compactness.
 *
 * <pre>
 *   compactness = r_s / R
 *   E_norm      = 1 + α·(r_s / R)^β       α = 0.3187, β = 0.9821 (canonical)
 * </pre>
 */
public final class PowerLaw {

    private PowerLaw() {}

    public static double compactness(double rs, double radius) {
        if (!(radius > 0.0)) {
            throw new IllegalArgumentException("radius must be positive, got " + radius);
        }
        return Math.max(0.0, rs) / radius;
    }

    public static double energyNormalized(double rs, double radius, ModelParameters params) {
        return 1.0 + params.powerLawAlpha() * Math.pow(compactness(rs, radius), params.powerLawBeta());
    }

    /** (E_norm − 1)·100. */
    public static double energyExcessPercent(double rs, double radius, ModelParameters params) {
        return (energyNormalized(rs, radius, params) - 1.0) * 100.0;
    }
}
