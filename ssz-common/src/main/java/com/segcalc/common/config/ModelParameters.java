package com.segcalc.common.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * SSZ model parameters for one run.
 *
 * <p>Regime boundaries are expressed in units of the Schwarzschild radius (x = r / r_s):
 * <pre>
 *   x &lt; blendLow                    → very_close (strong formula)
 *   blendLow ≤ x ≤ blendHigh         → blended    (quintic blend of strong and weak)
 *   blendHigh &lt; x ≤ photonSphereMax → photon_sphere
 *   photonSphereMax &lt; x ≤ weakStart → strong
 *   x &gt; weakStart                   → weak
 * </pre>
 *
 * <p>Δ(M) coefficients: {@code Δ(M) = (A·exp(−α·r_s) + B) · norm(log10 M)} in percent.
 */
public record ModelParameters(
    @JsonProperty("blend_low")              double blendLow,
    @JsonProperty("blend_high")             double blendHigh,
    @JsonProperty("photon_sphere_max")      double photonSphereMax,
    @JsonProperty("weak_start")             double weakStart,
    @JsonProperty("xi_max")                 double xiMax,
    @JsonProperty("delta_a")                double deltaA,
    @JsonProperty("delta_alpha")            double deltaAlpha,
    @JsonProperty("delta_b")                double deltaB,
    @JsonProperty("log_mass_min")           double logMassMin,
    @JsonProperty("log_mass_max")           double logMassMax,
    @JsonProperty("power_law_alpha")        double powerLawAlpha,
    @JsonProperty("power_law_beta")         double powerLawBeta,
    @JsonProperty("intersection_r_over_rs") double intersectionROverRs
) {

    public static final ModelParameters CANONICAL = new ModelParameters(
        1.8,          // blend zone lower edge
        2.2,          // blend zone upper edge
        3.0,          // photon sphere upper edge
        10.0,         // weak field starts above this
        1.0,          // ξ_max
        98.01,        // A
        2.7177e4,     // α  [1/m]
        1.96,         // B
        10.0,         // log10(M/kg) lower normalization bound
        42.0,         // log10(M/kg) upper normalization bound
        0.3187,       // power-law amplitude
        0.9821,       // power-law exponent
        1.386562      // universal intersection r*/r_s
    );

    public ModelParameters {
        if (!(blendLow > 0.0 && blendLow < blendHigh
              && blendHigh < photonSphereMax && photonSphereMax < weakStart)) {
            throw new IllegalArgumentException(String.format(
                "regime boundaries must be strictly increasing and positive: %s < %s < %s < %s",
                blendLow, blendHigh, photonSphereMax, weakStart));
        }
        if (!(xiMax > 0.0)) {
            throw new IllegalArgumentException("xi_max must be positive, got " + xiMax);
        }
        if (logMassMax < logMassMin) {
            throw new IllegalArgumentException(String.format(
                "log-mass range is inverted: [%s, %s]", logMassMin, logMassMax));
        }
    }

    /** Width of the blend zone in units of r_s. */
    public double blendWidth() {
        return blendHigh - blendLow;
    }
}
