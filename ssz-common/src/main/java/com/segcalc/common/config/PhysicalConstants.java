package com.segcalc.common.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Physical constants frozen for one run (SI units).
 *
 * <p>Values default to CODATA 2018 via {@link #CODATA_2018}. Instances are immutable;
 * a different set of constants means a different {@link RunConfig}.
 */
public record PhysicalConstants(
    @JsonProperty("G")     double gravitationalConstant,   // m^3 / (kg s^2)
    @JsonProperty("c")     double speedOfLight,            // m / s
    @JsonProperty("M_sun") double solarMass,               // kg
    @JsonProperty("phi")   double phi                      // golden ratio
) {

    public static final double GOLDEN_RATIO = (1.0 + Math.sqrt(5.0)) / 2.0;

    public static final PhysicalConstants CODATA_2018 = new PhysicalConstants(
        6.67430e-11,
        299_792_458.0,
        1.98847e30,
        GOLDEN_RATIO
    );

    public PhysicalConstants {
        requirePositive("G", gravitationalConstant);
        requirePositive("c", speedOfLight);
        requirePositive("M_sun", solarMass);
        requirePositive("phi", phi);
    }

    /** c² in m²/s². */
    public double speedOfLightSquared() {
        return speedOfLight * speedOfLight;
    }

    /** Speed of light in km/s, the unit used by input records. */
    public double speedOfLightKms() {
        return speedOfLight / 1000.0;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive finite number, got " + value);
        }
    }
}
