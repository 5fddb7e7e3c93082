package com.segcalc.common.physics;

import com.segcalc.common.config.PhysicalConstants;

/**
 * Schwarzschild radius r_s = 2GM/c² and the normalized radius x = r / r_s.
 *
 * <p>No logging. No side-effects.
 */
public final class Schwarzschild {

    private Schwarzschild() {}

    /**
     * @param massKg mass in kg; non-positive mass yields r_s = 0
     * @return r_s in metres
     */
    public static double radius(double massKg, PhysicalConstants constants) {
        if (!(massKg > 0.0)) {
            return 0.0;
        }
        return 2.0 * constants.gravitationalConstant() * massKg / constants.speedOfLightSquared();
    }

    public static double radiusForSolarMasses(double massMsun, PhysicalConstants constants) {
        return radius(massMsun * constants.solarMass(), constants);
    }

    /** x = r / r_s; +∞ for a massless source. */
    public static double normalizedRadius(double radiusMeters, double schwarzschildRadius) {
        if (!(schwarzschildRadius > 0.0)) {
            return Double.POSITIVE_INFINITY;
        }
        return radiusMeters / schwarzschildRadius;
    }
}
