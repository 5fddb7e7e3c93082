package com.segcalc.common.physics;

import com.segcalc.common.config.PhysicalConstants;

/**
 * Parametrized post-Newtonian observables for light and orbits in the solar system.
 *
 * <p>These need the spatial part of the metric as well as g_tt, so they are not
 * derived from Ξ. In the weak field SSZ coincides with GR, hence γ = β = 1.
 * <pre>
 *   deflection   α  = (1+γ)·r_s / b
 *   Shapiro      Δt = (1+γ)·(r_s/c)·ln(4·r1·r2 / b²)        (grazing incidence)
 *   perihelion   Δφ = 6π·GM / (c²·a·(1−e²)) · (2+2γ−β)/3    per orbit
 * </pre>
 *
 * <p>No logging. No side-effects.
 */
public final class Ppn {

    public static final double GAMMA = 1.0;
    public static final double BETA = 1.0;

    public static final double ARCSEC_PER_RADIAN = 180.0 * 3600.0 / Math.PI;
    public static final double ASTRONOMICAL_UNIT = 1.495978707e11;   // m

    private Ppn() {}

    /** Deflection angle in radians for impact parameter {@code b} (m); +∞ for b ≤ 0. */
    public static double lightDeflection(double massKg, double b, double gamma, PhysicalConstants constants) {
        if (!(b > 0.0)) {
            return Double.POSITIVE_INFINITY;
        }
        return (1.0 + gamma) * Schwarzschild.radius(massKg, constants) / b;
    }

    public static double lightDeflectionArcsec(double massKg, double b, PhysicalConstants constants) {
        return lightDeflection(massKg, b, GAMMA, constants) * ARCSEC_PER_RADIAN;
    }

    /**
     * One-way Shapiro delay in seconds for a signal between distances {@code r1} and
     * {@code r2} (m) from the mass, passing at impact parameter {@code b}.
     *
     * @return +∞ for b ≤ 0, NaN for non-positive distances
     */
    public static double shapiroDelay(double massKg, double r1, double r2, double b, double gamma,
                                      PhysicalConstants constants) {
        if (!(b > 0.0)) {
            return Double.POSITIVE_INFINITY;
        }
        if (!(r1 > 0.0) || !(r2 > 0.0)) {
            return Double.NaN;
        }
        double rs = Schwarzschild.radius(massKg, constants);
        return (1.0 + gamma) * (rs / constants.speedOfLight()) * Math.log(4.0 * r1 * r2 / (b * b));
    }

    /**
     * γ recovered from a measured one-way delay over the same geometry; the inverse of
     * {@link #shapiroDelay}.
     */
    public static double gammaFromShapiroDelay(double delay, double massKg, double r1, double r2, double b,
                                               PhysicalConstants constants) {
        double unitDelay = shapiroDelay(massKg, r1, r2, b, 0.0, constants);
        return delay / unitDelay - 1.0;
    }

    /** Perihelion advance per orbit in radians; NaN for a ≤ 0 or e outside [0, 1). */
    public static double perihelionPrecession(double massKg, double semiMajorAxis, double eccentricity,
                                              double gamma, double beta, PhysicalConstants constants) {
        if (!(semiMajorAxis > 0.0) || !(eccentricity >= 0.0 && eccentricity < 1.0)) {
            return Double.NaN;
        }
        double perOrbit = 6.0 * Math.PI * constants.gravitationalConstant() * massKg
                        / (constants.speedOfLightSquared() * semiMajorAxis * (1.0 - eccentricity * eccentricity));
        return perOrbit * (2.0 + 2.0 * gamma - beta) / 3.0;
    }

    /** Perihelion advance in arcseconds per century for an orbit of {@code periodYears}. */
    public static double perihelionPrecessionArcsecPerCentury(double massKg, double semiMajorAxis,
                                                              double eccentricity, double periodYears,
                                                              PhysicalConstants constants) {
        if (!(periodYears > 0.0)) {
            return Double.NaN;
        }
        double perOrbit = perihelionPrecession(massKg, semiMajorAxis, eccentricity, GAMMA, BETA, constants);
        return perOrbit * ARCSEC_PER_RADIAN * (100.0 / periodYears);
    }
}
