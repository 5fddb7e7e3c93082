package com.segcalc.common.physics;

import com.segcalc.common.config.ModelParameters;
import com.segcalc.common.config.PhysicalConstants;
import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.Regime;
import com.segcalc.common.model.RedshiftMode;

/**
 * Gravitational, Doppler and combined redshifts for GR and SSZ.
 *
 * <pre>
 *   z_gr       = 1/√(1 − r_s/r) − 1                 (NaN for r ≤ r_s)
 *   z_doppler  = γ·(1 + β_los) − 1
 *   z_combined = (1 + z_a)(1 + z_b) − 1
 *   z_ssz_grav = z_gr·(1 + Δ(M)/100)                 DELTA_M
 *              = 1/√(1 − β·φ/2) − 1,  β = 2GM_eff/(rc²)   GEOMETRIC_HINT
 *              = z_gr                                GR_BASELINE and always in the weak field
 * </pre>
 *
 * <p>Degenerate geometry yields NaN (or +∞ for a non-positive geometric factor)
 * instead of an exception so a batch can carry on with its other rows.
 * No logging. No side-effects.
 */
public final class RedshiftCalculator {

    private RedshiftCalculator() {}

    // ── gravitational ─────────────────────────────────────────────────────

    public static double gravitational(double r, double rs) {
        if (!(rs > 0.0) || !(r > 0.0) || r <= rs) {
            return Double.NaN;
        }
        return 1.0 / Math.sqrt(1.0 - rs / r) - 1.0;
    }

    public static double gravitational(double massKg, double r, PhysicalConstants constants) {
        return gravitational(r, Schwarzschild.radius(massKg, constants));
    }

    /** z = 1/D − 1, NaN for D ≤ 0. Works for any dilation factor. */
    public static double fromDilation(double dilation) {
        if (!(dilation > 0.0)) {
            return Double.NaN;
        }
        return 1.0 / dilation - 1.0;
    }

    // ── kinematic ─────────────────────────────────────────────────────────

    /**
     * Special-relativistic Doppler redshift.
     *
     * @param speed            total speed, same unit as {@code c}; 0 or NaN means at rest
     * @param lineOfSightSpeed component along the line of sight; NaN means 0
     * @throws IllegalArgumentException if either speed reaches c
     */
    public static double doppler(double speed, double lineOfSightSpeed, double c) {
        if (Double.isNaN(speed) || speed == 0.0) {
            return 0.0;
        }
        double beta = Math.abs(speed) / c;
        double betaLos = Double.isNaN(lineOfSightSpeed) ? 0.0 : lineOfSightSpeed / c;
        if (beta >= 1.0 || Math.abs(betaLos) >= 1.0) {
            throw new IllegalArgumentException("speed must be below c, got beta=" + beta);
        }
        double gamma = 1.0 / Math.sqrt(1.0 - beta * beta);
        return gamma * (1.0 + betaLos) - 1.0;
    }

    /** Transverse Doppler only (no line-of-sight component). */
    public static double doppler(double speed, double c) {
        return doppler(speed, 0.0, c);
    }

    /** (1 + z_a)(1 + z_b) − 1. A NaN component counts as zero. */
    public static double combined(double zA, double zB) {
        double a = Double.isNaN(zA) ? 0.0 : zA;
        double b = Double.isNaN(zB) ? 0.0 : zB;
        return (1.0 + a) * (1.0 + b) - 1.0;
    }

    /** Null-tolerant variant for optional components. */
    public static double combined(Double zA, Double zB) {
        return combined(zA == null ? 0.0 : zA.doubleValue(), zB == null ? 0.0 : zB.doubleValue());
    }

    // ── SSZ ───────────────────────────────────────────────────────────────

    /**
     * Geometric-hint redshift for orbiting sources. The mass is inflated by the
     * raw Δ(M) before forming β = 2GM_eff/(rc²).
     *
     * @return +∞ when 1 − β·φ/2 ≤ 0
     */
    public static double geometricHint(double massKg, double r, PhysicalConstants constants,
                                       ModelParameters params) {
        if (!(massKg > 0.0) || !(r > 0.0)) {
            return Double.NaN;
        }
        double rs = Schwarzschild.radius(massKg, constants);
        double effectiveMass = massKg * (1.0 + MassCorrection.raw(rs, params) / 100.0);
        double beta = 2.0 * constants.gravitationalConstant() * effectiveMass
                    / (r * constants.speedOfLightSquared());
        double factor = 1.0 - beta * constants.phi() / 2.0;
        if (factor <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return 1.0 / Math.sqrt(factor) - 1.0;
    }

    /**
     * Every redshift component of a body at radius {@code r} moving at {@code speed} (m/s).
     * The weak-field regime always reproduces GR exactly, whatever the mode.
     */
    public static RedshiftBreakdown breakdown(double massKg, double r, double speed, Regime regime,
                                              RunConfig config) {
        PhysicalConstants constants = config.constants();
        double rs = Schwarzschild.radius(massKg, constants);
        double zGr = gravitational(r, rs);
        double zDoppler = doppler(speed, 0.0, constants.speedOfLight());

        RedshiftMode mode = config.redshiftMode();
        double correction = 0.0;
        double zSszGrav;
        if (!regime.allowsMassCorrection() || mode == RedshiftMode.GR_BASELINE) {
            zSszGrav = zGr;
        } else if (mode == RedshiftMode.GEOMETRIC_HINT) {
            correction = MassCorrection.percent(regime, massKg, rs, config.parameters());
            zSszGrav = geometricHint(massKg, r, constants, config.parameters());
        } else {
            correction = MassCorrection.percent(regime, massKg, rs, config.parameters());
            zSszGrav = MassCorrection.apply(zGr, correction);
        }

        // a degenerate gravitational term must not read as "absent" in the totals
        double zGrSr = Double.isNaN(zGr) ? Double.NaN : combined(zGr, zDoppler);
        double zSszTotal = Double.isNaN(zSszGrav) ? Double.NaN : combined(zSszGrav, zDoppler);

        return new RedshiftBreakdown(zGr, zDoppler, zGrSr, zSszGrav, zSszTotal, correction, mode);
    }
}
