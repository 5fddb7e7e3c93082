package com.segcalc.common.physics;

/**
 * Escape velocity and its dual "fall" velocity. Their product is c² at every radius.
 *
 * <pre>
 *   v_esc  = c·√(r_s / r)
 *   v_fall = c² / v_esc
 * </pre>
 */
public final class DualVelocity {

    private DualVelocity() {}

    public static double escape(double r, double rs, double c) {
        if (!(rs > 0.0) || !(r > 0.0)) {
            throw new IllegalArgumentException("radii must be positive: r=" + r + ", r_s=" + rs);
        }
        return c * Math.sqrt(rs / r);
    }

    public static double fall(double r, double rs, double c) {
        return c * c / escape(r, rs, c);
    }

    /** v_esc·v_fall / c² − 1; zero up to rounding. */
    public static double productDeviation(double r, double rs, double c) {
        return escape(r, rs, c) * fall(r, rs, c) / (c * c) - 1.0;
    }
}
