package com.segcalc.common.physics;

import com.segcalc.common.config.RunConfig;

/**
 * Clock-rate factors relative to a distant observer.
 *
 * <p>D_SSZ = 1 / (1 + Ξ) is finite and strictly positive for every r &gt; 0.
 * D_GR = √(1 − r_s/r) vanishes at and inside the horizon.
 *
 * <p>No logging. No side-effects.
 */
public final class TimeDilation {

    private TimeDilation() {}

    public static double ssz(double xi) {
        if (!(xi >= 0.0)) {
            throw new IllegalArgumentException("segment density must be >= 0, got " + xi);
        }
        return 1.0 / (1.0 + xi);
    }

    public static double ssz(double r, double rs, RunConfig config) {
        return ssz(SegmentDensity.evaluate(r, rs, config));
    }

    /** GR dilation; the ratio r_s/r is clamped to [0, 1] so rounding never yields a negative radicand. */
    public static double gr(double r, double rs) {
        if (!(rs > 0.0)) {
            throw new IllegalArgumentException("Schwarzschild radius must be positive, got " + rs);
        }
        if (!(r > rs)) {
            return 0.0;
        }
        double ratio = Math.min(1.0, Math.max(0.0, rs / r));
        return Math.sqrt(1.0 - ratio);
    }

    /** D_SSZ − D_GR. */
    public static double difference(double dSsz, double dGr) {
        return dSsz - dGr;
    }

    /** 100·(D_SSZ − D_GR)/D_GR; NaN when D_GR is zero. */
    public static double differencePercent(double dSsz, double dGr) {
        if (dGr == 0.0) {
            return Double.NaN;
        }
        return 100.0 * (dSsz - dGr) / dGr;
    }

    /**
     * D_SSZ (strong form) at the universal intersection r* where it meets D_GR.
     * Independent of mass; ≈ 0.528 with canonical parameters.
     */
    public static double atIntersection(RunConfig config) {
        double x = config.parameters().intersectionROverRs();
        double xi = SegmentDensity.strong(x, 1.0, config.constants().phi(), config.parameters().xiMax());
        return ssz(xi);
    }

    /** D_GR at the universal intersection, for cross-checking {@link #atIntersection}. */
    public static double grAtIntersection(RunConfig config) {
        return gr(config.parameters().intersectionROverRs(), 1.0);
    }
}
