package com.segcalc.common.physics;

import com.segcalc.common.classifier.RegimeClassifier;
import com.segcalc.common.config.RunConfig;
import com.segcalc.common.model.Regime;

import java.util.Arrays;

/**
 * Ξ, D_SSZ, D_GR and regime sampled over a log-spaced range of normalized radii.
 * Arrays are parallel: index i of each array belongs to {@code x[i]}.
 * Accessors return copies.
 */
public final class RadialSweep {

    private final double rs;
    private final double[] x;
    private final double[] xi;
    private final double[] dilationSsz;
    private final double[] dilationGr;
    private final Regime[] regimes;

    private RadialSweep(double rs, double[] x, double[] xi, double[] dilationSsz,
                        double[] dilationGr, Regime[] regimes) {
        this.rs = rs;
        this.x = x;
        this.xi = xi;
        this.dilationSsz = dilationSsz;
        this.dilationGr = dilationGr;
        this.regimes = regimes;
    }

    /**
     * Samples {@code points} values of x = r/r_s, evenly spaced in log10 between
     * {@code xMin} and {@code xMax} inclusive.
     */
    public static RadialSweep logSpaced(double rs, double xMin, double xMax, int points, RunConfig config) {
        if (!(rs > 0.0)) {
            throw new IllegalArgumentException("Schwarzschild radius must be positive, got " + rs);
        }
        if (!(xMin > 0.0) || !(xMax > xMin)) {
            throw new IllegalArgumentException("invalid sweep range [" + xMin + ", " + xMax + "]");
        }
        if (points < 2) {
            throw new IllegalArgumentException("sweep needs at least 2 points, got " + points);
        }

        double logMin = Math.log10(xMin);
        double step = (Math.log10(xMax) - logMin) / (points - 1);

        double[] x = new double[points];
        double[] xi = new double[points];
        double[] dSsz = new double[points];
        double[] dGr = new double[points];
        Regime[] regimes = new Regime[points];

        for (int i = 0; i < points; i++) {
            x[i] = i == points - 1 ? xMax : Math.pow(10.0, logMin + i * step);
            double r = x[i] * rs;
            xi[i] = SegmentDensity.evaluate(r, rs, config);
            dSsz[i] = TimeDilation.ssz(xi[i]);
            dGr[i] = TimeDilation.gr(r, rs);
            regimes[i] = RegimeClassifier.classify(x[i], config.parameters());
        }
        return new RadialSweep(rs, x, xi, dSsz, dGr, regimes);
    }

    public int size() {
        return x.length;
    }

    public double schwarzschildRadius() {
        return rs;
    }

    public double radiusAt(int i) {
        return x[i] * rs;
    }

    public double[] normalizedRadii() {
        return Arrays.copyOf(x, x.length);
    }

    public double[] segmentDensities() {
        return Arrays.copyOf(xi, xi.length);
    }

    public double[] dilationsSsz() {
        return Arrays.copyOf(dilationSsz, dilationSsz.length);
    }

    public double[] dilationsGr() {
        return Arrays.copyOf(dilationGr, dilationGr.length);
    }

    public Regime[] regimes() {
        return Arrays.copyOf(regimes, regimes.length);
    }

    /** Largest |D_SSZ·(1 + Ξ) − 1| across the sweep. */
    public double maxIdentityError() {
        double worst = 0.0;
        for (int i = 0; i < x.length; i++) {
            worst = Math.max(worst, Math.abs(dilationSsz[i] * (1.0 + xi[i]) - 1.0));
        }
        return worst;
    }
}
