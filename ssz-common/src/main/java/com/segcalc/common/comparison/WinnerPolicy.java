package com.segcalc.common.comparison;

import com.segcalc.common.model.ObservationComparison;
import com.segcalc.common.model.Winner;

/**
 * The single place where the SSZ/GR winner is decided.
 *
 * <pre>
 *   ε = 1e-12 · max(|res_SSZ|, |res_GR|, 1e-20)
 *   ||res_SSZ| − |res_GR|| ≤ ε  → TIE
 *   otherwise the smaller |residual| wins
 * </pre>
 *
 * A non-finite residual (NaN or ±∞) counts as missing: it always loses against a
 * finite one, and two missing residuals tie. The result depends only on the two
 * residuals.
 *
 * <p>No logging. No side-effects.
 */
public final class WinnerPolicy {

    public static final double RELATIVE_EPSILON = 1e-12;
    public static final double EPSILON_FLOOR = 1e-20;

    private WinnerPolicy() {}

    public static Winner decide(double residualSsz, double residualGr) {
        boolean sszMissing = !Double.isFinite(residualSsz);
        boolean grMissing = !Double.isFinite(residualGr);
        if (sszMissing && grMissing) {
            return Winner.TIE;
        }
        if (sszMissing) {
            return Winner.GR;
        }
        if (grMissing) {
            return Winner.SSZ;
        }

        double absSsz = Math.abs(residualSsz);
        double absGr = Math.abs(residualGr);
        double epsilon = RELATIVE_EPSILON * Math.max(Math.max(absSsz, absGr), EPSILON_FLOOR);
        if (Math.abs(absSsz - absGr) <= epsilon) {
            return Winner.TIE;
        }
        return absSsz < absGr ? Winner.SSZ : Winner.GR;
    }

    /**
     * Residuals of both predictions against {@code observed}, plus the winner.
     */
    public static ObservationComparison compare(double observed, double predictedSsz, double predictedGr) {
        double residualSsz = predictedSsz - observed;
        double residualGr = predictedGr - observed;
        return new ObservationComparison(observed, residualSsz, residualGr, decide(residualSsz, residualGr));
    }
}
