package com.segcalc.common.classifier;

import com.segcalc.common.config.ModelParameters;
import com.segcalc.common.model.Regime;

/**
 * Pure stateless classifier that maps a normalized radius x = r / r_s to a
 * {@link Regime}.
 *
 * <p>Rules (canonical boundaries; each interval is closed on its upper side):
 * <ol>
 *   <li>x &lt; 1.8        → {@link Regime#VERY_CLOSE}</li>
 *   <li>1.8 ≤ x ≤ 2.2  → {@link Regime#BLENDED}</li>
 *   <li>2.2 &lt; x ≤ 3.0  → {@link Regime#PHOTON_SPHERE}</li>
 *   <li>3.0 &lt; x ≤ 10.0 → {@link Regime#STRONG}</li>
 *   <li>x &gt; 10.0       → {@link Regime#WEAK}</li>
 * </ol>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class RegimeClassifier {

    private RegimeClassifier() {}

    public static Regime classify(double x) {
        return classify(x, ModelParameters.CANONICAL);
    }

    /**
     * @param x normalized radius; NaN or +∞ (massless source) classify as weak
     */
    public static Regime classify(double x, ModelParameters params) {
        if (Double.isNaN(x) || Double.isInfinite(x)) {
            return Regime.WEAK;
        }
        if (x < params.blendLow()) {
            return Regime.VERY_CLOSE;
        }
        if (x <= params.blendHigh()) {
            return Regime.BLENDED;
        }
        if (x <= params.photonSphereMax()) {
            return Regime.PHOTON_SPHERE;
        }
        if (x <= params.weakStart()) {
            return Regime.STRONG;
        }
        return Regime.WEAK;
    }

    /**
     * Classify a physical radius. A non-positive r_s means an undefined or
     * massless source and is treated as weak.
     */
    public static Regime classify(double r, double rs, ModelParameters params) {
        if (!(rs > 0.0)) {
            return Regime.WEAK;
        }
        return classify(r / rs, params);
    }
}
