package com.segcalc.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Zone of normalized radius x = r / r_s, ordered from the source outwards.
 * Boundaries are owned by {@link com.segcalc.common.classifier.RegimeClassifier}.
 */
public enum Regime {
    VERY_CLOSE("very_close"),
    BLENDED("blended"),
    PHOTON_SPHERE("photon_sphere"),
    STRONG("strong"),
    WEAK("weak");

    private final String label;

    Regime(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** The Δ(M) correction and the geometric hint are switched off in the weak field. */
    public boolean allowsMassCorrection() {
        return this != WEAK;
    }

    public static Regime fromLabel(String label) {
        for (Regime regime : values()) {
            if (regime.label.equalsIgnoreCase(label == null ? "" : label.trim())) {
                return regime;
            }
        }
        throw new IllegalArgumentException("Unknown regime: '" + label + "'");
    }
}
