package com.segcalc.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the SSZ gravitational redshift is derived from the GR baseline.
 *
 * <ul>
 *   <li>{@link #DELTA_M}: z_GR · (1 + Δ(M)/100); fixed-radius surfaces (default)</li>
 *   <li>{@link #GEOMETRIC_HINT}: (1 − β·φ/2)^(−½) − 1 with Δ(M)-inflated mass; orbiting sources</li>
 *   <li>{@link #GR_BASELINE}: no correction, SSZ gravitational redshift equals z_GR</li>
 * </ul>
 *
 * <p>All modes fall back to z_GR in the weak regime.
 */
public enum RedshiftMode {
    DELTA_M("delta_m"),
    GEOMETRIC_HINT("geometric_hint"),
    GR_BASELINE("gr_baseline");

    private final String label;

    RedshiftMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static RedshiftMode fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (RedshiftMode mode : values()) {
                if (mode.label.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException(
            "Unknown redshift mode: '" + label + "' (expected delta_m, geometric_hint or gr_baseline)");
    }
}
