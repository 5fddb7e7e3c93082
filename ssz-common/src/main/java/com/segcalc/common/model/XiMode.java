package com.segcalc.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Selects the segment-density formula.
 *
 * <ul>
 *   <li>{@link #AUTO}: blended formula (strong below the blend zone, weak above it)</li>
 *   <li>{@link #WEAK}: Ξ = r_s / (2r) everywhere</li>
 *   <li>{@link #STRONG}: Ξ = ξ_max·(1 − e^(−φ·r/r_s)) everywhere</li>
 * </ul>
 */
public enum XiMode {
    AUTO("auto"),
    WEAK("weak"),
    STRONG("strong");

    private final String label;

    XiMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Parses a configuration label. Unknown labels are rejected instead of
     * falling through to a default.
     */
    @JsonCreator
    public static XiMode fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (XiMode mode : values()) {
                if (mode.label.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown Xi mode: '" + label + "' (expected auto, weak or strong)");
    }
}
