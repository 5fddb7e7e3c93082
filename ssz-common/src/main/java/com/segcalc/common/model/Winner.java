package com.segcalc.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which model's prediction lies closer to the observed redshift.
 * Decided only by {@link com.segcalc.common.comparison.WinnerPolicy}.
 */
public enum Winner {
    SSZ,
    GR,
    TIE;

    @JsonValue
    public String label() {
        return name();
    }

    /**
     * Parses a winner label. Older reference files call the SSZ model "SEG";
     * that spelling is accepted as an alias.
     */
    @JsonCreator
    public static Winner fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Winner label must not be null");
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "SSZ", "SEG" -> SSZ;
            case "GR"         -> GR;
            case "TIE"        -> TIE;
            default -> throw new IllegalArgumentException("Unknown winner label: '" + label + "'");
        };
    }
}
