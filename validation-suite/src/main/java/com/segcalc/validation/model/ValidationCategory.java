package com.segcalc.validation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Check groups, in execution order.
 */
public enum ValidationCategory {
    CORE_FORMULA("Core formulas"),
    PHYSICAL_LIMIT("Physical limits"),
    NUMERICAL_STABILITY("Numerical stability"),
    REGIME_CONTINUITY("Regime continuity"),
    EXPERIMENTAL("Experimental cross-checks"),
    GOLDEN_REGRESSION("Golden dataset regression");

    private final String title;

    ValidationCategory(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
