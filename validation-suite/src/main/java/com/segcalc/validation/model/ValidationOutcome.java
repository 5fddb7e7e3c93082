package com.segcalc.validation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of one check. {@code expected} and {@code computed} are display strings
 * so that boolean, label and numeric checks share one record.
 */
public record ValidationOutcome(
    @JsonProperty("test_id")   String testId,
    @JsonProperty("category")  ValidationCategory category,
    @JsonProperty("status")    ValidationStatus status,
    @JsonProperty("expected")  String expected,
    @JsonProperty("computed")  String computed,
    @JsonProperty("tolerance") String tolerance,
    @JsonProperty("diagnosis") String diagnosis
) {

    public boolean passed() {
        return status == ValidationStatus.PASS;
    }
}
