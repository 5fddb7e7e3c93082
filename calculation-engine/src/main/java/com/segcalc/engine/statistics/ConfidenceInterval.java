package com.segcalc.engine.statistics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Percentile bootstrap interval around a point estimate.
 */
public record ConfidenceInterval(
    @JsonProperty("estimate") double estimate,
    @JsonProperty("lower")    double lower,
    @JsonProperty("upper")    double upper,
    @JsonProperty("level")    double level,
    @JsonProperty("rounds")   int rounds,
    @JsonProperty("seed")     long seed
) {

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    public double width() {
        return upper - lower;
    }
}
