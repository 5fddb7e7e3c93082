package com.segcalc.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The observation-dependent part of a result. Either the whole group is
 * present on a {@link CalculationResult} or none of it is.
 *
 * <p>Residuals are signed: {@code prediction − observation}.
 */
public record ObservationComparison(
    @JsonProperty("z_obs")        double observedRedshift,
    @JsonProperty("residual_ssz") double residualSsz,
    @JsonProperty("residual_gr")  double residualGr,
    @JsonProperty("winner")       Winner winner
) {

    public double absResidualSsz() {
        return Math.abs(residualSsz);
    }

    public double absResidualGr() {
        return Math.abs(residualGr);
    }
}
