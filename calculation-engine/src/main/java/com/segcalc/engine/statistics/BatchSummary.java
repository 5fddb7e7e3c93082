package com.segcalc.engine.statistics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.segcalc.common.model.Regime;

import java.util.Map;

/**
 * Aggregate view of one batch of results.
 *
 * <p>Winner tallies, {@code observed} and the residual statistics cover OK rows
 * only; a {@code DEGENERATE_GEOMETRY} row counts towards {@code degenerate} and
 * nothing else. Residual statistics use finite residuals only.
 * {@code sszWinRate} is SSZ wins over observed rows, ties included in the
 * denominator. {@code medianAbsResidualSszCi} is null when the batch has no
 * observations or bootstrapping is disabled.
 */
public record BatchSummary(
    @JsonProperty("run_id")              String runId,
    @JsonProperty("total")               int total,
    @JsonProperty("ok")                  int ok,
    @JsonProperty("degenerate")          int degenerate,
    @JsonProperty("failed")              int failed,
    @JsonProperty("observed")            int observed,
    @JsonProperty("ssz_wins")            int sszWins,
    @JsonProperty("gr_wins")             int grWins,
    @JsonProperty("ties")                int ties,
    @JsonProperty("ssz_win_rate")        double sszWinRate,
    @JsonProperty("binomial_p_value")    double binomialPValue,
    @JsonProperty("mean_residual_ssz")   double meanResidualSsz,
    @JsonProperty("std_residual_ssz")    double stdResidualSsz,
    @JsonProperty("mae_ssz")             double maeSsz,
    @JsonProperty("mean_residual_gr")    double meanResidualGr,
    @JsonProperty("std_residual_gr")     double stdResidualGr,
    @JsonProperty("mae_gr")              double maeGr,
    @JsonProperty("regimes")             Map<Regime, RegimeStats> regimes,
    @JsonProperty("median_abs_residual_ssz_ci") ConfidenceInterval medianAbsResidualSszCi
) {

    public BatchSummary {
        regimes = regimes == null ? Map.of() : Map.copyOf(regimes);
    }
}
