package com.segcalc.engine.statistics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-regime slice of a {@link BatchSummary}. The win rate is NaN when no
 * object in the regime carries an observation.
 */
public record RegimeStats(
    @JsonProperty("count")        int count,
    @JsonProperty("observed")     int observed,
    @JsonProperty("ssz_wins")     int sszWins,
    @JsonProperty("ssz_win_rate") double sszWinRate
) {}
