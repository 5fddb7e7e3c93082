package com.segcalc.validation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CategoryTally(
    @JsonProperty("total")  int total,
    @JsonProperty("passed") int passed
) {

    public int failed() {
        return total - passed;
    }
}
