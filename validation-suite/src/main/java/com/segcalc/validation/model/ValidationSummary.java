package com.segcalc.validation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.segcalc.common.model.Winner;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of a full harness run.
 *
 * @param goldenWinners winner distribution recomputed over the golden dataset
 */
public record ValidationSummary(
    @JsonProperty("run_id")         String runId,
    @JsonProperty("total")          int total,
    @JsonProperty("passed")         int passed,
    @JsonProperty("failed")         int failed,
    @JsonProperty("pass_rate")      double passRate,
    @JsonProperty("categories")     Map<ValidationCategory, CategoryTally> categories,
    @JsonProperty("golden_winners") Map<Winner, Integer> goldenWinners,
    @JsonProperty("outcomes")       List<ValidationOutcome> outcomes
) {

    public static ValidationSummary of(String runId, List<ValidationOutcome> outcomes,
                                       Map<Winner, Integer> goldenWinners) {
        Map<ValidationCategory, CategoryTally> categories = new EnumMap<>(ValidationCategory.class);
        for (ValidationCategory category : ValidationCategory.values()) {
            int total = 0;
            int passed = 0;
            for (ValidationOutcome outcome : outcomes) {
                if (outcome.category() == category) {
                    total++;
                    if (outcome.passed()) {
                        passed++;
                    }
                }
            }
            if (total > 0) {
                categories.put(category, new CategoryTally(total, passed));
            }
        }
        int passed = (int) outcomes.stream().filter(ValidationOutcome::passed).count();
        int total = outcomes.size();
        return new ValidationSummary(
            runId,
            total,
            passed,
            total - passed,
            total == 0 ? 0.0 : (double) passed / total,
            Collections.unmodifiableMap(categories),
            goldenWinners == null || goldenWinners.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(goldenWinners)),
            List.copyOf(outcomes));
    }

    public List<ValidationOutcome> failures() {
        return outcomes.stream().filter(o -> !o.passed()).toList();
    }

    public boolean allPassed() {
        return failed == 0;
    }
}
