package com.segcalc.validation.check;

/**
 * What a check body reports back to the {@link CheckRecorder}.
 */
public record Evaluation(boolean passed, String computed, String diagnosis) {

    public static Evaluation of(boolean passed, String computed) {
        return new Evaluation(passed, computed, null);
    }

    public static Evaluation of(boolean passed, String computed, String diagnosis) {
        return new Evaluation(passed, computed, diagnosis);
    }
}
