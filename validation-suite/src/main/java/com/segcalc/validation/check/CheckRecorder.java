package com.segcalc.validation.check;

import com.segcalc.validation.model.ValidationCategory;
import com.segcalc.validation.model.ValidationOutcome;
import com.segcalc.validation.model.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Runs check bodies for one category and records their outcomes.
 *
 * <p>A check never escapes with an exception: anything thrown by the body is
 * recorded as a {@link ValidationStatus#FAIL} with the exception as diagnosis.
 * A NaN computed value always fails a numeric comparison.
 */
public class CheckRecorder {

    private static final Logger log = LoggerFactory.getLogger(CheckRecorder.class);

    private final ValidationCategory category;
    private final List<ValidationOutcome> outcomes = new ArrayList<>();

    public CheckRecorder(ValidationCategory category) {
        this.category = category;
    }

    public ValidationCategory category() {
        return category;
    }

    public List<ValidationOutcome> outcomes() {
        return List.copyOf(outcomes);
    }

    /** |computed − expected| ≤ tolerance. */
    public void absolute(String testId, double expected, double tolerance, DoubleSupplier computed) {
        verify(testId, format(expected), "±" + format(tolerance), () -> {
            double value = computed.getAsDouble();
            boolean ok = Math.abs(value - expected) <= tolerance;
            return Evaluation.of(ok, format(value), ok ? null : "off by " + format(Math.abs(value - expected)));
        });
    }

    /** |computed − expected| / |expected| ≤ tolerance; falls back to absolute when expected is 0. */
    public void relative(String testId, double expected, double tolerance, DoubleSupplier computed) {
        verify(testId, format(expected), "rel " + format(tolerance), () -> {
            double value = computed.getAsDouble();
            double scale = expected == 0.0 ? 1.0 : Math.abs(expected);
            double error = Math.abs(value - expected) / scale;
            boolean ok = error <= tolerance;
            return Evaluation.of(ok, format(value), ok ? null : "relative error " + format(error));
        });
    }

    /** computed lies strictly inside (lower, upper). */
    public void within(String testId, double lower, double upper, DoubleSupplier computed) {
        verify(testId, "(" + format(lower) + ", " + format(upper) + ")", "range", () -> {
            double value = computed.getAsDouble();
            return Evaluation.of(value > lower && value < upper, format(value));
        });
    }

    public <T> void equal(String testId, T expected, Supplier<T> computed) {
        verify(testId, String.valueOf(expected), "exact", () -> {
            T value = computed.get();
            return Evaluation.of(expected == null ? value == null : expected.equals(value), String.valueOf(value));
        });
    }

    /** General form; the body describes its own computed value. */
    public void verify(String testId, String expected, String tolerance, Supplier<Evaluation> body) {
        ValidationOutcome outcome;
        try {
            Evaluation evaluation = body.get();
            outcome = new ValidationOutcome(testId, category,
                evaluation.passed() ? ValidationStatus.PASS : ValidationStatus.FAIL,
                expected, evaluation.computed(), tolerance, evaluation.diagnosis());
        } catch (RuntimeException e) {
            outcome = new ValidationOutcome(testId, category, ValidationStatus.FAIL,
                expected, "error", tolerance, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (!outcome.passed()) {
            log.warn("[Validation] FAIL. test={} expected={} computed={} diagnosis={}",
                testId, outcome.expected(), outcome.computed(), outcome.diagnosis());
        }
        outcomes.add(outcome);
    }

    static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        double abs = Math.abs(value);
        if (abs != 0.0 && (abs < 1e-4 || abs >= 1e6)) {
            return String.format(Locale.ROOT, "%.6e", value);
        }
        return String.format(Locale.ROOT, "%.9g", value);
    }
}
