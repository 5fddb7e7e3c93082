package com.segcalc.validation.check;

import com.segcalc.validation.model.ValidationCategory;

/**
 * A fixed set of checks for one {@link ValidationCategory}.
 * Implementations record every outcome on the recorder and never throw.
 */
public interface ValidationCheckGroup {

    ValidationCategory category();

    void run(ValidationContext context, CheckRecorder recorder);
}
