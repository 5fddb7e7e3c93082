package com.segcalc.validation.golden;

import com.segcalc.common.exception.SegcalcException;

/**
 * The golden dataset is missing, unreadable or malformed. Aborts a harness run.
 */
public class GoldenDatasetException extends SegcalcException {

    public GoldenDatasetException(String source, String message) {
        super(source, message);
    }

    public GoldenDatasetException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
