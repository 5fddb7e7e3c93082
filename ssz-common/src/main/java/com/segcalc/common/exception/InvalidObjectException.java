package com.segcalc.common.exception;

/**
 * Raised when a {@link com.segcalc.common.model.CelestialObject} is built from
 * values outside their physical range. Inputs are rejected, never clamped.
 */
public class InvalidObjectException extends SegcalcException {

    public InvalidObjectException(String objectName, String message) {
        super(objectName == null || objectName.isBlank() ? "<unnamed>" : objectName, message);
    }
}
