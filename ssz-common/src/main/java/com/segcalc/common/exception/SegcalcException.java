package com.segcalc.common.exception;

/**
 * Base of the engine's unchecked errors. The subject names what the error is
 * about (an object name, a dataset file) and prefixes the message as
 * {@code [subject] message} so that log lines from batch runs stay attributable.
 */
public class SegcalcException extends RuntimeException {
    private final String subject;

    public SegcalcException(String subject, String message) {
        super("[" + subject + "] " + message);
        this.subject = subject;
    }

    public SegcalcException(String subject, String message, Throwable cause) {
        super("[" + subject + "] " + message, cause);
        this.subject = subject;
    }

    /** The object or resource the error refers to. */
    public String getSubject() {
        return subject;
    }
}
