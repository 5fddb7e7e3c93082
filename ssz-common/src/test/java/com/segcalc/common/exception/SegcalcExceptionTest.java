package com.segcalc.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SegcalcExceptionTest {

    @Test
    @DisplayName("message is prefixed with the subject")
    void subjectPrefix() {
        SegcalcException ex = new SegcalcException("reference_catalogue.csv", "golden dataset has no rows");
        assertEquals("reference_catalogue.csv", ex.getSubject());
        assertEquals("[reference_catalogue.csv] golden dataset has no rows", ex.getMessage());
        assertNull(ex.getCause());
    }

    @Test
    @DisplayName("cause is kept")
    void cause() {
        IllegalStateException cause = new IllegalStateException("truncated");
        SegcalcException ex = new SegcalcException("PSR_J0740+6620", "unreadable row", cause);
        assertSame(cause, ex.getCause());
        assertTrue(ex.getMessage().startsWith("[PSR_J0740+6620] "));
    }

    @Test
    @DisplayName("invalid objects without a name use a placeholder subject")
    void unnamedObject() {
        InvalidObjectException ex = new InvalidObjectException("  ", "mass must be positive");
        assertEquals("<unnamed>", ex.getSubject());
        assertEquals("[<unnamed>] mass must be positive", ex.getMessage());
    }
}
