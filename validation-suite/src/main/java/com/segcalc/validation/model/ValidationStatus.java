package com.segcalc.validation.model;

public enum ValidationStatus {
    PASS,
    FAIL
}
