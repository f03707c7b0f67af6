package com.ptl.domain.exception;

/**
 * Category of a rejected ledger operation.
 * Lets callers tell "try again later" apart from "this request is invalid".
 */
public enum ErrorTag {
    PRECONDITION_VIOLATION("PRECONDITION_VIOLATION"),
    CONSTRAINT_BLOCKED("CONSTRAINT_BLOCKED"),
    ARITHMETIC_OVERFLOW("ARITHMETIC_OVERFLOW");

    private final String value;

    ErrorTag(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
