package com.extractionplatform.common.exception;

/**
 * Evidence or Finding violates an evidence-model invariant. Thrown at creation time;
 * the offending object never enters the accumulator.
 */
public class ValidationException extends RuntimeException {
    private final String field;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
