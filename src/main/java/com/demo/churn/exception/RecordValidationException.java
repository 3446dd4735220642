package com.demo.churn.exception;

import com.demo.churn.service.validation.FieldViolation;

import java.util.List;

/** A single submitted record was rejected by the validator. */
public class RecordValidationException extends ChurnException {

    private final List<FieldViolation> violations;

    public RecordValidationException(String message, List<FieldViolation> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
