package com.demo.churn.service.validation;

/**
 * One problem found on a record.
 *
 * @param field      record field name (as in the batch CSV header), or a comma separated
 *                   list for cross-field rules
 * @param constraint short machine code: required, type, range, allowed, rule
 */
public record FieldViolation(String field, String constraint, String message, Severity severity) {

    public enum Severity { ERROR, WARNING }

    public static FieldViolation error(String field, String constraint, String message) {
        return new FieldViolation(field, constraint, message, Severity.ERROR);
    }

    public static FieldViolation warning(String field, String constraint, String message) {
        return new FieldViolation(field, constraint, message, Severity.WARNING);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
