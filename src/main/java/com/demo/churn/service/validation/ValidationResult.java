package com.demo.churn.service.validation;

import java.util.List;
import java.util.stream.Collectors;

public record ValidationResult(List<FieldViolation> violations) {

    public ValidationResult {
        violations = List.copyOf(violations);
    }

    /** Passes when no violation is an error; warnings do not block scoring. */
    public boolean isValid() {
        return violations.stream().noneMatch(FieldViolation::isError);
    }

    public List<FieldViolation> errors() {
        return violations.stream().filter(FieldViolation::isError).collect(Collectors.toList());
    }

    public List<FieldViolation> warnings() {
        return violations.stream().filter(v -> !v.isError()).collect(Collectors.toList());
    }

    public boolean hasErrorOn(String field) {
        return errors().stream().anyMatch(v -> List.of(v.field().split(",")).contains(field));
    }

    public String summary() {
        return errors().stream().map(FieldViolation::message).collect(Collectors.joining("; "));
    }
}
