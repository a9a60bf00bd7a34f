package com.gprintex.commission.exception;

import com.gprintex.commission.domain.ValidationResult;

import java.util.List;

public class ValidationException extends CommissionException {

    private final transient List<ValidationResult> errors;

    public ValidationException(List<ValidationResult> errors) {
        super("VALIDATION_FAILED", errors.stream()
            .map(ValidationResult::errorMessage)
            .reduce((a, b) -> a + "; " + b)
            .orElse("Validation failed"));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String code, String message, String field) {
        this(List.of(ValidationResult.error(code, message, field)));
    }

    public List<ValidationResult> getErrors() {
        return errors;
    }
}
