package com.gprintex.commission.domain;

/**
 * Field-level validation outcome returned on the Left side of create operations.
 */
public record ValidationResult(
    boolean valid,
    String errorCode,
    String errorMessage,
    String fieldName
) {
    public static ValidationResult success() {
        return new ValidationResult(true, null, null, null);
    }

    public static ValidationResult error(String code, String message, String field) {
        return new ValidationResult(false, code, message, field);
    }

    public static ValidationResult error(String code, String message) {
        return new ValidationResult(false, code, message, null);
    }
}
