package com.civicgate.eventmodel;

import java.util.List;

/**
 * Result of a validation that collects every error at once.
 *
 * @param valid  true if validation passed
 * @param errors human-readable error messages (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /**
     * Joins the errors into one message, for exceptions.
     */
    public String message() {
        return String.join("; ", errors);
    }
}
