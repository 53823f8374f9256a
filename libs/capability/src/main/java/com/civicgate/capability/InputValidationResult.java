package com.civicgate.capability;

import java.util.List;

/**
 * Outcome of checking operation arguments against an {@link InputSchema}.
 *
 * @param valid  true when no violation was found
 * @param errors every violation, in property order
 */
public record InputValidationResult(boolean valid, List<String> errors) {

    public static InputValidationResult ok() {
        return new InputValidationResult(true, List.of());
    }

    public static InputValidationResult fail(List<String> errors) {
        return new InputValidationResult(false, List.copyOf(errors));
    }

    public String message() {
        return "Invalid arguments: " + String.join("; ", errors);
    }
}
