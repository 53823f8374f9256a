package com.civicgate.capability;

/**
 * What a handler reports back: result text on success, an error message on failure.
 *
 * @param success whether the operation succeeded
 * @param text    result text, usually JSON (null on failure)
 * @param error   failure message (null on success)
 */
public record OperationOutcome(boolean success, String text, String error) {

    public OperationOutcome {
        if (!success && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("error must not be null or blank for a failure");
        }
    }

    public static OperationOutcome success(String text) {
        return new OperationOutcome(true, text == null ? "" : text, null);
    }

    public static OperationOutcome failure(String error) {
        return new OperationOutcome(false, null, error);
    }
}
