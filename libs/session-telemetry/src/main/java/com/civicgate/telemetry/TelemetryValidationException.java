package com.civicgate.telemetry;

import java.util.List;

/**
 * Caller-supplied telemetry input was rejected. Nothing was recorded.
 */
public class TelemetryValidationException extends RuntimeException {

    private final List<String> errors;

    public TelemetryValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
