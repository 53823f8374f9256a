package com.civicgate.eventmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates telemetry input that arrives from callers rather than from the gateway itself.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Validates a checkpoint request before any sequence number is spent on it.
     *
     * @param summary the caller's summary
     * @param turns   optional message turns (nullable)
     */
    public static ValidationResult validateCheckpoint(String summary, List<MessageTurn> turns) {
        List<String> errors = new ArrayList<>();
        if (summary == null || summary.isBlank()) {
            errors.add("summary must not be empty");
        }
        if (turns != null) {
            long distinct = turns.stream().mapToInt(MessageTurn::turn).distinct().count();
            if (distinct != turns.size()) {
                errors.add("messages must not repeat a turn number");
            }
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /**
     * Validates an event read back from a log line.
     */
    public static ValidationResult validate(TelemetryEvent event) {
        List<String> errors = new ArrayList<>();
        if (event.seq() < 1) {
            errors.add("seq must be >= 1");
        }
        if (event.payload() instanceof ResultPayload result && result.isError()
                && result.errorMessage() == null) {
            errors.add("errorMessage must be set on a failed result");
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }
}
