package com.civicgate.eventmodel;

import java.util.Optional;

/**
 * The three kinds of telemetry event. {@link #value()} is the string written to the
 * {@code type} field of a log line and to the {@code type} column of the events table.
 */
public enum EventKind {

    CALL("tool_call"),
    RESULT("tool_result"),
    CHECKPOINT("checkpoint");

    private final String value;

    EventKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Looks up a kind by its wire value.
     *
     * @param value the string to match (e.g. "tool_call")
     * @return the matching kind, or empty if unknown
     */
    public static Optional<EventKind> fromString(String value) {
        for (EventKind kind : values()) {
            if (kind.value.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
