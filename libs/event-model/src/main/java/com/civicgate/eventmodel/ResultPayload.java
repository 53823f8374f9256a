package com.civicgate.eventmodel;

/**
 * Outcome of an operation, paired with its call through the shared sequence number.
 *
 * @param tool          operation name
 * @param durationMs    handler wall-clock time
 * @param isError       whether the handler failed
 * @param resultSummary truncated result text (nullable)
 * @param errorMessage  failure message (nullable)
 */
public record ResultPayload(
        String tool,
        long durationMs,
        boolean isError,
        String resultSummary,
        String errorMessage
) implements EventPayload {

    public ResultPayload {
        if (tool == null || tool.isBlank()) {
            throw new IllegalArgumentException("tool must not be null or blank");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be >= 0");
        }
    }

    @Override
    public EventKind kind() {
        return EventKind.RESULT;
    }
}
