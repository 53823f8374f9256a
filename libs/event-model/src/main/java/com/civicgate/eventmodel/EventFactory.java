package com.civicgate.eventmodel;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Factory methods for {@link TelemetryEvent}s.
 */
public final class EventFactory {

    /** Suffix appended to a truncated result summary. */
    public static final String TRUNCATION_MARKER = "...";

    private EventFactory() {
        // utility class
    }

    public static TelemetryEvent call(String sessionId, long seq, Instant at,
                                      String tool, Map<String, Object> redactedArgs) {
        return new TelemetryEvent(sessionId, seq, at, new CallPayload(tool, redactedArgs));
    }

    /**
     * Creates a result event, truncating {@code resultText} to {@code maxSummaryLength}
     * characters plus {@value #TRUNCATION_MARKER}. An empty text yields no summary.
     */
    public static TelemetryEvent result(String sessionId, long seq, Instant at, String tool,
                                        long durationMs, boolean isError, String resultText,
                                        String errorMessage, int maxSummaryLength) {
        String summary = truncate(resultText, maxSummaryLength);
        String error = errorMessage == null || errorMessage.isEmpty() ? null : errorMessage;
        return new TelemetryEvent(sessionId, seq, at,
                new ResultPayload(tool, durationMs, isError, summary, error));
    }

    public static TelemetryEvent checkpoint(String sessionId, long seq, Instant at,
                                            String summary, List<String> recentTools) {
        return new TelemetryEvent(sessionId, seq, at, new CheckpointPayload(summary, recentTools));
    }

    /**
     * Truncates to {@code maxLength} characters plus the marker; null or empty text gives null.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + TRUNCATION_MARKER;
    }
}
