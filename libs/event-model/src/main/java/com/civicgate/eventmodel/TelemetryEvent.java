package com.civicgate.eventmodel;

import java.time.Instant;

/**
 * One entry of a session's event stream.
 * <p>
 * Within a session, calls and checkpoints take consecutive sequence numbers starting at 1.
 * A result carries the sequence number of the call it answers.
 *
 * @param sessionId owning session
 * @param seq       per-session sequence number, at least 1
 * @param timestamp when the event was recorded
 * @param payload   kind-specific body
 */
public record TelemetryEvent(String sessionId, long seq, Instant timestamp, EventPayload payload) {

    public TelemetryEvent {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
    }

    public EventKind kind() {
        return payload.kind();
    }
}
