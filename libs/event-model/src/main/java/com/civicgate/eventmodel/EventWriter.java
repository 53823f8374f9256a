package com.civicgate.eventmodel;

import java.util.List;

/**
 * Destination for telemetry. Implementations decide their own durability; callers decide
 * whether a failure matters.
 */
public interface EventWriter {

    /**
     * Appends an event.
     */
    void append(TelemetryEvent event);

    /**
     * Records the session's initial row.
     */
    void sessionStarted(SessionSnapshot snapshot);

    /**
     * Records the latest counters and attribution of a session.
     */
    void sessionUpdated(SessionSnapshot snapshot);

    /**
     * Upserts conversation turns by (session, turn). Writers that do not keep messages
     * ignore them.
     */
    default void upsertMessages(String sessionId, List<MessageTurn> turns) {
    }
}
