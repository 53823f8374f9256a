package com.civicgate.eventmodel;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of a session's counters and attribution, as written to
 * {@code sessions.jsonl} and the sessions table.
 */
public record SessionSnapshot(
        String id,
        Instant startedAt,
        String environment,
        String transport,
        String userName,
        String purpose,
        Boolean telemetry,
        int toolCount,
        int checkpointCount,
        int errorCount,
        List<String> toolSequence,
        String lastCheckpointSummary
) {

    public SessionSnapshot {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        toolSequence = toolSequence == null ? List.of() : List.copyOf(toolSequence);
        lastCheckpointSummary = lastCheckpointSummary == null ? "" : lastCheckpointSummary;
    }
}
