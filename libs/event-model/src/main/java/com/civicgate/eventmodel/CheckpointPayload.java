package com.civicgate.eventmodel;

import java.util.List;

/**
 * A caller-supplied progress summary.
 *
 * @param summary     trimmed summary text
 * @param recentTools up to the last twenty operation names of the session, oldest first
 */
public record CheckpointPayload(String summary, List<String> recentTools) implements EventPayload {

    public CheckpointPayload {
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("summary must not be null or blank");
        }
        recentTools = recentTools == null ? List.of() : List.copyOf(recentTools);
    }

    @Override
    public EventKind kind() {
        return EventKind.CHECKPOINT;
    }
}
