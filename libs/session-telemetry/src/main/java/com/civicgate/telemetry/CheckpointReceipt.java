package com.civicgate.telemetry;

import java.time.Instant;
import java.util.List;

/**
 * What a recorded checkpoint returns to the caller.
 *
 * @param sessionId        session the checkpoint belongs to
 * @param seq              sequence number assigned to it
 * @param timestamp        when it was recorded
 * @param summary          trimmed summary
 * @param recentOperations up to the last twenty operation names, oldest first
 * @param toolCount        operations recorded in the session so far
 * @param checkpointCount  checkpoints recorded, this one included
 * @param errorCount       failed operations so far
 */
public record CheckpointReceipt(
        String sessionId,
        long seq,
        Instant timestamp,
        String summary,
        List<String> recentOperations,
        int toolCount,
        int checkpointCount,
        int errorCount
) {

    public CheckpointReceipt {
        recentOperations = List.copyOf(recentOperations);
    }
}
