package com.civicgate.eventmodel;

/**
 * Kind-specific body of a {@link TelemetryEvent}.
 */
public sealed interface EventPayload permits CallPayload, ResultPayload, CheckpointPayload {

    EventKind kind();
}
