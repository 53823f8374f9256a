package com.civicgate.telemetry;

import com.civicgate.eventmodel.SessionSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one session. Every method must be called holding the session's monitor;
 * {@link SessionTelemetry} does that.
 */
public final class Session {

    private final String id;
    private final Instant startedAt;
    private final String environment;
    private final String transport;
    private final ReminderPolicy reminder;
    private final List<String> toolSequence = new ArrayList<>();

    private boolean persisted;
    private boolean evicted;
    private Instant lastActivity;
    private long seq;
    private int toolCount;
    private int checkpointCount;
    private int errorCount;
    private String lastCheckpointSummary = "";
    private String userName;
    private String purpose;
    private Boolean telemetry;

    Session(String id, Instant startedAt, String environment, String transport, int reminderInterval) {
        this.id = id;
        this.startedAt = startedAt;
        this.environment = environment;
        this.transport = transport;
        this.reminder = new ReminderPolicy(reminderInterval);
        this.lastActivity = startedAt;
    }

    public String id() {
        return id;
    }

    public Instant startedAt() {
        return startedAt;
    }

    Instant lastActivity() {
        return lastActivity;
    }

    void touch(Instant now) {
        lastActivity = now;
    }

    /**
     * Detaches the session once idle past {@code timeout}; returns true if it was detached.
     */
    boolean evictIfIdle(Instant now, Duration timeout) {
        if (evicted || lastActivity.plus(timeout).isAfter(now)) {
            return false;
        }
        evicted = true;
        return true;
    }

    boolean isEvicted() {
        return evicted;
    }

    /**
     * Marks the session as written to the sinks; returns true only on the first call.
     */
    boolean markPersisted() {
        if (persisted) {
            return false;
        }
        persisted = true;
        return true;
    }

    long nextSeq() {
        return ++seq;
    }

    void operationCalled(String operation) {
        toolCount++;
        toolSequence.add(operation);
        reminder.recordOperation(operation);
    }

    void errorRecorded() {
        errorCount++;
    }

    void checkpointRecorded(String summary) {
        checkpointCount++;
        lastCheckpointSummary = summary;
        reminder.reset();
    }

    void attribute(String userName, String purpose, Boolean telemetry) {
        this.userName = userName;
        this.purpose = purpose;
        this.telemetry = telemetry;
    }

    ReminderPolicy reminder() {
        return reminder;
    }

    List<String> recentOperations(int max) {
        int from = Math.max(0, toolSequence.size() - max);
        return List.copyOf(toolSequence.subList(from, toolSequence.size()));
    }

    SessionSnapshot snapshot() {
        return new SessionSnapshot(id, startedAt, environment, transport, userName, purpose, telemetry,
                toolCount, checkpointCount, errorCount, toolSequence, lastCheckpointSummary);
    }
}
