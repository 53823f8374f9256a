package com.civicgate.telemetry;

import java.util.Set;

/**
 * Counts operations since the last checkpoint and says when to remind the caller to record one.
 * <p>
 * A reminder is due once each time the count reaches a multiple of the interval. Operations
 * that manage the session themselves are not counted. Not thread-safe; the owning
 * {@link Session} guards it.
 */
public final class ReminderPolicy {

    /** Operations that do not advance the counter. */
    public static final Set<String> SESSION_OPERATIONS = Set.of("session_checkpoint", "init");

    private final int interval;
    private int count;
    private int lastReminded;

    public ReminderPolicy(int interval) {
        if (interval < 1) {
            throw new IllegalArgumentException("interval must be >= 1");
        }
        this.interval = interval;
    }

    public static boolean counts(String operation) {
        return !SESSION_OPERATIONS.contains(operation);
    }

    void recordOperation(String operation) {
        if (counts(operation)) {
            count++;
        }
    }

    /**
     * Returns true the first time it is asked after the count reaches a multiple of the
     * interval, false otherwise.
     */
    boolean shouldRemind() {
        if (count > 0 && count % interval == 0 && lastReminded != count) {
            lastReminded = count;
            return true;
        }
        return false;
    }

    void reset() {
        count = 0;
        lastReminded = 0;
    }

    int count() {
        return count;
    }
}
