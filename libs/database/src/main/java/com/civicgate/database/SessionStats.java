package com.civicgate.database;

/**
 * Totals across all recorded sessions.
 */
public record SessionStats(long totalSessions, long totalTools, long totalErrors, long totalCheckpoints) {
}
