package com.civicgate.telemetry;

import java.time.Duration;

/**
 * Tunables of the session telemetry.
 *
 * @param environment      environment label stored on new sessions
 * @param transport        transport label stored on new sessions
 * @param reminderInterval operations between checkpoint reminders
 * @param maxRecentTools   operation names carried by a checkpoint
 * @param maxSummaryLength characters of a result kept before truncation
 * @param idleTimeout      inactivity after which a session is dropped from memory; null means the default
 */
public record TelemetrySettings(
        String environment,
        String transport,
        int reminderInterval,
        int maxRecentTools,
        int maxSummaryLength,
        Duration idleTimeout
) {

    public static final int DEFAULT_REMINDER_INTERVAL = 8;
    public static final int DEFAULT_MAX_RECENT_TOOLS = 20;
    public static final int DEFAULT_MAX_SUMMARY_LENGTH = 200;
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofHours(24);

    public TelemetrySettings {
        if (reminderInterval < 1) {
            throw new IllegalArgumentException("reminderInterval must be >= 1");
        }
        if (maxRecentTools < 1) {
            throw new IllegalArgumentException("maxRecentTools must be >= 1");
        }
        if (maxSummaryLength < 1) {
            throw new IllegalArgumentException("maxSummaryLength must be >= 1");
        }
        if (idleTimeout != null && (idleTimeout.isNegative() || idleTimeout.isZero())) {
            throw new IllegalArgumentException("idleTimeout must be positive");
        }
        environment = environment == null ? "unknown" : environment;
        idleTimeout = idleTimeout == null ? DEFAULT_IDLE_TIMEOUT : idleTimeout;
        transport = transport == null ? "http" : transport;
    }

    public static TelemetrySettings defaults(String environment) {
        return new TelemetrySettings(environment, "http", DEFAULT_REMINDER_INTERVAL,
                DEFAULT_MAX_RECENT_TOOLS, DEFAULT_MAX_SUMMARY_LENGTH, DEFAULT_IDLE_TIMEOUT);
    }
}
