package com.civicgate.gateway.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gateway settings bound from {@code civicgate.gateway.*}.
 *
 * <pre>
 * civicgate:
 *   gateway:
 *     name: civic-gateway
 *     environment: chakshu-digit
 *     enable-all-groups: false
 *     session-data-dir: ./data
 *     reminder-interval: 8
 *     session-idle-timeout: 24h
 * </pre>
 *
 * @param name Service name used for logging and metrics. Required.
 * @param environment Key of the platform environment active at start.
 * @param enableAllGroups Whether every operation group is visible from the start.
 * @param sessionDataDir Directory holding {@code events.jsonl} and {@code sessions.jsonl}.
 * @param reminderInterval Operations between checkpoint reminders.
 * @param resultSummaryLength Characters of a result kept in the telemetry log.
 * @param writerQueueCapacity Pending best-effort database writes before new ones are dropped.
 * @param sessionIdleTimeout Inactivity after which a session is dropped from memory.
 * @param allowedOrigins Origins allowed to call {@code /api/**} from a browser.
 */
@ConfigurationProperties(prefix = "civicgate.gateway")
@Validated
public record GatewayProperties(
        @NotBlank String name,
        String environment,
        boolean enableAllGroups,
        String sessionDataDir,
        @Min(1) @Max(1000) Integer reminderInterval,
        @Min(1) Integer resultSummaryLength,
        @Min(1) Integer writerQueueCapacity,
        Duration sessionIdleTimeout,
        List<String> allowedOrigins) {

    public GatewayProperties {
        if (environment == null || environment.isBlank()) {
            environment = "chakshu-digit";
        }
        if (sessionDataDir == null || sessionDataDir.isBlank()) {
            sessionDataDir = "./data";
        }
        if (reminderInterval == null) {
            reminderInterval = 8;
        }
        if (resultSummaryLength == null) {
            resultSummaryLength = 200;
        }
        if (writerQueueCapacity == null) {
            writerQueueCapacity = 1024;
        }
        if (sessionIdleTimeout == null) {
            sessionIdleTimeout = Duration.ofHours(24);
        }
        allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty()
                ? List.of("http://localhost:3000", "http://localhost:5173")
                : List.copyOf(allowedOrigins);
    }
}
