package com.civicgate.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregates {@link HealthCheck}s by component name into a {@link HealthReport}.
 * <p>
 * Checks run sequentially on the calling thread. A check that throws is reported as
 * {@link HealthStatus#UNHEALTHY}.
 */
public final class HealthCheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final Map<String, HealthCheck> checks = new LinkedHashMap<>();
    private final Clock clock;

    public HealthCheckRegistry() {
        this(Clock.systemUTC());
    }

    public HealthCheckRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers a check, replacing any existing check under the same name.
     */
    public synchronized void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    /**
     * Runs every registered check and returns the aggregate.
     */
    public synchronized HealthReport checkAll() {
        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, HealthCheck> entry : checks.entrySet()) {
            ComponentHealth result = runCheck(entry.getKey(), entry.getValue());
            results.put(entry.getKey(), result);
            overall = overall.worst(result.status());
        }
        return new HealthReport(overall, results, clock.instant());
    }

    public synchronized int size() {
        return checks.size();
    }

    private static ComponentHealth runCheck(String name, HealthCheck check) {
        try {
            ComponentHealth result = check.check();
            return result != null ? result : ComponentHealth.unhealthy(name, "check returned no result");
        } catch (RuntimeException e) {
            log.warn("Health check '{}' failed", name, e);
            return ComponentHealth.unhealthy(name, e.getMessage());
        }
    }
}
