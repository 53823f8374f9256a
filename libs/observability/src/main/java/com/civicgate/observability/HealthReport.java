package com.civicgate.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate health of all registered components.
 *
 * @param status     worst component status ({@link HealthStatus#HEALTHY} when nothing is registered)
 * @param components per-component results keyed by name, in registration order
 * @param timestamp  when the checks ran
 */
public record HealthReport(
        HealthStatus status,
        Map<String, ComponentHealth> components,
        Instant timestamp
) {

    public HealthReport {
        components = Map.copyOf(components);
    }
}
