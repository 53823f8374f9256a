package com.civicgate.observability;

/**
 * Health of a single component.
 *
 * @param name    component name (for example "event-log", "session-db")
 * @param status  component status
 * @param message optional detail
 */
public record ComponentHealth(String name, HealthStatus status, String message) {

    public ComponentHealth {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    public static ComponentHealth healthy(String name) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null);
    }

    public static ComponentHealth degraded(String name, String message) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message);
    }

    public static ComponentHealth unhealthy(String name, String message) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message);
    }
}
