package com.civicgate.observability;

/**
 * Health status for an individual component or the aggregate gateway.
 */
public enum HealthStatus {

    /** Component works normally. */
    HEALTHY,

    /** Component is impaired; the gateway keeps serving calls. */
    DEGRADED,

    /** Component is down and calls cannot be served. */
    UNHEALTHY;

    /**
     * Returns the worse of this status and {@code other}.
     */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
