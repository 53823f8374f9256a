package com.civicgate.observability;

/**
 * Health check of one gateway component. Implementations must be cheap and must not throw;
 * the registry still guards against it.
 */
@FunctionalInterface
public interface HealthCheck {

    ComponentHealth check();
}
