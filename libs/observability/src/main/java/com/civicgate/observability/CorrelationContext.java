package com.civicgate.observability;

/**
 * Immutable context of one gateway call, carried on the handling thread and mirrored
 * into SLF4J MDC.
 *
 * @param correlationId unique id for the inbound request
 * @param sessionId     telemetry session the call belongs to (nullable before the session is known)
 * @param operation     name of the operation being dispatched (nullable for non-operation requests)
 * @param tenantRoot    tenant root the caller is authenticated against (nullable before login)
 */
public record CorrelationContext(
        String correlationId,
        String sessionId,
        String operation,
        String tenantRoot
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for session ID. */
    public static final String MDC_SESSION_ID = "sessionId";

    /** MDC key for the operation name. */
    public static final String MDC_OPERATION = "operation";

    /** MDC key for the tenant root. */
    public static final String MDC_TENANT_ROOT = "tenantRoot";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy scoped to the given session and operation.
     */
    public CorrelationContext forOperation(String sessionId, String operation) {
        return new CorrelationContext(correlationId, sessionId, operation, tenantRoot);
    }

    /**
     * Returns a copy carrying the given tenant root.
     */
    public CorrelationContext withTenantRoot(String tenantRoot) {
        return new CorrelationContext(correlationId, sessionId, operation, tenantRoot);
    }
}
