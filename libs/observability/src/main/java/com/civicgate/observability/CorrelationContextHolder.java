package com.civicgate.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext} with an SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys {@code correlationId}, {@code sessionId},
 * {@code operation} and {@code tenantRoot}; clearing removes them. Work handed to another
 * thread must carry the context explicitly through {@link #callWithContext}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates the MDC.
     *
     * @param context the context to set
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the context and its MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_SESSION_ID);
        MDC.remove(CorrelationContext.MDC_OPERATION);
        MDC.remove(CorrelationContext.MDC_TENANT_ROOT);
    }

    /**
     * Runs {@code work} with the given context set, then restores whatever context was
     * active before (or clears it if there was none).
     *
     * @param context context for the duration of the work
     * @param work    the work to run
     * @param <T>     result type
     * @return the result of the work
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        putOrRemove(CorrelationContext.MDC_SESSION_ID, ctx.sessionId());
        putOrRemove(CorrelationContext.MDC_OPERATION, ctx.operation());
        putOrRemove(CorrelationContext.MDC_TENANT_ROOT, ctx.tenantRoot());
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
