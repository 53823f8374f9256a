package com.civicgate.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.concurrent.Callable;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that runs work inside a span
 * annotated with the current {@link CorrelationContext}.
 * <p>
 * The SDK (exporter, sampler) is configured by the hosting service, not here.
 */
public final class OperationTracer {

    public static final String ATTR_OPERATION = "gateway.operation";
    public static final String ATTR_SESSION_ID = "gateway.session.id";
    public static final String ATTR_CORRELATION_ID = "correlation.id";
    public static final String ATTR_TENANT_ROOT = "tenant.root";

    private final Tracer tracer;

    public OperationTracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code callable} inside a span named {@code operation <name>}. The span is ended
     * whatever the outcome; a thrown exception is recorded and rethrown.
     *
     * @param operation operation name
     * @param callable  the work
     * @param <T>       result type
     * @return the callable's result
     * @throws Exception whatever the callable throws
     */
    public <T> T trace(String operation, Callable<T> callable) throws Exception {
        Span span = tracer.spanBuilder("operation " + operation)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(ATTR_OPERATION, operation)
                .startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
            if (ctx.sessionId() != null) {
                span.setAttribute(ATTR_SESSION_ID, ctx.sessionId());
            }
            if (ctx.tenantRoot() != null) {
                span.setAttribute(ATTR_TENANT_ROOT, ctx.tenantRoot());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = callable.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Marks the current span as failed without an exception, for handlers that report
     * failure through their result.
     */
    public static void markCurrentFailed(String message) {
        Span.current().setStatus(StatusCode.ERROR, message == null ? "" : message);
    }
}
