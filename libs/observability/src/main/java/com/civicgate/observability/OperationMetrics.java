package com.civicgate.observability;

import java.time.Duration;
import java.util.Collection;

/**
 * Gateway meters for dispatched operations and the telemetry write path.
 * <ul>
 *   <li>{@code gateway.operations.calls} counter, tagged {@code operation} and {@code outcome}</li>
 *   <li>{@code gateway.operations.denied} counter, tagged {@code operation} and {@code group}</li>
 *   <li>{@code gateway.operations.duration} timer, tagged {@code operation}</li>
 *   <li>{@code gateway.telemetry.dropped} counter for best-effort writes discarded on overflow</li>
 *   <li>{@code gateway.telemetry.queued} gauge of best-effort writes waiting for the worker</li>
 * </ul>
 */
public final class OperationMetrics {

    public static final String CALLS = "gateway.operations.calls";
    public static final String DENIED = "gateway.operations.denied";
    public static final String DURATION = "gateway.operations.duration";
    public static final String DROPPED_WRITES = "gateway.telemetry.dropped";
    public static final String QUEUED_WRITES = "gateway.telemetry.queued";

    /** Outcome tag values. */
    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_ERROR = "error";

    private final MetricFactory factory;

    public OperationMetrics(MetricFactory factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory must not be null");
        }
        this.factory = factory;
    }

    /**
     * Records a completed dispatch.
     *
     * @param operation operation name
     * @param success   whether the handler reported success
     * @param elapsed   handler wall-clock time
     */
    public void recordCall(String operation, boolean success, Duration elapsed) {
        factory.counter(CALLS, "Dispatched operations",
                        "operation", operation,
                        "outcome", success ? OUTCOME_SUCCESS : OUTCOME_ERROR)
                .increment();
        factory.timer(DURATION, "Operation handler duration", "operation", operation)
                .record(elapsed);
    }

    /**
     * Records a call rejected because its group is not enabled.
     */
    public void recordDenied(String operation, String group) {
        factory.counter(DENIED, "Operations rejected by capability gating",
                        "operation", operation, "group", group)
                .increment();
    }

    /**
     * Records a best-effort telemetry write dropped because the writer queue was full.
     */
    public void recordDroppedWrite() {
        factory.counter(DROPPED_WRITES, "Best-effort telemetry writes dropped").increment();
    }

    /**
     * Reports the size of the best-effort write queue.
     */
    public void trackQueuedWrites(Collection<?> queue) {
        factory.gauge(QUEUED_WRITES, "Best-effort telemetry writes waiting", queue, Collection::size);
    }
}
