package com.civicgate.telemetry;

import com.civicgate.eventmodel.EventWriter;
import com.civicgate.eventmodel.MessageTurn;
import com.civicgate.eventmodel.SessionSnapshot;
import com.civicgate.eventmodel.TelemetryEvent;
import com.civicgate.observability.OperationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Fans every write out to a required writer and a best-effort writer.
 * <p>
 * The required writer is called on the caller's thread, in call order. The best-effort
 * writer runs on a single worker behind a bounded queue; when the queue is full the write is
 * dropped, logged and counted, and the queue depth is exposed as a gauge. Best-effort writes are skipped while {@code bestEffortEnabled}
 * is false. Failures of either writer are logged and never reach the caller.
 */
public final class TwoTierEventWriter implements EventWriter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TwoTierEventWriter.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private final EventWriter required;
    private final EventWriter bestEffort;
    private final BooleanSupplier bestEffortEnabled;
    private final Executor executor;
    private final OperationMetrics metrics;

    /**
     * Creates a writer with its own single-thread worker.
     */
    public TwoTierEventWriter(EventWriter required, EventWriter bestEffort, BooleanSupplier bestEffortEnabled,
                              int queueCapacity, OperationMetrics metrics) {
        this(required, bestEffort, bestEffortEnabled, singleWorker(queueCapacity), metrics);
    }

    /**
     * @param executor runs best-effort writes; a {@link RejectedExecutionException} counts as a drop
     * @param metrics  where drops and, for a {@link ThreadPoolExecutor}, queue depth are reported (nullable)
     */
    public TwoTierEventWriter(EventWriter required, EventWriter bestEffort, BooleanSupplier bestEffortEnabled,
                              Executor executor, OperationMetrics metrics) {
        if (required == null) {
            throw new IllegalArgumentException("required writer must not be null");
        }
        this.required = required;
        this.bestEffort = bestEffort;
        this.bestEffortEnabled = bestEffortEnabled == null ? () -> bestEffort != null : bestEffortEnabled;
        this.executor = executor;
        this.metrics = metrics;
        if (metrics != null && executor instanceof ThreadPoolExecutor pool) {
            metrics.trackQueuedWrites(pool.getQueue());
        }
    }

    @Override
    public void append(TelemetryEvent event) {
        requiredWrite("append", () -> required.append(event));
        bestEffortWrite("append", () -> bestEffort.append(event));
    }

    @Override
    public void sessionStarted(SessionSnapshot snapshot) {
        requiredWrite("session start", () -> required.sessionStarted(snapshot));
        bestEffortWrite("session start", () -> bestEffort.sessionStarted(snapshot));
    }

    @Override
    public void sessionUpdated(SessionSnapshot snapshot) {
        requiredWrite("session update", () -> required.sessionUpdated(snapshot));
        bestEffortWrite("session update", () -> bestEffort.sessionUpdated(snapshot));
    }

    @Override
    public void upsertMessages(String sessionId, List<MessageTurn> turns) {
        requiredWrite("messages", () -> required.upsertMessages(sessionId, turns));
        bestEffortWrite("messages", () -> bestEffort.upsertMessages(sessionId, turns));
    }

    /**
     * Stops the worker after the queued writes, waiting up to five seconds.
     */
    @Override
    public void close() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
            try {
                if (!service.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Best-effort telemetry writes still pending at shutdown; dropping them");
                    service.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                service.shutdownNow();
            }
        }
    }

    private void requiredWrite(String what, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            log.warn("Telemetry log write failed ({}): {}", what, e.getMessage());
        }
    }

    private void bestEffortWrite(String what, Runnable write) {
        if (bestEffort == null || !bestEffortEnabled.getAsBoolean()) {
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException e) {
                    log.warn("Best-effort telemetry write failed ({}): {}", what, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Best-effort telemetry queue full, dropped {}", what);
            if (metrics != null) {
                metrics.recordDroppedWrite();
            }
        }
    }

    private static ExecutorService singleWorker(int queueCapacity) {
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "telemetry-writer");
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }
}
