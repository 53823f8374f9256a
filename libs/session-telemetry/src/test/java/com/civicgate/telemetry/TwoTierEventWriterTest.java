package com.civicgate.telemetry;

import com.civicgate.eventmodel.CallPayload;
import com.civicgate.eventmodel.TelemetryEvent;
import com.civicgate.observability.MetricFactory;
import com.civicgate.observability.OperationMetrics;
import com.civicgate.telemetry.testing.RecordingEventWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("TwoTierEventWriter")
class TwoTierEventWriterTest {

    private static final Executor DIRECT = Runnable::run;
    private static final Executor FULL = runnable -> {
        throw new RejectedExecutionException("queue full");
    };

    private RecordingEventWriter required;
    private RecordingEventWriter bestEffort;
    private SimpleMeterRegistry registry;
    private OperationMetrics metrics;

    @BeforeEach
    void setUp() {
        required = new RecordingEventWriter();
        bestEffort = new RecordingEventWriter();
        registry = new SimpleMeterRegistry();
        metrics = new OperationMetrics(new MetricFactory(registry, "gateway"));
    }

    private static TelemetryEvent event() {
        return new TelemetryEvent("s-1", 1, Instant.parse("2026-03-01T10:00:00Z"),
                new CallPayload("mdms_search", Map.of()));
    }

    @Test
    @DisplayName("should write to both tiers")
    void shouldWriteBoth() {
        var writer = new TwoTierEventWriter(required, bestEffort, () -> true, DIRECT, metrics);

        writer.append(event());

        assertThat(required.events()).hasSize(1);
        assertThat(bestEffort.events()).hasSize(1);
    }

    @Test
    @DisplayName("should skip the best-effort tier while it is disabled")
    void shouldSkipDisabledTier() {
        AtomicBoolean enabled = new AtomicBoolean(false);
        var writer = new TwoTierEventWriter(required, bestEffort, enabled::get, DIRECT, metrics);

        writer.append(event());
        enabled.set(true);
        writer.append(event());

        assertThat(required.events()).hasSize(2);
        assertThat(bestEffort.events()).hasSize(1);
    }

    @Test
    @DisplayName("should drop and count best-effort writes when the queue is full")
    void shouldCountDrops() {
        var writer = new TwoTierEventWriter(required, bestEffort, () -> true, FULL, metrics);

        writer.append(event());
        writer.sessionUpdated(new com.civicgate.eventmodel.SessionSnapshot("s-1", Instant.EPOCH, "dev", "http",
                null, null, null, 0, 0, 0, null, null));

        assertThat(required.events()).hasSize(1);
        assertThat(required.updates()).hasSize(1);
        assertThat(registry.get(OperationMetrics.DROPPED_WRITES).counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should keep failures of either tier away from the caller")
    void shouldContainFailures() {
        required.failWith(new IllegalStateException("disk full"));
        bestEffort.failWith(new IllegalStateException("db down"));
        var writer = new TwoTierEventWriter(required, bestEffort, () -> true, DIRECT, metrics);

        assertThatCode(() -> writer.append(event())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should drain queued writes on close")
    void shouldDrainOnClose() {
        var writer = new TwoTierEventWriter(required, bestEffort, () -> true, 16, metrics);

        for (int i = 0; i < 10; i++) {
            writer.append(event());
        }
        writer.close();

        assertThat(bestEffort.events()).hasSize(10);
    }

    @Test
    @DisplayName("should work without a best-effort tier")
    void shouldWorkWithoutBestEffort() {
        var writer = new TwoTierEventWriter(required, null, null, DIRECT, null);

        writer.append(event());

        assertThat(required.events()).hasSize(1);
    }

    @Test
    @DisplayName("should report writes waiting behind a busy worker")
    void shouldGaugeQueuedWrites() throws InterruptedException {
        ThreadPoolExecutor pool = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(8));
        CountDownLatch busy = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        pool.execute(() -> {
            busy.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(busy.await(2, TimeUnit.SECONDS)).isTrue();
        var writer = new TwoTierEventWriter(required, bestEffort, () -> true, pool, metrics);

        writer.append(event());
        writer.append(event());
        writer.append(event());

        assertThat(registry.get(OperationMetrics.QUEUED_WRITES).gauge().value()).isEqualTo(3.0);

        release.countDown();
        writer.close();
        assertThat(registry.get(OperationMetrics.QUEUED_WRITES).gauge().value()).isZero();
        assertThat(bestEffort.events()).hasSize(3);
    }
}
