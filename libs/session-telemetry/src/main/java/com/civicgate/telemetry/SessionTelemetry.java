package com.civicgate.telemetry;

import com.civicgate.eventmodel.EventFactory;
import com.civicgate.eventmodel.EventValidator;
import com.civicgate.eventmodel.EventWriter;
import com.civicgate.eventmodel.MessageTurn;
import com.civicgate.eventmodel.SessionSnapshot;
import com.civicgate.eventmodel.TelemetryEvent;
import com.civicgate.eventmodel.ValidationResult;
import com.civicgate.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Records what happens in each session: calls, results and checkpoints, with per-session
 * sequence numbers.
 * <p>
 * Sequence numbers are issued and their events written while holding the session's monitor,
 * so the log of a session holds exactly 1..n in order. A result reuses the number of its call.
 * Recording never throws into the caller except for a rejected checkpoint.
 * <p>
 * Sessions idle longer than {@link TelemetrySettings#idleTimeout()} are dropped from memory
 * whenever a new session is opened; the default session is kept. A later call naming a
 * dropped id opens a new session under that id.
 */
public class SessionTelemetry {

    private static final Logger log = LoggerFactory.getLogger(SessionTelemetry.class);

    private final EventWriter writer;
    private final SensitiveDataRedactor redactor;
    private final TelemetrySettings settings;
    private final Clock clock;
    private final String defaultSessionId;
    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();

    public SessionTelemetry(EventWriter writer, SensitiveDataRedactor redactor, TelemetrySettings settings,
                            Clock clock) {
        if (writer == null) {
            throw new IllegalArgumentException("writer must not be null");
        }
        this.writer = writer;
        this.redactor = redactor == null ? new SensitiveDataRedactor() : redactor;
        this.settings = settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.defaultSessionId = UUID.randomUUID().toString();
    }

    /** Id used when a caller does not name a session. */
    public String defaultSessionId() {
        return defaultSessionId;
    }

    public TelemetrySettings settings() {
        return settings;
    }

    /**
     * Returns the session with this id, creating and persisting it on first use.
     * A null or blank id means the default session.
     */
    public Session ensureSession(String sessionId) {
        String id = sessionId == null || sessionId.isBlank() ? defaultSessionId : sessionId;
        while (true) {
            Session session = sessions.computeIfAbsent(id, key -> new Session(key, clock.instant(),
                    settings.environment(), settings.transport(), settings.reminderInterval()));
            boolean started;
            synchronized (session) {
                if (session.isEvicted()) {
                    sessions.remove(id, session);
                    continue;
                }
                session.touch(clock.instant());
                started = session.markPersisted();
                if (started) {
                    writer.sessionStarted(session.snapshot());
                    log.info("Session {} started", id);
                }
            }
            if (started) {
                evictIdle();
            }
            return session;
        }
    }

    /**
     * Drops every session other than the default one that has been idle longer than the
     * configured timeout.
     *
     * @return the number of sessions dropped
     */
    public int evictIdle() {
        Instant now = clock.instant();
        int evicted = 0;
        for (Session session : sessions.values()) {
            if (session.id().equals(defaultSessionId)) {
                continue;
            }
            synchronized (session) {
                if (!session.evictIfIdle(now, settings.idleTimeout())) {
                    continue;
                }
            }
            sessions.remove(session.id(), session);
            evicted++;
        }
        if (evicted > 0) {
            log.info("Dropped {} idle sessions, {} remain", evicted, sessions.size());
        }
        return evicted;
    }

    /**
     * Records an operation call with redacted arguments.
     *
     * @return the sequence number assigned to the call
     */
    public long recordCall(String sessionId, String operation, Map<String, ?> rawArgs) {
        Session session = ensureSession(sessionId);
        Map<String, Object> args = redactor.redact(rawArgs);
        synchronized (session) {
            long seq = session.nextSeq();
            writer.append(EventFactory.call(session.id(), seq, clock.instant(), operation, args));
            session.operationCalled(operation);
            return seq;
        }
    }

    /**
     * Records the outcome of the call with sequence number {@code seq}. Never throws.
     */
    public void recordResult(String sessionId, long seq, String operation, long durationMs, boolean isError,
                             String resultText, String errorMessage) {
        try {
            Session session = ensureSession(sessionId);
            synchronized (session) {
                TelemetryEvent event = EventFactory.result(session.id(), seq, clock.instant(), operation,
                        Math.max(0, durationMs), isError, resultText, errorMessage, settings.maxSummaryLength());
                writer.append(event);
                if (isError) {
                    session.errorRecorded();
                }
                writer.sessionUpdated(session.snapshot());
            }
        } catch (RuntimeException e) {
            log.warn("Recording result of {} #{} failed: {}", operation, seq, e.getMessage());
        }
    }

    /**
     * Records a checkpoint and resets the reminder counter.
     *
     * @param messages conversation turns to upsert with it (nullable)
     * @throws TelemetryValidationException if the summary is blank or turn numbers repeat;
     *                                      no sequence number is consumed then
     */
    public CheckpointReceipt recordCheckpoint(String sessionId, String summary, List<MessageTurn> messages) {
        ValidationResult validation = EventValidator.validateCheckpoint(summary, messages);
        if (!validation.valid()) {
            throw new TelemetryValidationException(validation.errors());
        }
        String trimmed = summary.trim();
        Session session = ensureSession(sessionId);
        synchronized (session) {
            long seq = session.nextSeq();
            Instant at = clock.instant();
            List<String> recent = session.recentOperations(settings.maxRecentTools());
            writer.append(EventFactory.checkpoint(session.id(), seq, at, trimmed, recent));
            if (messages != null && !messages.isEmpty()) {
                writer.upsertMessages(session.id(), messages);
            }
            session.checkpointRecorded(trimmed);
            SessionSnapshot snapshot = session.snapshot();
            writer.sessionUpdated(snapshot);
            return new CheckpointReceipt(session.id(), seq, at, trimmed, recent,
                    snapshot.toolCount(), snapshot.checkpointCount(), snapshot.errorCount());
        }
    }

    /**
     * True exactly once each time the session's counted operations since the last checkpoint
     * reach a multiple of the reminder interval.
     */
    public boolean shouldRemind(String sessionId) {
        Session session = ensureSession(sessionId);
        synchronized (session) {
            return session.reminder().shouldRemind();
        }
    }

    /**
     * Stores who is driving the session and why.
     */
    public void attributeUser(String sessionId, String userName, String purpose, boolean telemetryEnabled) {
        Session session = ensureSession(sessionId);
        synchronized (session) {
            session.attribute(userName, purpose, telemetryEnabled);
            writer.sessionUpdated(session.snapshot());
        }
    }

    public Optional<SessionSnapshot> snapshot(String sessionId) {
        String id = sessionId == null || sessionId.isBlank() ? defaultSessionId : sessionId;
        Session session = sessions.get(id);
        if (session == null) {
            return Optional.empty();
        }
        synchronized (session) {
            return Optional.of(session.snapshot());
        }
    }

    public int sessionCount() {
        return sessions.size();
    }
}
