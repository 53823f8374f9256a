package com.civicgate.database;

import com.civicgate.eventmodel.CallPayload;
import com.civicgate.eventmodel.CheckpointPayload;
import com.civicgate.eventmodel.EventWriter;
import com.civicgate.eventmodel.MessageTurn;
import com.civicgate.eventmodel.ResultPayload;
import com.civicgate.eventmodel.SessionSnapshot;
import com.civicgate.eventmodel.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Session telemetry in PostgreSQL, plus the dashboard queries over it.
 * <p>
 * The sink starts enabled when it has a data source and is disabled for the rest of the
 * process on the first failure to obtain a connection. Writes never throw: while disabled
 * they do nothing, and statement failures are logged. Reads against a disabled sink throw
 * {@link SinkUnavailableException}.
 */
public class RelationalSink implements EventWriter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RelationalSink.class);

    static final int MAX_PAGE_SIZE = 500;

    private static final String INSERT_SESSION =
            "INSERT INTO sessions (id, started_at, environment, transport) VALUES (?,?,?,?) "
                    + "ON CONFLICT (id) DO NOTHING";
    private static final String UPDATE_SESSION =
            "UPDATE sessions SET environment=?, user_name=?, user_purpose=?, tool_count=?, checkpoint_count=?, "
                    + "error_count=?, tool_sequence=?, last_checkpoint_summary=?, updated_at=NOW() WHERE id=?";
    private static final String INSERT_EVENT =
            "INSERT INTO events (session_id, seq, ts, type, tool, args, duration_ms, is_error, result_summary, "
                    + "error_message, summary, recent_tools) VALUES (?,?,?,?,?,?::jsonb,?,?,?,?,?,?) "
                    + "ON CONFLICT (session_id, seq, type) DO NOTHING";
    private static final String UPSERT_MESSAGE =
            "INSERT INTO messages (session_id, turn, role, content, ts) VALUES (?,?,?,?::jsonb,NOW()) "
                    + "ON CONFLICT (session_id, turn) DO UPDATE SET role=EXCLUDED.role, content=EXCLUDED.content, "
                    + "ts=NOW()";
    private static final String SELECT_STATS =
            "SELECT COUNT(*) AS total_sessions, COALESCE(SUM(tool_count),0) AS total_tools, "
                    + "COALESCE(SUM(error_count),0) AS total_errors, "
                    + "COALESCE(SUM(checkpoint_count),0) AS total_checkpoints FROM sessions";
    private static final String SELECT_SESSIONS =
            "SELECT " + SessionRows.SESSION_COLUMNS + " FROM sessions ORDER BY started_at DESC LIMIT ? OFFSET ?";
    private static final String SELECT_SESSION =
            "SELECT " + SessionRows.SESSION_COLUMNS + " FROM sessions WHERE id=?";
    private static final String SELECT_EVENTS =
            "SELECT " + SessionRows.EVENT_COLUMNS + " FROM events WHERE session_id=? "
                    + "ORDER BY seq, CASE type WHEN 'tool_result' THEN 1 ELSE 0 END";
    private static final String SELECT_MESSAGES =
            "SELECT turn, role, content FROM messages WHERE session_id=? ORDER BY turn";

    private final DataSource dataSource;
    private final AtomicBoolean enabled;

    /**
     * @param dataSource pooled connections, or null for a sink that is disabled from the start
     */
    public RelationalSink(DataSource dataSource) {
        this.dataSource = dataSource;
        this.enabled = new AtomicBoolean(dataSource != null);
    }

    public static RelationalSink disabled() {
        return new RelationalSink(null);
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    // ── Writes ──

    @Override
    public void sessionStarted(SessionSnapshot snapshot) {
        write("session start", c -> {
            try (PreparedStatement ps = c.prepareStatement(INSERT_SESSION)) {
                ps.setString(1, snapshot.id());
                ps.setTimestamp(2, Timestamp.from(snapshot.startedAt()));
                ps.setString(3, nullToEmpty(snapshot.environment()));
                ps.setString(4, snapshot.transport() == null ? "http" : snapshot.transport());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public void sessionUpdated(SessionSnapshot snapshot) {
        write("session update", c -> {
            try (PreparedStatement ps = c.prepareStatement(UPDATE_SESSION)) {
                ps.setString(1, nullToEmpty(snapshot.environment()));
                ps.setString(2, snapshot.userName());
                ps.setString(3, snapshot.purpose());
                ps.setInt(4, snapshot.toolCount());
                ps.setInt(5, snapshot.checkpointCount());
                ps.setInt(6, snapshot.errorCount());
                ps.setArray(7, c.createArrayOf("text", snapshot.toolSequence().toArray()));
                ps.setString(8, snapshot.lastCheckpointSummary());
                ps.setString(9, snapshot.id());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public void append(TelemetryEvent event) {
        write("event " + event.kind().value(), c -> {
            try (PreparedStatement ps = c.prepareStatement(INSERT_EVENT)) {
                bindEvent(c, ps, event);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public void upsertMessages(String sessionId, List<MessageTurn> turns) {
        if (turns == null || turns.isEmpty()) {
            return;
        }
        write("messages", c -> {
            try (PreparedStatement ps = c.prepareStatement(UPSERT_MESSAGE)) {
                for (MessageTurn turn : turns) {
                    ps.setString(1, sessionId);
                    ps.setInt(2, turn.turn());
                    ps.setString(3, turn.role());
                    ps.setString(4, SessionRows.toJson(turn.content()));
                    ps.addBatch();
                }
                return ps.executeBatch().length;
            }
        });
    }

    // ── Reads ──

    public SessionStats stats() {
        return read("stats", c -> {
            try (PreparedStatement ps = c.prepareStatement(SELECT_STATS);
                 ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return new SessionStats(0, 0, 0, 0);
                }
                return new SessionStats(rs.getLong("total_sessions"), rs.getLong("total_tools"),
                        rs.getLong("total_errors"), rs.getLong("total_checkpoints"));
            }
        });
    }

    /**
     * Lists sessions newest first. The limit is clamped to 1..500 and the offset to 0 or more.
     */
    public SessionPage listSessions(int limit, int offset) {
        int pageSize = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        int skip = Math.max(0, offset);
        return read("sessions", c -> {
            List<SessionSnapshot> sessions = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(SELECT_SESSIONS)) {
                ps.setInt(1, pageSize);
                ps.setInt(2, skip);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        sessions.add(SessionRows.session(rs));
                    }
                }
            }
            return new SessionPage(sessions, pageSize, skip);
        });
    }

    public SessionTimeline timeline(String sessionId) {
        return read("timeline", c -> {
            SessionSnapshot session = null;
            try (PreparedStatement ps = c.prepareStatement(SELECT_SESSION)) {
                ps.setString(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        session = SessionRows.session(rs);
                    }
                }
            }
            List<TelemetryEvent> events = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(SELECT_EVENTS)) {
                ps.setString(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        events.add(SessionRows.event(sessionId, rs));
                    }
                }
            }
            List<MessageTurn> messages = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(SELECT_MESSAGES)) {
                ps.setString(1, sessionId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        messages.add(SessionRows.message(rs));
                    }
                }
            }
            return new SessionTimeline(session, events, messages);
        });
    }

    /**
     * Disables the sink and closes the pool if it owns one.
     */
    @Override
    public void close() {
        enabled.set(false);
        if (dataSource instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Closing the session database pool failed: {}", e.getMessage());
            }
        }
    }

    // ── Private Helpers ──

    private void write(String what, JdbcWork<?> work) {
        if (!enabled.get()) {
            return;
        }
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            disable(e);
            return;
        }
        try (connection) {
            work.run(connection);
        } catch (SQLException e) {
            log.warn("Session database write failed ({}): {}", what, e.getMessage());
        }
    }

    private <T> T read(String what, JdbcWork<T> work) {
        if (!enabled.get()) {
            throw new SinkUnavailableException();
        }
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            disable(e);
            throw new SinkUnavailableException();
        }
        try (connection) {
            return work.run(connection);
        } catch (SQLException e) {
            throw new SessionQueryException("Session query failed: " + what, e);
        }
    }

    private void disable(SQLException cause) {
        if (enabled.compareAndSet(true, false)) {
            log.error("Session database unreachable, sessions will not be persisted this run: {}",
                    cause.getMessage());
        }
    }

    private static void bindEvent(Connection c, PreparedStatement ps, TelemetryEvent event) throws SQLException {
        ps.setString(1, event.sessionId());
        ps.setLong(2, event.seq());
        ps.setTimestamp(3, Timestamp.from(event.timestamp()));
        ps.setString(4, event.kind().value());
        for (int i = 5; i <= 12; i++) {
            ps.setNull(i, i == 12 ? Types.ARRAY : Types.VARCHAR);
        }
        if (event.payload() instanceof CallPayload call) {
            ps.setString(5, call.tool());
            ps.setString(6, SessionRows.toJson(call.args()));
        } else if (event.payload() instanceof ResultPayload result) {
            ps.setString(5, result.tool());
            ps.setLong(7, result.durationMs());
            ps.setBoolean(8, result.isError());
            ps.setString(9, result.resultSummary());
            ps.setString(10, result.errorMessage());
        } else if (event.payload() instanceof CheckpointPayload checkpoint) {
            ps.setString(11, checkpoint.summary());
            ps.setArray(12, c.createArrayOf("text", checkpoint.recentTools().toArray()));
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @FunctionalInterface
    private interface JdbcWork<T> {
        T run(Connection connection) throws SQLException;
    }
}
