package com.civicgate.database;

import com.civicgate.eventmodel.CallPayload;
import com.civicgate.eventmodel.CheckpointPayload;
import com.civicgate.eventmodel.MessageTurn;
import com.civicgate.eventmodel.ResultPayload;
import com.civicgate.eventmodel.SessionSnapshot;
import com.civicgate.eventmodel.TelemetryEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("RelationalSink")
class RelationalSinkTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private DataSource dataSource;
    private Connection connection;
    private PreparedStatement statement;
    private RelationalSink sink;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        sink = new RelationalSink(dataSource);
    }

    private static SessionSnapshot snapshot() {
        return new SessionSnapshot("s-1", NOW, "chakshu-digit", "http", "alice", "setup tenant", true,
                3, 1, 0, List.of("configure", "mdms_search"), "configured tenant");
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("should insert a call event with its arguments as JSON")
        void shouldInsertCall() throws SQLException {
            var event = new TelemetryEvent("s-1", 4, NOW,
                    new CallPayload("configure", Map.of("username", "ADMIN", "password", "***")));

            sink.append(event);

            verify(connection).prepareStatement(contains("INSERT INTO events"));
            verify(statement).setString(1, "s-1");
            verify(statement).setLong(2, 4L);
            verify(statement).setTimestamp(3, Timestamp.from(NOW));
            verify(statement).setString(4, "tool_call");
            verify(statement).setString(5, "configure");
            verify(statement).setString(org.mockito.ArgumentMatchers.eq(6), contains("\"password\":\"***\""));
            verify(statement).executeUpdate();
            verify(connection).close();
        }

        @Test
        @DisplayName("should bind result columns")
        void shouldInsertResult() throws SQLException {
            sink.append(new TelemetryEvent("s-1", 4, NOW,
                    new ResultPayload("mdms_search", 12, true, null, "timeout")));

            verify(statement).setString(4, "tool_result");
            verify(statement).setLong(7, 12L);
            verify(statement).setBoolean(8, true);
            verify(statement).setString(10, "timeout");
        }

        @Test
        @DisplayName("should update session counters")
        void shouldUpdateSession() throws SQLException {
            sink.sessionUpdated(snapshot());

            verify(connection).prepareStatement(contains("UPDATE sessions SET"));
            verify(statement).setString(2, "alice");
            verify(statement).setInt(4, 3);
            verify(statement).setString(9, "s-1");
        }

        @Test
        @DisplayName("should upsert message turns in one batch")
        void shouldUpsertMessages() throws SQLException {
            when(statement.executeBatch()).thenReturn(new int[] {1, 1});

            sink.upsertMessages("s-1", List.of(
                    new MessageTurn(1, "user", List.of(Map.of("type", "text", "text", "hi"))),
                    new MessageTurn(2, "assistant", "ok")));

            verify(connection).prepareStatement(contains("ON CONFLICT (session_id, turn) DO UPDATE"));
            verify(statement, times(2)).addBatch();
            verify(statement).executeBatch();
        }

        @Test
        @DisplayName("should skip an empty message list")
        void shouldSkipEmptyMessages() {
            sink.upsertMessages("s-1", List.of());

            verifyNoInteractions(dataSource);
        }

        @Test
        @DisplayName("should log and stay enabled when a statement fails")
        void shouldSurviveStatementFailure() throws SQLException {
            when(statement.executeUpdate()).thenThrow(new SQLException("duplicate key"));

            assertThatCode(() -> sink.sessionStarted(snapshot())).doesNotThrowAnyException();

            assertThat(sink.isEnabled()).isTrue();
        }
    }

    @Nested
    @DisplayName("Degradation")
    class Degradation {

        @Test
        @DisplayName("should disable itself on the first connection failure")
        void shouldDisableOnConnectionFailure() throws SQLException {
            when(dataSource.getConnection()).thenThrow(new SQLTransientConnectionException("refused"));

            assertThatCode(() -> sink.append(new TelemetryEvent("s-1", 1, NOW,
                    new CheckpointPayload("done", List.of())))).doesNotThrowAnyException();
            sink.sessionUpdated(snapshot());

            assertThat(sink.isEnabled()).isFalse();
            verify(dataSource, times(1)).getConnection();
        }

        @Test
        @DisplayName("should raise the same error on every read while disabled")
        void shouldRaiseConsistentReadError() {
            RelationalSink disabled = RelationalSink.disabled();

            assertThatThrownBy(disabled::stats)
                    .isInstanceOf(SinkUnavailableException.class)
                    .hasMessage("Session database not available");
            assertThatThrownBy(() -> disabled.listSessions(10, 0))
                    .isInstanceOf(SinkUnavailableException.class)
                    .hasMessage("Session database not available");
            assertThatThrownBy(() -> disabled.timeline("s-1"))
                    .isInstanceOf(SinkUnavailableException.class)
                    .hasMessage("Session database not available");
        }

        @Test
        @DisplayName("should turn a read connection failure into the unavailable error")
        void shouldDisableOnReadFailure() throws SQLException {
            when(dataSource.getConnection()).thenThrow(new SQLTransientConnectionException("refused"));

            assertThatThrownBy(sink::stats).isInstanceOf(SinkUnavailableException.class);
            assertThat(sink.isEnabled()).isFalse();
        }

        @Test
        @DisplayName("should report a failed query on a reachable database as a query error")
        void shouldWrapQueryFailure() throws SQLException {
            when(statement.executeQuery()).thenThrow(new SQLException("relation does not exist"));

            assertThatThrownBy(sink::stats)
                    .isInstanceOf(SessionQueryException.class)
                    .hasMessageContaining("stats");
            assertThat(sink.isEnabled()).isTrue();
        }

        @Test
        @DisplayName("should not touch the pool after close")
        void shouldStopAfterClose() {
            sink.close();

            sink.sessionStarted(snapshot());

            assertThat(sink.isEnabled()).isFalse();
            verifyNoInteractions(dataSource);
        }
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("should read totals")
        void shouldReadStats() throws SQLException {
            ResultSet rs = mock(ResultSet.class);
            when(statement.executeQuery()).thenReturn(rs);
            when(rs.next()).thenReturn(true);
            when(rs.getLong("total_sessions")).thenReturn(4L);
            when(rs.getLong("total_tools")).thenReturn(40L);
            when(rs.getLong("total_errors")).thenReturn(2L);
            when(rs.getLong("total_checkpoints")).thenReturn(5L);

            assertThat(sink.stats()).isEqualTo(new SessionStats(4, 40, 2, 5));
        }

        @Test
        @DisplayName("should clamp page bounds")
        void shouldClampPage() throws SQLException {
            ResultSet rs = mock(ResultSet.class);
            when(statement.executeQuery()).thenReturn(rs);

            SessionPage page = sink.listSessions(10_000, -3);

            assertThat(page.limit()).isEqualTo(RelationalSink.MAX_PAGE_SIZE);
            assertThat(page.offset()).isZero();
            assertThat(page.sessions()).isEmpty();
            verify(statement).setInt(1, RelationalSink.MAX_PAGE_SIZE);
            verify(statement).setInt(2, 0);
        }

        @Test
        @DisplayName("should map a session row")
        void shouldMapSessionRow() throws SQLException {
            ResultSet rs = mock(ResultSet.class);
            java.sql.Array sequence = mock(java.sql.Array.class);
            when(statement.executeQuery()).thenReturn(rs);
            when(rs.next()).thenReturn(true, false);
            when(rs.getString("id")).thenReturn("s-9");
            when(rs.getTimestamp("started_at")).thenReturn(Timestamp.from(NOW));
            when(rs.getString("transport")).thenReturn("http");
            when(rs.getInt("tool_count")).thenReturn(2);
            when(rs.getArray("tool_sequence")).thenReturn(sequence);
            when(sequence.getArray()).thenReturn(new String[] {"init", "configure"});

            SessionPage page = sink.listSessions(20, 0);

            assertThat(page.sessions()).hasSize(1);
            SessionSnapshot row = page.sessions().get(0);
            assertThat(row.id()).isEqualTo("s-9");
            assertThat(row.startedAt()).isEqualTo(NOW);
            assertThat(row.toolCount()).isEqualTo(2);
            assertThat(row.toolSequence()).containsExactly("init", "configure");
        }

        @Test
        @DisplayName("should return an empty timeline for an unknown session")
        void shouldReturnEmptyTimeline() throws SQLException {
            ResultSet rs = mock(ResultSet.class);
            when(statement.executeQuery()).thenReturn(rs);

            SessionTimeline timeline = sink.timeline("missing");

            assertThat(timeline.session()).isNull();
            assertThat(timeline.events()).isEmpty();
            assertThat(timeline.messages()).isEmpty();
            verify(statement, never()).executeUpdate();
        }
    }
}
