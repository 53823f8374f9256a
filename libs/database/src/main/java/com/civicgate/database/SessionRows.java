package com.civicgate.database;

import com.civicgate.eventmodel.CallPayload;
import com.civicgate.eventmodel.CheckpointPayload;
import com.civicgate.eventmodel.EventKind;
import com.civicgate.eventmodel.EventPayload;
import com.civicgate.eventmodel.EventSerializer;
import com.civicgate.eventmodel.MessageTurn;
import com.civicgate.eventmodel.ResultPayload;
import com.civicgate.eventmodel.SessionSnapshot;
import com.civicgate.eventmodel.TelemetryEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Row mapping between the session tables and the event model.
 */
final class SessionRows {

    static final String SESSION_COLUMNS = "id, started_at, environment, transport, user_name, user_purpose, "
            + "tool_count, checkpoint_count, error_count, tool_sequence, last_checkpoint_summary";
    static final String EVENT_COLUMNS = "seq, ts, type, tool, args, duration_ms, is_error, result_summary, "
            + "error_message, summary, recent_tools";

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    private SessionRows() {
        // utility class
    }

    static SessionSnapshot session(ResultSet rs) throws SQLException {
        Timestamp started = rs.getTimestamp("started_at");
        return new SessionSnapshot(
                rs.getString("id"),
                started == null ? null : started.toInstant(),
                rs.getString("environment"),
                rs.getString("transport"),
                rs.getString("user_name"),
                rs.getString("user_purpose"),
                null,
                rs.getInt("tool_count"),
                rs.getInt("checkpoint_count"),
                rs.getInt("error_count"),
                strings(rs.getArray("tool_sequence")),
                rs.getString("last_checkpoint_summary"));
    }

    static TelemetryEvent event(String sessionId, ResultSet rs) throws SQLException {
        String type = rs.getString("type");
        EventKind kind = EventKind.fromString(type)
                .orElseThrow(() -> new SQLException("Unknown event type: " + type));
        EventPayload payload = switch (kind) {
            case CALL -> new CallPayload(rs.getString("tool"), fromJson(rs.getString("args"), ARGS_TYPE));
            case RESULT -> new ResultPayload(rs.getString("tool"), rs.getLong("duration_ms"),
                    rs.getBoolean("is_error"), rs.getString("result_summary"), rs.getString("error_message"));
            case CHECKPOINT -> new CheckpointPayload(rs.getString("summary"), strings(rs.getArray("recent_tools")));
        };
        return new TelemetryEvent(sessionId, rs.getLong("seq"), rs.getTimestamp("ts").toInstant(), payload);
    }

    static MessageTurn message(ResultSet rs) throws SQLException {
        return new MessageTurn(rs.getInt("turn"), rs.getString("role"),
                fromJson(rs.getString("content"), new TypeReference<Object>() {
                }));
    }

    static String toJson(Object value) throws SQLException {
        try {
            return EventSerializer.objectMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SQLException("Value cannot be written as JSON", e);
        }
    }

    private static <T> T fromJson(String json, TypeReference<T> type) throws SQLException {
        if (json == null) {
            return null;
        }
        try {
            return EventSerializer.objectMapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Stored JSON cannot be read", e);
        }
    }

    private static List<String> strings(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        Object[] values = (Object[]) array.getArray();
        return Arrays.stream(values).map(String::valueOf).toList();
    }
}
