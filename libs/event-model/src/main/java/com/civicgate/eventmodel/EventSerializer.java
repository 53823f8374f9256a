package com.civicgate.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON-lines codec for telemetry.
 * <p>
 * An event is written as one flat object: {@code sessionId}, {@code seq}, {@code ts},
 * {@code type} and the kind-specific fields ({@code tool}, {@code args} for a call;
 * {@code tool}, {@code durationMs}, {@code isError}, {@code resultSummary},
 * {@code errorMessage} for a result; {@code summary}, {@code recentTools} for a checkpoint).
 * Null fields are left out.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Serializes an event to a single line of JSON (no trailing newline).
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String toJsonLine(TelemetryEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("sessionId", event.sessionId());
        node.put("seq", event.seq());
        node.put("ts", event.timestamp().toString());
        node.put("type", event.kind().value());

        EventPayload payload = event.payload();
        if (payload instanceof CallPayload call) {
            node.put("tool", call.tool());
            node.set("args", MAPPER.valueToTree(call.args()));
        } else if (payload instanceof ResultPayload result) {
            node.put("tool", result.tool());
            node.put("durationMs", result.durationMs());
            node.put("isError", result.isError());
            putIfPresent(node, "resultSummary", result.resultSummary());
            putIfPresent(node, "errorMessage", result.errorMessage());
        } else if (payload instanceof CheckpointPayload checkpoint) {
            node.put("summary", checkpoint.summary());
            ArrayNode tools = node.putArray("recentTools");
            checkpoint.recentTools().forEach(tools::add);
        }
        return write(node, event.sessionId());
    }

    /**
     * Serializes a session snapshot to a single line of JSON.
     */
    public static String toJsonLine(SessionSnapshot snapshot) {
        return write(MAPPER.valueToTree(snapshot), snapshot.id());
    }

    /**
     * Parses one line written by {@link #toJsonLine(TelemetryEvent)}.
     *
     * @throws EventSerializationException if the line is malformed or has an unknown type
     */
    public static TelemetryEvent fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = text(node, "type");
            EventKind kind = EventKind.fromString(type).orElse(null);
            if (kind == null) {
                throw new EventSerializationException("Unknown event type: " + type, null);
            }
            String sessionId = text(node, "sessionId");
            long seq = node.path("seq").asLong();
            Instant ts = Instant.parse(text(node, "ts"));

            EventPayload payload = switch (kind) {
                case CALL -> new CallPayload(text(node, "tool"),
                        node.has("args") ? MAPPER.convertValue(node.get("args"), ARGS_TYPE) : Map.of());
                case RESULT -> new ResultPayload(text(node, "tool"),
                        node.path("durationMs").asLong(),
                        node.path("isError").asBoolean(false),
                        text(node, "resultSummary"),
                        text(node, "errorMessage"));
                case CHECKPOINT -> new CheckpointPayload(text(node, "summary"), strings(node.path("recentTools")));
            };
            return new TelemetryEvent(sessionId, seq, ts, payload);
        } catch (JsonProcessingException | IllegalArgumentException | DateTimeParseException | NullPointerException e) {
            throw new EventSerializationException("Failed to parse event line", e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static String write(JsonNode node, String sessionId) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize telemetry for session " + sessionId, e);
        }
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(n -> values.add(n.asText()));
        return values;
    }

    /**
     * Thrown when a telemetry line cannot be written or read.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
