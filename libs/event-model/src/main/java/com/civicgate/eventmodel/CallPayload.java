package com.civicgate.eventmodel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An operation invocation.
 *
 * @param tool operation name
 * @param args redacted arguments, never the raw ones
 */
public record CallPayload(String tool, Map<String, Object> args) implements EventPayload {

    public CallPayload {
        if (tool == null || tool.isBlank()) {
            throw new IllegalArgumentException("tool must not be null or blank");
        }
        // LinkedHashMap keeps argument order and tolerates null values from JSON
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    @Override
    public EventKind kind() {
        return EventKind.CALL;
    }
}
