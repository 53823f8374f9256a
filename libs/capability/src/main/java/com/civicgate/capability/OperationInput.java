package com.civicgate.capability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Arguments of one dispatched call, with typed accessors for handlers.
 *
 * @param args      decoded JSON arguments as received (unredacted)
 * @param sessionId telemetry session of the call
 */
public record OperationInput(Map<String, Object> args, String sessionId) {

    public OperationInput {
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public Optional<String> string(String key) {
        Object value = args.get(key);
        return value instanceof String s && !s.isBlank() ? Optional.of(s) : Optional.empty();
    }

    public boolean bool(String key, boolean defaultValue) {
        Object value = args.get(key);
        return value instanceof Boolean b ? b : defaultValue;
    }

    /**
     * Returns the string items of a list argument; absent or non-list values give an empty list.
     */
    public List<String> strings(String key) {
        Object value = args.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    /**
     * Returns the object items of a list argument.
     */
    public List<Map<String, Object>> objects(String key) {
        Object value = args.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                Map<String, Object> copy = new LinkedHashMap<>();
                map.forEach((k, v) -> copy.put(String.valueOf(k), v));
                result.add(copy);
            }
        }
        return result;
    }
}
