package com.civicgate.observability;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Redacts credential-bearing argument values before they are logged or recorded.
 * <p>
 * A value is redacted when its key equals one of the sensitive keys, ignoring case.
 * Matching is exact: {@code username} and {@code tokenType} are passed through untouched.
 * Nested maps and lists are redacted recursively, so credentials wrapped in an options
 * object or in a list of records are covered as well.
 */
public final class SensitiveDataRedactor {

    /** The replacement marker for redacted values. */
    public static final String REDACTED = "***";

    /** Keys whose values never leave process memory. */
    public static final Set<String> DEFAULT_SENSITIVE_KEYS = Set.of(
            "password", "secret", "token", "auth_token",
            "access_token", "refresh_token", "client_secret", "api_key"
    );

    private final Set<String> sensitiveKeys;

    /**
     * Creates a redactor with {@link #DEFAULT_SENSITIVE_KEYS}.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_KEYS);
    }

    /**
     * Creates a redactor with custom sensitive keys (matched case-insensitively).
     *
     * @param keys argument keys to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys must not be null");
        }
        this.sensitiveKeys = keys.stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Returns a copy of {@code args} with sensitive values replaced by {@value #REDACTED}.
     * Key order is preserved. Null input returns an empty map.
     *
     * @param args raw operation arguments
     * @return a new map safe to log and persist
     */
    public Map<String, Object> redact(Map<String, ?> args) {
        if (args == null || args.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> result = new LinkedHashMap<>(args.size());
        for (Map.Entry<String, ?> entry : args.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            result.put(key, isSensitive(key) ? REDACTED : redactValue(value));
        }
        return result;
    }

    /**
     * Checks whether a key is one of the sensitive keys.
     *
     * @param key the argument key
     * @return true if values under this key must be redacted
     */
    public boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        return sensitiveKeys.contains(key.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the lower-cased sensitive keys this redactor uses.
     */
    public Set<String> sensitiveKeys() {
        return sensitiveKeys;
    }

    private Object redactValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return redact(asStringKeyed(nested));
        }
        if (value instanceof List<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            for (Object item : items) {
                copy.add(redactValue(item));
            }
            return copy;
        }
        return value;
    }

    private static Map<String, Object> asStringKeyed(Map<?, ?> nested) {
        Map<String, Object> copy = new LinkedHashMap<>(nested.size());
        nested.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
