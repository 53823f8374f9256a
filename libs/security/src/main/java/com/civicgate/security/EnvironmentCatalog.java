package com.civicgate.security;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The platform environments the gateway is configured for, in declaration order.
 */
public final class EnvironmentCatalog {

    private final Map<String, PlatformEnvironment> environments;

    public EnvironmentCatalog(List<PlatformEnvironment> environments) {
        if (environments == null || environments.isEmpty()) {
            throw new IllegalArgumentException("at least one environment must be configured");
        }
        Map<String, PlatformEnvironment> byKey = new LinkedHashMap<>();
        for (PlatformEnvironment env : environments) {
            if (byKey.putIfAbsent(env.key(), env) != null) {
                throw new IllegalArgumentException("Duplicate environment key: " + env.key());
            }
        }
        this.environments = byKey;
    }

    /**
     * @throws IllegalArgumentException naming the available keys when {@code key} is unknown
     */
    public PlatformEnvironment get(String key) {
        PlatformEnvironment env = environments.get(key);
        if (env == null) {
            throw new IllegalArgumentException("Unknown environment: " + key
                    + ". Available: " + String.join(", ", environments.keySet()));
        }
        return env;
    }

    public boolean contains(String key) {
        return environments.containsKey(key);
    }

    public List<PlatformEnvironment> all() {
        return List.copyOf(environments.values());
    }
}
