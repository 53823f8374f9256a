package com.civicgate.security;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A deployment of the platform the gateway can talk to.
 *
 * @param key               catalog key (e.g. "chakshu-digit")
 * @param name              display name
 * @param url               base URL, without trailing slash
 * @param stateTenantId     default state tenant
 * @param description       free text
 * @param endpointOverrides paths replacing {@link PlatformEndpoint} defaults, keyed by endpoint name
 */
public record PlatformEnvironment(
        String key,
        String name,
        String url,
        String stateTenantId,
        String description,
        Map<String, String> endpointOverrides
) {

    public PlatformEnvironment {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null or blank");
        }
        if (stateTenantId == null || stateTenantId.isBlank()) {
            throw new IllegalArgumentException("stateTenantId must not be null or blank");
        }
        endpointOverrides = endpointOverrides == null ? Map.of() : Map.copyOf(endpointOverrides);

        List<String> invalid = new ArrayList<>();
        for (String overrideKey : endpointOverrides.keySet()) {
            if (PlatformEndpoint.fromKey(overrideKey).isEmpty()) {
                invalid.add(overrideKey);
            }
        }
        if (!invalid.isEmpty()) {
            throw new IllegalArgumentException("Invalid endpoint override key(s) " + invalid
                    + " in environment \"" + key + "\". Valid keys: "
                    + Arrays.stream(PlatformEndpoint.values()).map(Enum::name).collect(Collectors.joining(", ")));
        }
        url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        name = name == null ? key : name;
    }

    /**
     * Returns the absolute URL of {@code endpoint}, honouring overrides.
     */
    public String endpointUrl(PlatformEndpoint endpoint) {
        return url + endpointOverrides.getOrDefault(endpoint.name(), endpoint.defaultPath());
    }
}
