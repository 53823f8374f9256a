package com.civicgate.gateway.config;

import com.civicgate.security.Credentials;
import com.civicgate.security.EnvironmentCatalog;
import com.civicgate.security.PlatformEnvironment;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the civic services platform, bound from {@code civicgate.platform.*}.
 *
 * <p>Environment entries are keyed by the name callers pass to {@code configure}. Endpoint
 * override keys must be bracketed in YAML ({@code "[MDMS_SEARCH]"}) so Boot keeps them verbatim.
 *
 * @param oauthClientId OAuth client used for password logins.
 * @param oauthClientSecret Secret of the OAuth client; often empty.
 * @param requestTimeout Timeout of each identity call.
 * @param defaultUsername Username for lazy logins (nullable).
 * @param defaultPassword Password for lazy logins (nullable).
 * @param defaultTenant Tenant for lazy logins; the environment's state tenant when blank.
 * @param environments Environment catalog. At least one entry.
 */
@ConfigurationProperties(prefix = "civicgate.platform")
@Validated
public record PlatformProperties(
        String oauthClientId,
        String oauthClientSecret,
        Duration requestTimeout,
        String defaultUsername,
        String defaultPassword,
        String defaultTenant,
        @NotEmpty Map<String, @Valid EnvironmentProperties> environments) {

    public PlatformProperties {
        if (oauthClientId == null || oauthClientId.isBlank()) {
            oauthClientId = "egov-user-client";
        }
        if (oauthClientSecret == null) {
            oauthClientSecret = "";
        }
        if (requestTimeout == null) {
            requestTimeout = Duration.ofSeconds(30);
        }
        environments = environments == null ? Map.of() : new LinkedHashMap<>(environments);
    }

    /**
     * Credentials used when an operation needs a login and none has happened yet.
     */
    public Credentials defaultCredentials() {
        return new Credentials(defaultUsername, defaultPassword);
    }

    /**
     * Builds the environment catalog, validating endpoint overrides.
     *
     * @throws IllegalArgumentException if an entry is incomplete or overrides an unknown endpoint
     */
    public EnvironmentCatalog toCatalog() {
        List<PlatformEnvironment> list = new ArrayList<>();
        environments.forEach((key, env) -> list.add(new PlatformEnvironment(key, env.name(), env.url(),
                env.stateTenantId(), env.description(), env.endpointOverrides())));
        return new EnvironmentCatalog(list);
    }

    /**
     * One platform deployment.
     */
    public record EnvironmentProperties(
            String name,
            @NotBlank String url,
            @NotBlank String stateTenantId,
            String description,
            Map<String, String> endpointOverrides) {
    }
}
