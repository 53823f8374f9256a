package com.civicgate.database;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the session database.
 *
 * <pre>{@code
 * civicgate:
 *   session-db:
 *     enabled: true
 *     url: jdbc:postgresql://localhost:15433/mcp_sessions
 *     username: mcp
 *     password: mcp123
 *     pool-size: 5
 *     locations: classpath:db/migration/sessions
 * }</pre>
 *
 * @param enabled   whether to connect at all; a disabled database behaves like an unreachable one
 * @param url       JDBC URL
 * @param username  database user
 * @param password  database password
 * @param poolSize  maximum pooled connections
 * @param locations Flyway migration locations
 */
@Validated
@ConfigurationProperties(prefix = "civicgate.session-db")
public record SessionDatabaseProperties(
        boolean enabled,
        String url,
        String username,
        String password,
        @Min(1) @Max(50) Integer poolSize,
        String locations) {

    public static final int DEFAULT_POOL_SIZE = 5;
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/sessions";

    public SessionDatabaseProperties {
        poolSize = poolSize == null ? DEFAULT_POOL_SIZE : poolSize;
        locations = locations == null || locations.isBlank() ? DEFAULT_LOCATIONS : locations;
    }

    /**
     * True when the database is enabled and a URL is present.
     */
    public boolean usable() {
        return enabled && url != null && !url.isBlank();
    }
}
