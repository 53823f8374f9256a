package com.civicgate.database;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RelationalSink}.
 * <p>
 * When the database is disabled, unconfigured, or unreachable at startup, the sink is created
 * disabled and the service starts anyway. Services importing this configuration should turn
 * off Spring Boot's own DataSource and Flyway auto-configuration.
 */
@Configuration
@EnableConfigurationProperties(SessionDatabaseProperties.class)
public class SessionDatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionDatabaseConfig.class);

    @Bean
    public RelationalSink relationalSink(SessionDatabaseProperties properties) {
        return open(properties);
    }

    /**
     * Opens the sink: builds the pool, runs migrations, and falls back to a disabled sink on failure.
     */
    public static RelationalSink open(SessionDatabaseProperties properties) {
        if (!properties.usable()) {
            log.info("Session database disabled; sessions are kept in the append-only log only");
            return RelationalSink.disabled();
        }
        HikariDataSource dataSource = SessionSchemaMigrator.createDataSource(properties);
        try {
            int applied = SessionSchemaMigrator.migrate(dataSource, properties.locations());
            log.info("Session database ready ({} migration(s) applied)", applied);
            return new RelationalSink(dataSource);
        } catch (RuntimeException e) {
            log.error("Failed to connect to the session database, sessions will NOT be persisted this run: {}",
                    e.getMessage());
            dataSource.close();
            return RelationalSink.disabled();
        }
    }
}
