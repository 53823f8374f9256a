package com.civicgate.database;

import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.springframework.boot.jdbc.DataSourceBuilder;

import javax.sql.DataSource;

/**
 * Builds the session database pool and brings its schema up to date.
 * <p>
 * A POJO: the gateway calls it from its configuration, tests call it directly.
 */
public final class SessionSchemaMigrator {

    private SessionSchemaMigrator() {
        // utility class
    }

    /**
     * Creates a Hikari pool sized from the properties. No connection is opened yet.
     */
    public static HikariDataSource createDataSource(SessionDatabaseProperties properties) {
        HikariDataSource dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
        dataSource.setMaximumPoolSize(properties.poolSize());
        dataSource.setPoolName("session-db");
        dataSource.setIdleTimeout(30_000);
        return dataSource;
    }

    /**
     * Configures Flyway for the session schema.
     */
    public static Flyway flyway(DataSource dataSource, String locations) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(locations)
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }

    /**
     * Applies pending migrations and returns the number applied.
     *
     * @throws org.flywaydb.core.api.FlywayException if the database is unreachable or a migration fails
     */
    public static int migrate(DataSource dataSource, String locations) {
        MigrateResult result = flyway(dataSource, locations).migrate();
        return result.migrationsExecuted;
    }
}
