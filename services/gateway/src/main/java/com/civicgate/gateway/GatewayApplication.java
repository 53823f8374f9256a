package com.civicgate.gateway;

import com.civicgate.database.SessionDatabaseConfig;
import com.civicgate.gateway.config.GatewayProperties;
import com.civicgate.gateway.config.PlatformProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Civic Gateway: exposes the platform's operations to an automated caller.
 *
 * <p>The session database is optional. Its pool and migrations are owned by {@link
 * SessionDatabaseConfig}, so Boot's own datasource and Flyway auto-configuration stay off; the
 * gateway starts without a database and reports itself degraded.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@EnableConfigurationProperties({GatewayProperties.class, PlatformProperties.class})
@Import(SessionDatabaseConfig.class)
public class GatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(GatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
        log.info("Civic Gateway started");
    }
}
