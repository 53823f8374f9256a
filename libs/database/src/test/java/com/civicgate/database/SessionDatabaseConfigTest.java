package com.civicgate.database;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SessionDatabaseConfig")
class SessionDatabaseConfigTest {

    @Nested
    @DisplayName("Properties")
    class Properties {

        @Test
        @DisplayName("should default pool size and migration locations")
        void shouldApplyDefaults() {
            var props = new SessionDatabaseProperties(true, "jdbc:postgresql://db/sessions", "mcp", null, null, " ");

            assertThat(props.poolSize()).isEqualTo(5);
            assertThat(props.locations()).isEqualTo("classpath:db/migration/sessions");
            assertThat(props.usable()).isTrue();
        }

        @Test
        @DisplayName("should not be usable without a URL")
        void shouldRequireUrl() {
            assertThat(new SessionDatabaseProperties(true, "", "mcp", null, 3, null).usable()).isFalse();
            assertThat(new SessionDatabaseProperties(false, "jdbc:postgresql://db/x", null, null, 3, null).usable())
                    .isFalse();
        }
    }

    @Nested
    @DisplayName("open")
    class Open {

        @Test
        @DisplayName("should return a disabled sink when the database is switched off")
        void shouldReturnDisabledSink() {
            var sink = SessionDatabaseConfig.open(new SessionDatabaseProperties(false, null, null, null, null, null));

            assertThat(sink.isEnabled()).isFalse();
        }

        @Test
        @DisplayName("should start disabled when the database cannot be reached")
        void shouldFallBackWhenUnreachable() {
            var props = new SessionDatabaseProperties(true, "jdbc:postgresql://127.0.0.1:1/sessions",
                    "mcp", "mcp123", 1, null);

            var sink = SessionDatabaseConfig.open(props);

            assertThat(sink.isEnabled()).isFalse();
        }
    }

    @Nested
    @DisplayName("Migration resources")
    class MigrationResources {

        @Test
        @DisplayName("V1__session_telemetry.sql creates the three session tables")
        void schemaCreatesTables() throws IOException {
            try (InputStream is = getClass().getClassLoader()
                    .getResourceAsStream("db/migration/sessions/V1__session_telemetry.sql")) {
                assertThat(is).as("migration must be on the classpath").isNotNull();
                String sql = new String(is.readAllBytes(), StandardCharsets.UTF_8);

                assertThat(sql)
                        .containsIgnoringCase("CREATE TABLE IF NOT EXISTS sessions")
                        .containsIgnoringCase("CREATE TABLE IF NOT EXISTS events")
                        .containsIgnoringCase("CREATE TABLE IF NOT EXISTS messages")
                        .contains("PRIMARY KEY (session_id, turn)");
            }
        }
    }
}
