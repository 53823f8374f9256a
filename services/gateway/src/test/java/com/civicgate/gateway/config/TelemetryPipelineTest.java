package com.civicgate.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.civicgate.database.RelationalSink;
import com.civicgate.eventmodel.CallPayload;
import com.civicgate.eventmodel.EventSerializer;
import com.civicgate.observability.SensitiveDataRedactor;
import com.civicgate.telemetry.JsonLinesEventLog;
import com.civicgate.telemetry.SessionTelemetry;
import com.civicgate.telemetry.TelemetrySettings;
import com.civicgate.telemetry.TwoTierEventWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

@DisplayName("Telemetry pipeline")
class TelemetryPipelineTest {

    @TempDir
    Path dataDir;

    @Test
    @DisplayName("should store redacted call arguments in both the log file and the session database")
    void shouldRedactAcrossBothTiers() throws Exception {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        PreparedStatement statement = mock(PreparedStatement.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        RelationalSink sink = new RelationalSink(dataSource);

        try (JsonLinesEventLog log = new JsonLinesEventLog(dataDir)) {
            TwoTierEventWriter writer = new TwoTierEventWriter(log, sink, sink::isEnabled,
                    TwoTierEventWriter.DEFAULT_QUEUE_CAPACITY, null);
            SessionTelemetry telemetry = new SessionTelemetry(writer, new SensitiveDataRedactor(),
                    TelemetrySettings.defaults("dev"), Clock.systemUTC());

            telemetry.recordCall("s-1", "configure",
                    Map.of("username", "ADMIN", "password", "eGov@123", "tenant_id", "pg"));
            writer.close();
        }

        List<String> lines = Files.readAllLines(dataDir.resolve(JsonLinesEventLog.EVENTS_FILE));
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0)).doesNotContain("eGov@123");
        CallPayload logged = (CallPayload) EventSerializer.fromJsonLine(lines.get(0)).payload();
        assertThat(logged.args())
                .containsEntry("username", "ADMIN")
                .containsEntry("password", "***")
                .containsEntry("tenant_id", "pg");

        ArgumentCaptor<String> argsColumn = ArgumentCaptor.forClass(String.class);
        verify(statement).setString(eq(6), argsColumn.capture());
        assertThat(argsColumn.getValue())
                .contains("\"password\":\"***\"")
                .contains("\"username\":\"ADMIN\"")
                .doesNotContain("eGov@123");
    }
}
