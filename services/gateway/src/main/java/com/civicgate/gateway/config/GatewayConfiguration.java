package com.civicgate.gateway.config;

import com.civicgate.capability.CapabilityRegistry;
import com.civicgate.capability.GroupCatalog;
import com.civicgate.database.RelationalSink;
import com.civicgate.database.SinkUnavailableException;
import com.civicgate.gateway.dispatch.Dispatcher;
import com.civicgate.gateway.infrastructure.notify.OperationListNotifier;
import com.civicgate.gateway.infrastructure.platform.HttpPlatformIdentityClient;
import com.civicgate.gateway.operations.CoreOperations;
import com.civicgate.observability.ComponentHealth;
import com.civicgate.observability.HealthCheckRegistry;
import com.civicgate.observability.MetricFactory;
import com.civicgate.observability.OperationMetrics;
import com.civicgate.observability.OperationTracer;
import com.civicgate.observability.SensitiveDataRedactor;
import com.civicgate.security.AuthResolver;
import com.civicgate.security.PlatformIdentityClient;
import com.civicgate.telemetry.JsonLinesEventLog;
import com.civicgate.telemetry.SessionTelemetry;
import com.civicgate.telemetry.TelemetrySettings;
import com.civicgate.telemetry.TwoTierEventWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the registry, telemetry and auth resolver into the {@link Dispatcher}.
 *
 * <p>Each subsystem is a plain object built here, so tests can construct isolated instances
 * without a Spring context.
 */
@Configuration
public class GatewayConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfiguration.class);

    static final String INSTRUMENTATION_NAME = "com.civicgate.gateway";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OperationListNotifier operationListNotifier() {
        return new OperationListNotifier(0L);
    }

    @Bean
    public CapabilityRegistry capabilityRegistry(OperationListNotifier notifier) {
        CapabilityRegistry registry = new CapabilityRegistry(GroupCatalog.platformDefault());
        registry.setChangeListener(notifier);
        return registry;
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public OperationMetrics operationMetrics(MeterRegistry meterRegistry, GatewayProperties properties) {
        return new OperationMetrics(new MetricFactory(meterRegistry, properties.name()));
    }

    @Bean
    public OperationTracer operationTracer() {
        return new OperationTracer(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Bean
    public JsonLinesEventLog jsonLinesEventLog(GatewayProperties properties) {
        return new JsonLinesEventLog(Path.of(properties.sessionDataDir()));
    }

    @Bean
    public TwoTierEventWriter telemetryWriter(JsonLinesEventLog eventLog, RelationalSink relationalSink,
                                              GatewayProperties properties, OperationMetrics metrics) {
        return new TwoTierEventWriter(eventLog, relationalSink, relationalSink::isEnabled,
                properties.writerQueueCapacity(), metrics);
    }

    @Bean
    public SessionTelemetry sessionTelemetry(TwoTierEventWriter writer, SensitiveDataRedactor redactor,
                                             GatewayProperties properties, Clock clock) {
        TelemetrySettings settings = new TelemetrySettings(properties.environment(), "http",
                properties.reminderInterval(), TelemetrySettings.DEFAULT_MAX_RECENT_TOOLS,
                properties.resultSummaryLength(), properties.sessionIdleTimeout());
        return new SessionTelemetry(writer, redactor, settings, clock);
    }

    @Bean
    public PlatformIdentityClient platformIdentityClient(PlatformProperties platform, ObjectMapper objectMapper) {
        return new HttpPlatformIdentityClient(objectMapper, platform.oauthClientId(), platform.oauthClientSecret(),
                platform.requestTimeout());
    }

    @Bean
    public AuthResolver authResolver(PlatformProperties platform, GatewayProperties properties,
                                     PlatformIdentityClient identityClient) {
        return new AuthResolver(platform.toCatalog(), properties.environment(), identityClient,
                platform.defaultCredentials(), platform.defaultTenant());
    }

    @Bean
    public CoreOperations coreOperations(CapabilityRegistry registry, SessionTelemetry telemetry,
                                         AuthResolver authResolver, ObjectMapper objectMapper,
                                         GatewayProperties properties) {
        CoreOperations operations = new CoreOperations(registry, telemetry, authResolver, objectMapper);
        operations.registerAll();
        if (properties.enableAllGroups()) {
            registry.enableAll();
            log.info("All operation groups enabled at startup");
        }
        return operations;
    }

    @Bean
    public Dispatcher dispatcher(CapabilityRegistry registry, SessionTelemetry telemetry, AuthResolver authResolver,
                                 OperationTracer tracer, OperationMetrics metrics, CoreOperations coreOperations) {
        // coreOperations is a parameter so the core group is registered before the first dispatch
        log.info("Dispatcher ready with {} enabled operation(s)", registry.enabledDescriptors().size());
        return new Dispatcher(registry, telemetry, authResolver, tracer, metrics);
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(Clock clock, JsonLinesEventLog eventLog,
                                                   RelationalSink relationalSink) {
        HealthCheckRegistry registry = new HealthCheckRegistry(clock);
        registry.register("event-log", () -> Files.isWritable(eventLog.eventsFile())
                ? ComponentHealth.healthy("event-log")
                : ComponentHealth.unhealthy("event-log", "Cannot write " + eventLog.eventsFile()));
        registry.register("session-db", () -> relationalSink.isEnabled()
                ? ComponentHealth.healthy("session-db")
                : ComponentHealth.degraded("session-db", SinkUnavailableException.MESSAGE));
        return registry;
    }
}
