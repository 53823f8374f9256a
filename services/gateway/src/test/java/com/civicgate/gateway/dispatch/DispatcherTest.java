package com.civicgate.gateway.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import com.civicgate.capability.CapabilityRegistry;
import com.civicgate.capability.GroupCatalog;
import com.civicgate.capability.InputSchema;
import com.civicgate.capability.OperationDescriptor;
import com.civicgate.capability.OperationOutcome;
import com.civicgate.capability.PropertyType;
import com.civicgate.eventmodel.CallPayload;
import com.civicgate.eventmodel.EventKind;
import com.civicgate.eventmodel.ResultPayload;
import com.civicgate.eventmodel.TelemetryEvent;
import com.civicgate.observability.CorrelationContextHolder;
import com.civicgate.observability.MetricFactory;
import com.civicgate.observability.OperationMetrics;
import com.civicgate.observability.OperationTracer;
import com.civicgate.observability.SensitiveDataRedactor;
import com.civicgate.security.AuthResolver;
import com.civicgate.security.Credentials;
import com.civicgate.security.EnvironmentCatalog;
import com.civicgate.security.PlatformEnvironment;
import com.civicgate.security.RoleGrant;
import com.civicgate.security.StandardRole;
import com.civicgate.security.testing.InMemoryIdentityClient;
import com.civicgate.telemetry.SessionTelemetry;
import com.civicgate.telemetry.TelemetrySettings;
import com.civicgate.telemetry.testing.RecordingEventWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Dispatcher")
class DispatcherTest {

    private static final PlatformEnvironment DEV =
            new PlatformEnvironment("dev", "Dev", "https://dev.example.org", "pg", null, null);
    private static final Credentials ADMIN = new Credentials("ADMIN", "eGov@123");

    private final AtomicInteger mdmsInvocations = new AtomicInteger();

    private CapabilityRegistry registry;
    private RecordingEventWriter writer;
    private SessionTelemetry telemetry;
    private InMemoryIdentityClient identity;
    private SimpleMeterRegistry meterRegistry;
    private InMemorySpanExporter spanExporter;
    private SdkTracerProvider tracerProvider;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry(GroupCatalog.platformDefault());
        registry.register(OperationDescriptor.builder("echo")
                .handler(input -> OperationOutcome.success("echo:" + input.args().keySet()))
                .build());
        registry.register(OperationDescriptor.builder("explode")
                .handler(input -> {
                    throw new IllegalStateException("boom");
                })
                .build());
        registry.register(OperationDescriptor.builder("refuse")
                .handler(input -> OperationOutcome.failure("Tenant not found"))
                .build());
        registry.register(OperationDescriptor.builder("typed")
                .inputSchema(InputSchema.builder().required("tenant_id", PropertyType.STRING, "tenant").build())
                .handler(input -> OperationOutcome.success("ok"))
                .build());
        registry.register(OperationDescriptor.builder("mdms_search")
                .group("mdms")
                .requiresAuthentication(true)
                .handler(input -> {
                    mdmsInvocations.incrementAndGet();
                    return OperationOutcome.success("[]");
                })
                .build());

        writer = new RecordingEventWriter();
        telemetry = new SessionTelemetry(writer, new SensitiveDataRedactor(), TelemetrySettings.defaults("test"),
                Clock.fixed(Instant.parse("2025-07-12T10:30:00Z"), ZoneOffset.UTC));
        identity = new InMemoryIdentityClient()
                .addAccount("ADMIN", "eGov@123", "pg", List.of(RoleGrant.of(StandardRole.EMPLOYEE, "pg")));
        meterRegistry = new SimpleMeterRegistry();
        spanExporter = InMemorySpanExporter.create();
        tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        tracerProvider.close();
    }

    private Dispatcher dispatcher(Credentials defaults) {
        AuthResolver resolver = new AuthResolver(new EnvironmentCatalog(List.of(DEV)), "dev", identity, defaults, null);
        return new Dispatcher(registry, telemetry, resolver, new OperationTracer(tracerProvider.get("test")),
                new OperationMetrics(new MetricFactory(meterRegistry, "gateway-test")));
    }

    private Dispatcher dispatcher() {
        return dispatcher(Credentials.none());
    }

    @Nested
    @DisplayName("Rejected calls")
    class Rejected {

        @Test
        @DisplayName("should answer an unknown operation without recording anything")
        void shouldRejectUnknownOperation() {
            DispatchResponse response = dispatcher().dispatch("s1", "no_such_tool", Map.of());

            assertThat(response.success()).isFalse();
            assertThat(response.error()).isEqualTo("Unknown tool: no_such_tool");
            assertThat(response.errorType()).isEqualTo("ConfigurationException");
            assertThat(writer.events()).isEmpty();
            assertThat(telemetry.sessionCount()).isZero();
        }

        @Test
        @DisplayName("should deny an operation of a disabled group without invoking it")
        void shouldDenyDisabledGroup() {
            DispatchResponse response = dispatcher().dispatch("s1", "mdms_search", Map.of());

            assertThat(response.success()).isFalse();
            assertThat(response.errorType()).isEqualTo("CapabilityDeniedException");
            assertThat(response.error()).contains("\"mdms\"").contains("enable_tools");
            assertThat(response.details()).containsEntry("toolGroup", "mdms")
                    .containsEntry("activeGroups", List.of("core"));
            assertThat(mdmsInvocations).hasValue(0);
            assertThat(writer.events()).isEmpty();
            assertThat(meterRegistry.get(OperationMetrics.DENIED).tag("group", "mdms").counter().count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Telemetry")
    class Telemetry {

        @Test
        @DisplayName("should record a call and a result sharing one sequence number")
        void shouldPairCallAndResult() {
            DispatchResponse response = dispatcher().dispatch("s1", "echo", Map.of("tenant_id", "pg"));

            assertThat(response.success()).isTrue();
            assertThat(response.sessionId()).isEqualTo("s1");
            assertThat(response.result()).isEqualTo("echo:[tenant_id]");

            List<TelemetryEvent> events = writer.eventsOf("s1");
            assertThat(events).extracting(TelemetryEvent::kind).containsExactly(EventKind.CALL, EventKind.RESULT);
            assertThat(events).extracting(TelemetryEvent::seq).containsExactly(1L, 1L);
            ResultPayload result = (ResultPayload) events.get(1).payload();
            assertThat(result.isError()).isFalse();
            assertThat(result.tool()).isEqualTo("echo");
        }

        @Test
        @DisplayName("should redact secrets in recorded arguments but pass them to the handler")
        void shouldRedactRecordedArguments() {
            DispatchResponse response =
                    dispatcher().dispatch("s1", "echo", Map.of("username", "ADMIN", "password", "eGov@123"));

            assertThat(response.result()).contains("password");
            CallPayload call = (CallPayload) writer.eventsOf("s1").get(0).payload();
            assertThat(call.args()).containsEntry("username", "ADMIN").containsEntry("password", "***");
        }

        @Test
        @DisplayName("should use the default session when none is named")
        void shouldUseDefaultSession() {
            DispatchResponse response = dispatcher().dispatch(null, "echo", null);

            assertThat(response.sessionId()).isEqualTo(telemetry.defaultSessionId());
            assertThat(writer.eventsOf(telemetry.defaultSessionId())).hasSize(2);
        }

        @Test
        @DisplayName("should count outcomes per operation")
        void shouldCountOutcomes() {
            Dispatcher dispatcher = dispatcher();
            dispatcher.dispatch("s1", "echo", Map.of());
            dispatcher.dispatch("s1", "explode", Map.of());

            assertThat(meterRegistry.get(OperationMetrics.CALLS)
                    .tag("operation", "echo").tag("outcome", OperationMetrics.OUTCOME_SUCCESS).counter().count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get(OperationMetrics.CALLS)
                    .tag("operation", "explode").tag("outcome", OperationMetrics.OUTCOME_ERROR).counter().count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should turn a handler exception into an error envelope and an error result")
        void shouldCaptureHandlerException() {
            DispatchResponse response = dispatcher().dispatch("s1", "explode", Map.of());

            assertThat(response.success()).isFalse();
            assertThat(response.error()).isEqualTo("boom");
            assertThat(response.errorType()).isEqualTo(Dispatcher.HANDLER_ERROR);
            ResultPayload result = (ResultPayload) writer.eventsOf("s1").get(1).payload();
            assertThat(result.isError()).isTrue();
            assertThat(result.errorMessage()).isEqualTo("boom");
            assertThat(telemetry.snapshot("s1").orElseThrow().errorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should report a failure outcome as a handler error")
        void shouldReportFailureOutcome() {
            DispatchResponse response = dispatcher().dispatch("s1", "refuse", Map.of());

            assertThat(response.success()).isFalse();
            assertThat(response.error()).isEqualTo("Tenant not found");
            assertThat(response.errorType()).isEqualTo(Dispatcher.HANDLER_ERROR);
        }

        @Test
        @DisplayName("should reject arguments that break the input schema")
        void shouldRejectInvalidArguments() {
            DispatchResponse response = dispatcher().dispatch("s1", "typed", Map.of());

            assertThat(response.success()).isFalse();
            assertThat(response.errorType()).isEqualTo(Dispatcher.VALIDATION_ERROR);
            assertThat(response.error()).contains("tenant_id is required");
            assertThat(writer.eventsOf("s1")).hasSize(2);
        }
    }

    @Nested
    @DisplayName("Authentication")
    class Authentication {

        @Test
        @DisplayName("should fail an authenticated operation when no login is possible")
        void shouldFailWithoutCredentials() {
            registry.enableGroups(List.of("mdms"));

            DispatchResponse response = dispatcher().dispatch("s1", "mdms_search", Map.of());

            assertThat(response.success()).isFalse();
            assertThat(response.errorType()).isEqualTo("AuthenticationException");
            assertThat(response.error()).contains("configure");
            assertThat(mdmsInvocations).hasValue(0);
        }

        @Test
        @DisplayName("should log in lazily with default credentials")
        void shouldLogInLazily() {
            registry.enableGroups(List.of("mdms"));

            DispatchResponse response = dispatcher(ADMIN).dispatch("s1", "mdms_search", Map.of());

            assertThat(response.success()).isTrue();
            assertThat(mdmsInvocations).hasValue(1);
            assertThat(identity.loginAttempts()).containsExactly("pg");
        }
    }

    @Nested
    @DisplayName("Checkpoint reminder")
    class Reminder {

        @Test
        @DisplayName("should append the hint to the eighth result only")
        void shouldAppendHintOnEighthCall() {
            Dispatcher dispatcher = dispatcher();
            for (int i = 1; i <= 7; i++) {
                assertThat(dispatcher.dispatch("s1", "echo", Map.of()).result())
                        .doesNotContain("session_checkpoint");
            }

            assertThat(dispatcher.dispatch("s1", "echo", Map.of()).result()).endsWith(Dispatcher.CHECKPOINT_HINT);
            assertThat(dispatcher.dispatch("s1", "echo", Map.of()).result()).doesNotContain("session_checkpoint");
        }

        @Test
        @DisplayName("should not append the hint to a failed result")
        void shouldNotHintOnFailure() {
            Dispatcher dispatcher = dispatcher();
            for (int i = 1; i <= 7; i++) {
                dispatcher.dispatch("s1", "echo", Map.of());
            }

            DispatchResponse failed = dispatcher.dispatch("s1", "explode", Map.of());

            assertThat(failed.error()).isEqualTo("boom");
        }
    }

    @Nested
    @DisplayName("Tracing")
    class Tracing {

        @Test
        @DisplayName("should run the handler inside a span tagged with the session")
        void shouldTraceHandler() {
            dispatcher().dispatch("s1", "echo", Map.of());

            List<SpanData> spans = spanExporter.getFinishedSpanItems();
            assertThat(spans).hasSize(1);
            assertThat(spans.get(0).getName()).isEqualTo("operation echo");
            assertThat(spans.get(0).getAttributes().get(AttributeKey.stringKey(OperationTracer.ATTR_SESSION_ID)))
                    .isEqualTo("s1");
        }

        @Test
        @DisplayName("should restore the caller's correlation context afterwards")
        void shouldClearContextAfterDispatch() {
            dispatcher().dispatch("s1", "echo", Map.of());

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }
}
