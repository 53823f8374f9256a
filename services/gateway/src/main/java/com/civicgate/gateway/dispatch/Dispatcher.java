package com.civicgate.gateway.dispatch;

import com.civicgate.capability.CapabilityDeniedException;
import com.civicgate.capability.CapabilityRegistry;
import com.civicgate.capability.ConfigurationException;
import com.civicgate.capability.InputValidationResult;
import com.civicgate.capability.OperationDescriptor;
import com.civicgate.capability.OperationInput;
import com.civicgate.capability.OperationOutcome;
import com.civicgate.observability.CorrelationContext;
import com.civicgate.observability.CorrelationContextHolder;
import com.civicgate.observability.OperationMetrics;
import com.civicgate.observability.OperationTracer;
import com.civicgate.security.AuthContext;
import com.civicgate.security.AuthResolver;
import com.civicgate.security.AuthenticationException;
import com.civicgate.telemetry.ReminderPolicy;
import com.civicgate.telemetry.SessionTelemetry;
import com.civicgate.telemetry.TelemetryValidationException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one operation call through the capability check, telemetry, lazy login and tracing.
 *
 * <p>Unknown and denied calls are answered without touching the session: no events are recorded
 * and no handler runs. Everything else records a call before the handler and a result after it,
 * paired by sequence number. {@link #dispatch} never throws.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    public static final String CHECKPOINT_HINT =
            "\n\n---\n**Hint**: Consider calling `session_checkpoint` to record your progress so far.";

    static final String HANDLER_ERROR = "HandlerError";
    static final String VALIDATION_ERROR = "ValidationError";
    static final String INTERNAL_ERROR = "InternalError";

    private final CapabilityRegistry registry;
    private final SessionTelemetry telemetry;
    private final AuthResolver authResolver;
    private final OperationTracer tracer;
    private final OperationMetrics metrics;

    public Dispatcher(CapabilityRegistry registry, SessionTelemetry telemetry, AuthResolver authResolver,
                      OperationTracer tracer, OperationMetrics metrics) {
        this.registry = registry;
        this.telemetry = telemetry;
        this.authResolver = authResolver;
        this.tracer = tracer;
        this.metrics = metrics;
    }

    /**
     * Dispatches a call.
     *
     * @param sessionId caller's session, or null for the process default session
     * @param name operation name
     * @param args decoded arguments (nullable)
     */
    public DispatchResponse dispatch(String sessionId, String name, Map<String, Object> args) {
        Map<String, Object> arguments = args == null ? Map.of() : args;

        OperationDescriptor descriptor = registry.find(name).orElse(null);
        if (descriptor == null) {
            ConfigurationException unknown = new ConfigurationException("Unknown tool: " + name);
            log.warn("Rejected call to unknown operation {}", name);
            return DispatchResponse.rejected(unknown.getMessage(), ConfigurationException.class.getSimpleName(), null);
        }

        if (!registry.isGroupEnabled(descriptor.group())) {
            CapabilityDeniedException denied =
                    new CapabilityDeniedException(name, descriptor.group(), registry.enabledGroups());
            metrics.recordDenied(name, descriptor.group());
            log.info("Denied {}: group {} is not enabled", name, descriptor.group());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("activeGroups", denied.activeGroups());
            details.put("toolGroup", denied.group());
            return DispatchResponse.rejected(denied.getMessage(), CapabilityDeniedException.class.getSimpleName(),
                    details);
        }

        try {
            String sid = telemetry.ensureSession(sessionId).id();
            CorrelationContext context = CorrelationContextHolder.get()
                    .orElseGet(() -> new CorrelationContext(UUID.randomUUID().toString(), null, null, null))
                    .forOperation(sid, name)
                    .withTenantRoot(authResolver.context().map(AuthContext::tenantRoot).orElse(null));
            return CorrelationContextHolder.callWithContext(context, () -> invoke(sid, descriptor, arguments));
        } catch (RuntimeException e) {
            log.error("Dispatch of {} failed outside the handler", name, e);
            return DispatchResponse.failure(null, "Internal error while dispatching " + name, INTERNAL_ERROR);
        }
    }

    private DispatchResponse invoke(String sessionId, OperationDescriptor descriptor, Map<String, Object> args) {
        String name = descriptor.name();
        long started = System.nanoTime();
        long seq = telemetry.recordCall(sessionId, name, args);

        OperationOutcome outcome;
        String errorType = null;
        try {
            outcome = execute(sessionId, descriptor, args);
            if (!outcome.success()) {
                errorType = HANDLER_ERROR;
            }
        } catch (InvalidArgumentsException e) {
            outcome = OperationOutcome.failure(e.getMessage());
            errorType = VALIDATION_ERROR;
        } catch (Exception e) {
            outcome = OperationOutcome.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            errorType = errorType(e);
            log.warn("{} #{} failed: {}", name, seq, outcome.error());
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        telemetry.recordResult(sessionId, seq, name, elapsed.toMillis(), !outcome.success(),
                outcome.text(), outcome.error());
        metrics.recordCall(name, outcome.success(), elapsed);

        if (!outcome.success()) {
            return DispatchResponse.failure(sessionId, outcome.error(), errorType);
        }
        String text = outcome.text();
        if (ReminderPolicy.counts(name) && telemetry.shouldRemind(sessionId)) {
            log.debug("Checkpoint reminder attached to {} #{}", name, seq);
            text = text + CHECKPOINT_HINT;
        }
        return DispatchResponse.ok(sessionId, text);
    }

    private OperationOutcome execute(String sessionId, OperationDescriptor descriptor, Map<String, Object> args)
            throws Exception {
        InputValidationResult validation = descriptor.inputSchema().validate(args);
        if (!validation.valid()) {
            throw new InvalidArgumentsException(validation.message());
        }
        if (descriptor.requiresAuthentication()) {
            AuthContext auth = authResolver.ensureAuthenticated();
            CorrelationContextHolder.get()
                    .ifPresent(ctx -> CorrelationContextHolder.set(ctx.withTenantRoot(auth.tenantRoot())));
        }
        return tracer.trace(descriptor.name(), () -> {
            OperationOutcome result = descriptor.handler().handle(new OperationInput(args, sessionId));
            if (result == null) {
                throw new IllegalStateException("Handler of " + descriptor.name() + " returned no outcome");
            }
            if (!result.success()) {
                OperationTracer.markCurrentFailed(result.error());
            }
            return result;
        });
    }

    private static String errorType(Exception e) {
        if (e instanceof AuthenticationException) {
            return AuthenticationException.class.getSimpleName();
        }
        if (e instanceof ConfigurationException) {
            return ConfigurationException.class.getSimpleName();
        }
        if (e instanceof TelemetryValidationException) {
            return VALIDATION_ERROR;
        }
        return HANDLER_ERROR;
    }

    private static final class InvalidArgumentsException extends RuntimeException {
        InvalidArgumentsException(String message) {
            super(message);
        }
    }
}
