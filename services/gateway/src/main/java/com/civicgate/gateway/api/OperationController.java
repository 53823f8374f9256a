package com.civicgate.gateway.api;

import com.civicgate.capability.CapabilityRegistry;
import com.civicgate.capability.OperationDescriptor;
import com.civicgate.gateway.dispatch.DispatchResponse;
import com.civicgate.gateway.dispatch.Dispatcher;
import com.civicgate.gateway.infrastructure.notify.OperationListNotifier;
import com.civicgate.gateway.infrastructure.web.CorrelationIdFilter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * The caller-facing surface: list the visible operations, call one, and subscribe to changes
 * of the list.
 *
 * <p>A call always answers 200 with a {@link DispatchResponse}; failures are reported in the body.
 */
@RestController
@RequestMapping("/api/v1/operations")
public class OperationController {

    private final CapabilityRegistry registry;
    private final Dispatcher dispatcher;
    private final OperationListNotifier notifier;

    public OperationController(CapabilityRegistry registry, Dispatcher dispatcher, OperationListNotifier notifier) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.notifier = notifier;
    }

    @GetMapping
    public Map<String, Object> listOperations() {
        List<Map<String, Object>> operations = registry.enabledDescriptors().stream()
                .map(OperationController::describe)
                .toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("version", notifier.version());
        body.put("operations", operations);
        return body;
    }

    @PostMapping("/{name}")
    public ResponseEntity<DispatchResponse> callOperation(
            @PathVariable String name,
            @RequestHeader(name = CorrelationIdFilter.SESSION_ID_HEADER, required = false) String sessionId,
            @RequestBody(required = false) Map<String, Object> args) {
        DispatchResponse response = dispatcher.dispatch(sessionId, name, args);
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok();
        if (response.sessionId() != null) {
            builder.header(CorrelationIdFilter.SESSION_ID_HEADER, response.sessionId());
        }
        return builder.body(response);
    }

    @GetMapping(path = "/changes", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribeToChanges() {
        return notifier.subscribe();
    }

    private static Map<String, Object> describe(OperationDescriptor descriptor) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("name", descriptor.name());
        json.put("description", descriptor.description());
        json.put("inputSchema", descriptor.inputSchema().toJson());
        return json;
    }
}
