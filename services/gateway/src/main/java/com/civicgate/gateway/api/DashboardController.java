package com.civicgate.gateway.api;

import com.civicgate.database.RelationalSink;
import com.civicgate.database.SessionPage;
import com.civicgate.database.SessionStats;
import com.civicgate.database.SessionTimeline;
import com.civicgate.database.SinkUnavailableException;
import com.civicgate.eventmodel.EventSerializer;
import com.civicgate.eventmodel.MessageTurn;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read side of the session database for the dashboard, plus message ingestion.
 *
 * <p>Every endpoint answers 503 while the session database is unavailable.
 */
@RestController
@RequestMapping("/api/v1/dashboard")
public class DashboardController {

    private final RelationalSink sink;

    public DashboardController(RelationalSink sink) {
        this.sink = sink;
    }

    @GetMapping("/stats")
    public SessionStats stats() {
        return sink.stats();
    }

    @GetMapping("/sessions")
    public SessionPage sessions(
            @RequestParam(defaultValue = "50") int limit, @RequestParam(defaultValue = "0") int offset) {
        return sink.listSessions(limit, offset);
    }

    @GetMapping("/sessions/{id}/events")
    public ResponseEntity<Map<String, Object>> timeline(@PathVariable String id) throws JsonProcessingException {
        SessionTimeline timeline = sink.timeline(id);
        if (timeline.session() == null && timeline.events().isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        List<JsonNode> events = new ArrayList<>(timeline.events().size());
        for (var event : timeline.events()) {
            events.add(EventSerializer.objectMapper().readTree(EventSerializer.toJsonLine(event)));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session", timeline.session());
        body.put("events", events);
        body.put("messages", timeline.messages());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/sessions/{id}/messages")
    public ResponseEntity<Map<String, Object>> ingestMessages(
            @PathVariable String id, @Valid @RequestBody MessageBatch batch) {
        if (!sink.isEnabled()) {
            throw new SinkUnavailableException();
        }
        Set<Integer> seen = new HashSet<>();
        for (MessageTurn turn : batch.messages()) {
            if (!seen.add(turn.turn())) {
                throw new IllegalArgumentException("messages must not repeat a turn number");
            }
        }
        sink.upsertMessages(id, batch.messages());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("sessionId", id, "accepted", batch.messages().size()));
    }

    /**
     * Body of a message ingestion request.
     */
    public record MessageBatch(@NotEmpty List<MessageTurn> messages) {
    }
}
