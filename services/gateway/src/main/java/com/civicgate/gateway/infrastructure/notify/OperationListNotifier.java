package com.civicgate.gateway.infrastructure.notify;

import com.civicgate.capability.CapabilityChangeListener;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Pushes a {@value #EVENT_NAME} server-sent event to every subscriber when the visible
 * operations change, and keeps a version number callers can poll instead.
 */
public class OperationListNotifier implements CapabilityChangeListener {

    private static final Logger log = LoggerFactory.getLogger(OperationListNotifier.class);

    public static final String EVENT_NAME = "tools/list_changed";

    private final List<SseEmitter> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong version = new AtomicLong();
    private final long emitterTimeoutMillis;

    public OperationListNotifier(long emitterTimeoutMillis) {
        this.emitterTimeoutMillis = emitterTimeoutMillis;
    }

    /**
     * Opens a subscription. The emitter is dropped when it completes, times out or fails.
     */
    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMillis);
        subscribers.add(emitter);
        emitter.onCompletion(() -> subscribers.remove(emitter));
        emitter.onTimeout(() -> subscribers.remove(emitter));
        emitter.onError(e -> subscribers.remove(emitter));
        return emitter;
    }

    @Override
    public void capabilitiesChanged(List<String> activeGroups) {
        long current = version.incrementAndGet();
        Map<String, Object> data = Map.of("version", current, "activeGroups", activeGroups);
        for (SseEmitter emitter : subscribers) {
            try {
                emitter.send(SseEmitter.event().name(EVENT_NAME).id(Long.toString(current)).data(data));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping list-change subscriber: {}", e.getMessage());
                subscribers.remove(emitter);
            }
        }
        log.info("Operation list changed (version {}), active groups {}", current, activeGroups);
    }

    public long version() {
        return version.get();
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
