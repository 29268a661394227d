package com.sentinel.service.core;

import com.sentinel.domain.common.EventType;
import com.sentinel.domain.event.Event;
import com.sentinel.domain.event.EventData;
import com.sentinel.domain.event.GenericEventData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Event Service.
 * Stamps events with their originating module and time, then publishes them on the bus.
 */
public final class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final EventBus bus;

    public EventService(EventBus bus) {
        this.bus = Objects.requireNonNull(bus, "bus");
    }

    /**
     * Emit a typed event.
     */
    public Event emit(EventType type, String module, EventData data) {
        Event event = Event.of(type, module, data);
        bus.publish(event);
        log.debug("Event emitted: type={}, module={}", type, module);
        return event;
    }

    /**
     * Emit an event with an untyped payload.
     */
    public Event emit(EventType type, String module, Map<String, Object> fields) {
        return emit(type, module, GenericEventData.of(fields));
    }

    public EventBus bus() {
        return bus;
    }
}
