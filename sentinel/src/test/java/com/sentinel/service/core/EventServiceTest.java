package com.sentinel.service.core;

import com.sentinel.domain.common.EventType;
import com.sentinel.domain.event.Event;
import com.sentinel.domain.event.GenericEventData;
import com.sentinel.domain.event.JobStatusData;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EventService.
 */
class EventServiceTest {

    @Test
    void testRejectsMissingBus() {
        NullPointerException e = assertThrows(NullPointerException.class, () -> new EventService(null));
        assertEquals("bus", e.getMessage());
    }

    @Test
    void testEmitPublishesStampedEvent() {
        EventBus bus = new EventBus();
        List<Event> received = new ArrayList<>();
        bus.subscribe(EventType.JOB_STARTED, received::add);
        EventService events = new EventService(bus);

        Event emitted = events.emit(EventType.JOB_STARTED, "queue", JobStatusData.started("a", "sync_cycle", "Sync"));

        assertEquals(1, received.size());
        assertSame(emitted, received.get(0));
        assertEquals("queue", emitted.module());
        assertNotNull(emitted.timestamp());
    }

    @Test
    void testEmitWrapsUntypedFields() {
        EventBus bus = new EventBus();
        List<Event> received = new ArrayList<>();
        bus.subscribe(EventType.SYSTEM_STATUS, received::add);

        new EventService(bus).emit(EventType.SYSTEM_STATUS, "engine", Map.of("message", "up"));

        assertEquals(1, received.size());
        GenericEventData data = assertInstanceOf(GenericEventData.class, received.get(0).data());
        assertEquals("up", data.fields().get("message"));
    }
}
