package com.sentinel.service.core;

import com.sentinel.domain.common.EventType;
import com.sentinel.domain.event.Event;
import com.sentinel.domain.event.GenericEventData;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EventBus.
 *
 * Tests:
 * - Fan-out to every subscriber despite a failing one
 * - Subscription order
 * - Exact type matching
 * - Unsubscribe
 * - Async dispatch
 */
class EventBusTest {

    private static Event progressEvent() {
        return Event.of(EventType.JOB_PROGRESS, "test", GenericEventData.of(Map.of("current", 1)));
    }

    @Test
    void testFanOutSurvivesFailingSubscriber() {
        EventBus bus = new EventBus();
        AtomicInteger received = new AtomicInteger();

        for (int i = 1; i <= 5; i++) {
            final int index = i;
            bus.subscribe(EventType.JOB_PROGRESS, e -> {
                received.incrementAndGet();
                if (index == 2) {
                    throw new IllegalStateException("subscriber 2 blew up");
                }
            });
        }

        assertDoesNotThrow(() -> bus.publish(progressEvent()), "Publisher must never see subscriber failures");
        assertEquals(5, received.get(), "All 5 subscribers should receive the event");
        assertEquals(1, bus.getSubscriberFailures(), "One subscriber failure recorded");
    }

    @Test
    void testErrorInSubscriberIsIsolated() {
        EventBus bus = new EventBus();
        AtomicInteger after = new AtomicInteger();

        bus.subscribe(EventType.JOB_FAILED, e -> { throw new AssertionError("not fatal to the bus"); });
        bus.subscribe(EventType.JOB_FAILED, e -> after.incrementAndGet());

        bus.publish(Event.of(EventType.JOB_FAILED, "test", null));

        assertEquals(1, after.get(), "Subscriber after a thrown Error still runs");
    }

    @Test
    void testDeliveryInSubscriptionOrder() {
        EventBus bus = new EventBus();
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < 4; i++) {
            final int index = i;
            bus.subscribe(EventType.JOB_STARTED, e -> order.add(index));
        }
        bus.publish(Event.of(EventType.JOB_STARTED, "test", null));

        assertEquals(List.of(0, 1, 2, 3), order);
    }

    @Test
    void testOnlyMatchingTypeIsDelivered() {
        EventBus bus = new EventBus();
        AtomicInteger completed = new AtomicInteger();
        bus.subscribe(EventType.JOB_COMPLETED, e -> completed.incrementAndGet());

        bus.publish(progressEvent());
        bus.publish(Event.of(EventType.JOB_FAILED, "test", null));

        assertEquals(0, completed.get(), "Other event types must not reach JOB_COMPLETED subscribers");
        assertEquals(1, bus.subscriberCount(EventType.JOB_COMPLETED));
        assertEquals(0, bus.subscriberCount(EventType.JOB_PROGRESS));
    }

    @Test
    void testUnsubscribeIsIdempotent() {
        EventBus bus = new EventBus();
        AtomicInteger received = new AtomicInteger();
        EventBus.Subscription sub = bus.subscribe(EventType.JOB_PROGRESS, e -> received.incrementAndGet());

        bus.publish(progressEvent());
        sub.unsubscribe();
        sub.unsubscribe();
        bus.publish(progressEvent());

        assertEquals(1, received.get(), "No delivery after unsubscribe");
        assertEquals(EventType.JOB_PROGRESS, sub.eventType());
        assertEquals(0, bus.subscriberCount(EventType.JOB_PROGRESS));
    }

    @Test
    void testPublishWithoutSubscribers() {
        EventBus bus = new EventBus();
        assertDoesNotThrow(() -> bus.publish(progressEvent()));
    }

    @Test
    void testAsyncDispatch() throws InterruptedException {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            EventBus bus = new EventBus(executor);
            CountDownLatch latch = new CountDownLatch(3);
            List<String> threads = Collections.synchronizedList(new ArrayList<>());

            for (int i = 0; i < 3; i++) {
                bus.subscribe(EventType.SYSTEM_STATUS, e -> {
                    threads.add(Thread.currentThread().getName());
                    latch.countDown();
                });
            }
            bus.publish(Event.of(EventType.SYSTEM_STATUS, "test", null));

            assertTrue(latch.await(2, TimeUnit.SECONDS), "All async subscribers should run");
            assertFalse(threads.contains(Thread.currentThread().getName()),
                "Async delivery must not run on the publishing thread");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testAsyncDispatchFallsBackInlineWhenRejected() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        executor.shutdown();

        EventBus bus = new EventBus(executor);
        AtomicInteger received = new AtomicInteger();
        bus.subscribe(EventType.SYSTEM_STATUS, e -> received.incrementAndGet());

        bus.publish(Event.of(EventType.SYSTEM_STATUS, "test", null));

        assertEquals(1, received.get(), "Rejected async dispatch is delivered inline");
    }
}
