package com.sentinel.service.core;

import com.sentinel.domain.common.EventType;
import com.sentinel.domain.event.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Typed publish/subscribe bus.
 *
 * Features:
 * - Fan-out to every subscriber of the exact event type, in subscription order
 * - Synchronous dispatch on the publishing thread by default
 * - Optional async dispatch: each publish becomes one task on the given executor,
 *   which still delivers to subscribers in order
 * - A failing subscriber is logged and skipped; the others still receive the event
 *   and the publisher never sees the failure
 *
 * Delivery is best effort, at most once per subscriber registered at publish time.
 * No persistence, no replay.
 *
 * Usage:
 * <pre>
 * EventBus bus = new EventBus();
 * EventBus.Subscription sub = bus.subscribe(EventType.JOB_FAILED, e -> alert(e));
 * bus.publish(Event.of(EventType.JOB_FAILED, "queue", data));
 * sub.unsubscribe();
 * </pre>
 */
public final class EventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<EventType, List<Registration>> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong subscriptionIds = new AtomicLong();
    private final AtomicLong subscriberFailures = new AtomicLong();
    private final Executor dispatcher;

    /**
     * Synchronous bus: subscribers run on the publishing thread.
     */
    public EventBus() {
        this.dispatcher = null;
    }

    /**
     * Async bus: fan-out runs on the given executor. Use a bounded executor; when it
     * rejects a dispatch the event is delivered on the publishing thread instead.
     */
    public EventBus(Executor dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /**
     * Register a handler for one event type.
     */
    public Subscription subscribe(EventType type, Consumer<Event> handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");

        Registration registration = new Registration(subscriptionIds.incrementAndGet(), type, handler);
        subscribers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(registration);
        log.debug("[EVENT-BUS] Subscribed #{} to {}", registration.id, type);
        return registration;
    }

    /**
     * Deliver an event to the current subscribers of its type.
     */
    public void publish(Event event) {
        Objects.requireNonNull(event, "event");

        List<Registration> targets = subscribers.get(event.type());
        if (targets == null || targets.isEmpty()) {
            return;
        }

        if (dispatcher == null) {
            deliver(event, targets);
            return;
        }

        try {
            dispatcher.execute(() -> deliver(event, targets));
        } catch (RejectedExecutionException e) {
            log.warn("[EVENT-BUS] Async dispatcher rejected {}, delivering inline", event.type());
            deliver(event, targets);
        }
    }

    public int subscriberCount(EventType type) {
        List<Registration> targets = subscribers.get(type);
        return targets == null ? 0 : targets.size();
    }

    /**
     * Number of subscriber invocations that threw since creation.
     */
    public long getSubscriberFailures() {
        return subscriberFailures.get();
    }

    private void deliver(Event event, List<Registration> targets) {
        // CopyOnWriteArrayList iteration is a snapshot: late subscribers miss this event
        for (Registration registration : targets) {
            try {
                registration.handler.accept(event);
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Throwable t) {
                subscriberFailures.incrementAndGet();
                log.error("[EVENT-BUS] Subscriber #{} failed handling {} from {}: {}",
                    registration.id, event.type(), event.module(), t.getMessage(), t);
            }
        }
    }

    /**
     * Handle returned by {@link #subscribe}.
     */
    public interface Subscription {
        EventType eventType();

        /**
         * Stop receiving events. Idempotent.
         */
        void unsubscribe();
    }

    private final class Registration implements Subscription {
        private final long id;
        private final EventType type;
        private final Consumer<Event> handler;

        private Registration(long id, EventType type, Consumer<Event> handler) {
            this.id = id;
            this.type = type;
            this.handler = handler;
        }

        @Override
        public EventType eventType() {
            return type;
        }

        @Override
        public void unsubscribe() {
            List<Registration> targets = subscribers.get(type);
            if (targets != null && targets.remove(this)) {
                log.debug("[EVENT-BUS] Unsubscribed #{} from {}", id, type);
            }
        }
    }
}
