package com.sentinel.service.listener;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.domain.common.EventType;
import com.sentinel.domain.event.Event;
import com.sentinel.domain.event.EventData;
import com.sentinel.domain.event.GenericEventData;
import com.sentinel.domain.job.Job;
import com.sentinel.domain.job.JobPriority;
import com.sentinel.domain.job.JobType;
import com.sentinel.service.core.EventBus;
import com.sentinel.service.queue.JobManager;
import com.sentinel.service.queue.JobQueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Translates domain events into jobs.
 *
 * Pure translation: each mapping decides job type, priority and retry budget for one
 * event type. The job payload is the event's data plus the triggering event type and
 * module. Jobs go through {@link JobManager#enqueueIfNotPending}, so a burst of the
 * same event collapses into one pending job.
 *
 * A rejected enqueue is logged and dropped. Listeners never throw back into the bus.
 */
public final class JobEventListeners {
    private static final Logger log = LoggerFactory.getLogger(JobEventListeners.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    public static final String PAYLOAD_TRIGGER = "trigger_event";
    public static final String PAYLOAD_SOURCE = "source_module";

    /**
     * One event-type-to-job translation rule.
     */
    public record Mapping(EventType eventType, JobType jobType, JobPriority priority, int maxRetries) {
        public Mapping {
            Objects.requireNonNull(eventType, "eventType");
            Objects.requireNonNull(jobType, "jobType");
            Objects.requireNonNull(priority, "priority");
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
            }
        }
    }

    private final JobManager jobManager;
    private final List<Mapping> mappings;
    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong collapsed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public JobEventListeners(JobManager jobManager) {
        this(jobManager, defaultMappings());
    }

    public JobEventListeners(JobManager jobManager, List<Mapping> mappings) {
        this.jobManager = Objects.requireNonNull(jobManager, "jobManager");
        this.mappings = List.copyOf(mappings);
    }

    /**
     * State change → planner batch, new recommendations → trading run,
     * dividend → reinvestment.
     */
    public static List<Mapping> defaultMappings() {
        return List.of(
            new Mapping(EventType.STATE_CHANGED, JobType.PLANNER_BATCH, JobPriority.CRITICAL, 2),
            new Mapping(EventType.RECOMMENDATIONS_READY, JobType.EVENT_BASED_TRADING, JobPriority.CRITICAL, 1),
            new Mapping(EventType.DIVIDEND_DETECTED, JobType.DIVIDEND_REINVESTMENT, JobPriority.HIGH, 3)
        );
    }

    /**
     * Subscribe every mapping on the bus. Calling it twice does nothing.
     */
    public synchronized void register(EventBus bus) {
        if (!subscriptions.isEmpty()) {
            log.warn("[LISTENER] Job event listeners already registered");
            return;
        }
        for (Mapping mapping : mappings) {
            subscriptions.add(bus.subscribe(mapping.eventType(), event -> onEvent(mapping, event)));
            log.info("[LISTENER] {} → {} ({}, maxRetries={})",
                mapping.eventType(), mapping.jobType(), mapping.priority(), mapping.maxRetries());
        }
    }

    public synchronized void unregister() {
        subscriptions.forEach(EventBus.Subscription::unsubscribe);
        subscriptions.clear();
    }

    public List<Mapping> getMappings() {
        return mappings;
    }

    public long getEnqueuedCount() { return enqueued.get(); }
    public long getCollapsedCount() { return collapsed.get(); }
    public long getDroppedCount() { return dropped.get(); }

    void onEvent(Mapping mapping, Event event) {
        Job job = Job.builder(mapping.jobType())
            .priority(mapping.priority())
            .createdAt(jobManager.getClock().instant())
            .maxRetries(mapping.maxRetries())
            .payload(payloadFor(event))
            .build();

        try {
            if (jobManager.enqueueIfNotPending(job)) {
                enqueued.incrementAndGet();
                log.info("[LISTENER] {} from {} → enqueued {} [{}]",
                    event.type(), event.module(), job.getType(), job.getId());
            } else {
                collapsed.incrementAndGet();
                log.debug("[LISTENER] {} from {}: {} already pending", event.type(), event.module(), job.getType());
            }
        } catch (JobQueueException e) {
            dropped.incrementAndGet();
            log.warn("[LISTENER] Dropped {} [{}] for {}: {}",
                job.getType(), job.getId(), event.type(), e.getMessage());
        }
    }

    static Map<String, Object> payloadFor(Event event) {
        Map<String, Object> payload = new LinkedHashMap<>(dataFields(event.data()));
        payload.put(PAYLOAD_TRIGGER, event.type().name());
        payload.put(PAYLOAD_SOURCE, event.module());
        return payload;
    }

    private static Map<String, Object> dataFields(EventData data) {
        if (data instanceof GenericEventData generic) {
            return generic.fields();
        }
        try {
            Map<String, Object> fields = MAPPER.convertValue(data, new TypeReference<Map<String, Object>>() {});
            return fields == null ? Map.of() : fields;
        } catch (IllegalArgumentException e) {
            log.warn("[LISTENER] Could not flatten {} payload: {}", data.getClass().getSimpleName(), e.getMessage());
            return Map.of();
        }
    }
}
