package com.sentinel.service.history;

import com.sentinel.domain.common.EventType;
import com.sentinel.domain.event.Event;
import com.sentinel.domain.event.JobStatusData;
import com.sentinel.service.core.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Keeps the most recent terminal job outcomes (JOB_COMPLETED / JOB_FAILED) in memory.
 *
 * The engine itself keeps no history; this is a plain bus subscriber. Oldest entries
 * are evicted once {@code capacity} is reached. Nothing is persisted.
 */
public final class JobHistoryRecorder {
    private static final Logger log = LoggerFactory.getLogger(JobHistoryRecorder.class);

    /**
     * One terminal outcome.
     */
    public record Entry(Instant recordedAt, String module, JobStatusData status) {}

    private final int capacity;
    private final Deque<Entry> entries;
    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    public JobHistoryRecorder(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public synchronized void register(EventBus bus) {
        if (!subscriptions.isEmpty()) {
            return;
        }
        subscriptions.add(bus.subscribe(EventType.JOB_COMPLETED, this::record));
        subscriptions.add(bus.subscribe(EventType.JOB_FAILED, this::record));
        log.info("Job history recorder registered (capacity={})", capacity);
    }

    public synchronized void unregister() {
        subscriptions.forEach(EventBus.Subscription::unsubscribe);
        subscriptions.clear();
    }

    void record(Event event) {
        JobStatusData status = event.typedData(JobStatusData.class).orElse(null);
        if (status == null) {
            log.warn("{} from {} carries no job status, not recorded", event.type(), event.module());
            return;
        }
        synchronized (entries) {
            if (entries.size() == capacity) {
                entries.removeFirst();
            }
            entries.addLast(new Entry(event.timestamp(), event.module(), status));
        }
    }

    /**
     * Newest first, at most {@code limit} entries.
     */
    public List<Entry> recent(int limit) {
        List<Entry> result = new ArrayList<>();
        synchronized (entries) {
            Iterator<Entry> it = entries.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
        }
        return result;
    }

    public List<Entry> recent() {
        return recent(capacity);
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }
}
