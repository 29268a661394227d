package com.sentinel.service.history;

import com.sentinel.domain.common.EventType;
import com.sentinel.domain.event.Event;
import com.sentinel.domain.event.JobStatusData;
import com.sentinel.service.core.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Counts terminal failures per job type inside a sliding window.
 *
 * Each JOB_FAILED is stamped with the monitor's clock; stamps older than the window are
 * pruned. Below the threshold a failure is logged at WARN, at or above it at ERROR.
 * A JOB_COMPLETED of the same type clears its count.
 */
public final class JobFailureMonitor {
    private static final Logger log = LoggerFactory.getLogger(JobFailureMonitor.class);

    /**
     * Health of one job type.
     */
    public record TypeHealth(int recentFailures, boolean healthy) {}

    private final Clock clock;
    private final Duration window;
    private final int threshold;
    private final Map<String, Deque<Instant>> failures = new HashMap<>();
    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    public JobFailureMonitor(Clock clock, Duration window, int threshold) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.window = Objects.requireNonNull(window, "window");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, got " + window);
        }
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1, got " + threshold);
        }
        this.threshold = threshold;
    }

    public synchronized void register(EventBus bus) {
        if (!subscriptions.isEmpty()) {
            return;
        }
        subscriptions.add(bus.subscribe(EventType.JOB_FAILED, this::onFailed));
        subscriptions.add(bus.subscribe(EventType.JOB_COMPLETED, this::onCompleted));
        log.info("Job failure monitor registered (threshold={} in {}m)", threshold, window.toMinutes());
    }

    public synchronized void unregister() {
        subscriptions.forEach(EventBus.Subscription::unsubscribe);
        subscriptions.clear();
    }

    void onFailed(Event event) {
        JobStatusData status = event.typedData(JobStatusData.class).orElse(null);
        if (status == null || status.jobType() == null) {
            return;
        }
        Instant now = clock.instant();
        int recent;
        synchronized (failures) {
            Deque<Instant> stamps = failures.computeIfAbsent(status.jobType(), k -> new ArrayDeque<>());
            stamps.addLast(now);
            prune(stamps, now);
            recent = stamps.size();
        }

        if (recent >= threshold) {
            log.error("[FAILURES] ✗ {} failed {} times in the last {}m (threshold {}), last error: {}",
                status.jobType(), recent, window.toMinutes(), threshold, status.error());
        } else {
            log.warn("[FAILURES] ⚠ {} failed (failure {}/{}): {}",
                status.jobType(), recent, threshold, status.error());
        }
    }

    void onCompleted(Event event) {
        JobStatusData status = event.typedData(JobStatusData.class).orElse(null);
        if (status == null || status.jobType() == null) {
            return;
        }
        synchronized (failures) {
            if (failures.remove(status.jobType()) != null) {
                log.debug("[FAILURES] {} completed, failure count reset", status.jobType());
            }
        }
    }

    private void prune(Deque<Instant> stamps, Instant now) {
        Instant cutoff = now.minus(window);
        while (!stamps.isEmpty() && stamps.peekFirst().isBefore(cutoff)) {
            stamps.removeFirst();
        }
    }

    /**
     * Failures of {@code jobType} still inside the window.
     */
    public int recentFailures(String jobType) {
        synchronized (failures) {
            Deque<Instant> stamps = failures.get(jobType);
            if (stamps == null) {
                return 0;
            }
            prune(stamps, clock.instant());
            return stamps.size();
        }
    }

    public boolean isHealthy(String jobType) {
        return recentFailures(jobType) < threshold;
    }

    /**
     * Every type with failures inside the window, sorted by name.
     */
    public Map<String, TypeHealth> status() {
        Map<String, TypeHealth> result = new TreeMap<>();
        synchronized (failures) {
            Instant now = clock.instant();
            for (Map.Entry<String, Deque<Instant>> entry : failures.entrySet()) {
                prune(entry.getValue(), now);
                int recent = entry.getValue().size();
                if (recent > 0) {
                    result.put(entry.getKey(), new TypeHealth(recent, recent < threshold));
                }
            }
        }
        return result;
    }

    public Duration getWindow() {
        return window;
    }

    public int getThreshold() {
        return threshold;
    }
}
