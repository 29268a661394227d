package com.sentinel.service.queue;

import com.sentinel.domain.common.EventType;
import com.sentinel.domain.event.JobStatusData;
import com.sentinel.domain.event.ProgressInfo;
import com.sentinel.domain.job.JobCatalog;
import com.sentinel.domain.job.JobType;
import com.sentinel.service.core.EventService;

import java.time.Duration;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Progress channel from a running handler back to the event bus.
 *
 * Bound to one job run. Throttled calls emit a JOB_PROGRESS event only if
 * {@code minInterval} has passed since the last emission, or when current == total
 * with total > 0. Unthrottled calls always emit and restart the throttle window.
 *
 * Safe to call from several threads of the same handler. A reporter built without
 * an event service does nothing.
 */
public final class ProgressReporter {

    public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofMillis(100);

    static final String MODULE = "queue";

    private final EventService events;
    private final String jobId;
    private final JobType jobType;
    private final String description;
    private final long minIntervalNanos;
    private final LongSupplier nanoClock;

    private final Object throttleLock = new Object();
    private long lastEmitNanos;
    private boolean emitted = false;

    public ProgressReporter(EventService events, String jobId, JobType jobType) {
        this(events, jobId, jobType, DEFAULT_MIN_INTERVAL);
    }

    public ProgressReporter(EventService events, String jobId, JobType jobType, Duration minInterval) {
        this(events, jobId, jobType, minInterval, System::nanoTime);
    }

    ProgressReporter(EventService events, String jobId, JobType jobType, Duration minInterval,
                     LongSupplier nanoClock) {
        this.events = events;
        this.jobId = jobId;
        this.jobType = jobType;
        this.description = JobCatalog.describe(jobType);
        this.minIntervalNanos = minInterval.toNanos();
        this.nanoClock = nanoClock;
    }

    /**
     * Reporter that never emits.
     */
    public static ProgressReporter noop(String jobId, JobType jobType) {
        return new ProgressReporter(null, jobId, jobType);
    }

    public void report(int current, int total, String message) {
        emitIfAllowed(ProgressInfo.of(current, total, message), completes(current, total));
    }

    public void reportWithDetails(int current, int total, String message,
                                  String phase, String subPhase, Map<String, Object> details) {
        emitIfAllowed(new ProgressInfo(current, total, message, phase, subPhase, details), completes(current, total));
    }

    /**
     * Always emits. For milestones and phase transitions.
     */
    public void reportUnthrottled(int current, int total, String message) {
        emitIfAllowed(ProgressInfo.of(current, total, message), true);
    }

    public void reportUnthrottledWithDetails(int current, int total, String message,
                                             String phase, String subPhase, Map<String, Object> details) {
        emitIfAllowed(new ProgressInfo(current, total, message, phase, subPhase, details), true);
    }

    /**
     * Indeterminate progress (current = total = 0). Throttled, never bypasses.
     */
    public void reportMessage(String message) {
        emitIfAllowed(ProgressInfo.of(0, 0, message), false);
    }

    public String getJobId() {
        return jobId;
    }

    public JobType getJobType() {
        return jobType;
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }

    private static boolean completes(int current, int total) {
        return total > 0 && current == total;
    }

    private void emitIfAllowed(ProgressInfo progress, boolean bypassThrottle) {
        if (events == null) {
            return;
        }

        synchronized (throttleLock) {
            long now = nanoClock.getAsLong();
            if (!bypassThrottle && emitted && now - lastEmitNanos < minIntervalNanos) {
                return;
            }
            lastEmitNanos = now;
            emitted = true;
        }

        events.emit(EventType.JOB_PROGRESS, MODULE,
            JobStatusData.progress(jobId, jobType.id(), description, progress));
    }
}
