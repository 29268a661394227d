package com.sentinel.service.scheduler;

import com.sentinel.application.port.output.MarketStateDetector;
import com.sentinel.domain.job.Job;
import com.sentinel.domain.job.JobCatalog;
import com.sentinel.domain.job.JobType;
import com.sentinel.service.queue.JobManager;
import com.sentinel.service.queue.JobQueueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Time-driven job producer.
 *
 * Three loops on one scheduled executor:
 * - Fast loop (every minute): daily / weekly / monthly cadences at their HH:MM,
 *   plus the deployment check
 * - Hourly loop (every hour, first run immediately): hourly cadences
 * - Market sync loop (every minute): sync_cycle on minutes aligned with the interval
 *   the market-state detector recommends; fixed fallback interval without a detector
 *
 * Every calendar enqueue goes through JobManager.enqueueIfShouldRun, so a tick that
 * fires twice in a minute (clock skew, restart) never duplicates work. Enqueue
 * failures are logged; the tick carries on.
 *
 * start() is idempotent; stop() cancels every loop and returns only once they have
 * exited. Each start() gets a fresh executor and cancellation flag.
 *
 * The tick methods are public so callers (and tests) can drive the scheduler with
 * explicit times instead of waiting for the executor.
 */
public final class TimeScheduler {
    private static final Logger log = LoggerFactory.getLogger(TimeScheduler.class);

    private static final Duration MINUTE = Duration.ofMinutes(1);
    private static final Duration HOUR = Duration.ofHours(1);

    private final JobManager jobManager;
    private final MarketStateDetector detector;     // Null = fixed fallback interval
    private final List<Cadence> cadences;
    private final ZoneId zone;
    private final Clock clock;
    private final Duration fallbackSyncInterval;
    private final Duration deploymentInterval;      // Zero = deployment checks disabled

    // Private bookkeeping, guarded by stateLock (not `this`: stop() holds that while ticks drain)
    private final Object stateLock = new Object();
    private final Map<JobType, LocalDateTime> lastFiredSlot = new HashMap<>();
    private long lastSyncMinute = Long.MIN_VALUE;

    private ScheduledExecutorService executor;
    private AtomicBoolean cancelled;
    private volatile boolean running = false;

    private TimeScheduler(Builder builder) {
        this.jobManager = builder.jobManager;
        this.detector = builder.detector;
        this.cadences = List.copyOf(builder.cadences);
        this.zone = builder.zone;
        this.clock = builder.clock;
        this.fallbackSyncInterval = builder.fallbackSyncInterval;
        this.deploymentInterval = builder.deploymentInterval;
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    public synchronized void start() {
        if (running) {
            log.info("[SCHEDULER] Already running, start ignored");
            return;
        }

        AtomicBoolean token = new AtomicBoolean(false);
        AtomicInteger threadSeq = new AtomicInteger();
        ScheduledExecutorService exec = Executors.newScheduledThreadPool(3, r -> {
            Thread t = new Thread(r, "time-scheduler-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        long toNextMinute = millisUntilNextMinute();
        exec.scheduleAtFixedRate(guarded(token, "fast", () -> tickFast(now())),
            toNextMinute, MINUTE.toMillis(), TimeUnit.MILLISECONDS);
        exec.scheduleAtFixedRate(guarded(token, "hourly", () -> tickHourly(now())),
            0, HOUR.toMillis(), TimeUnit.MILLISECONDS);
        exec.scheduleAtFixedRate(guarded(token, "market-sync", () -> tickMarketSync(now())),
            toNextMinute, MINUTE.toMillis(), TimeUnit.MILLISECONDS);

        this.executor = exec;
        this.cancelled = token;
        this.running = true;

        log.info("[SCHEDULER] Started ({} cadences, zone {}, market detector: {}, deployment check: {})",
            cadences.size(), zone, detector == null ? "none, fallback " + fallbackSyncInterval : detector.getClass().getSimpleName(),
            deploymentInterval.isZero() ? "off" : deploymentInterval);
    }

    /**
     * Cancel all loops and wait for them to exit. No enqueue happens after this returns.
     * Idempotent.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("[SCHEDULER] Stopping");
        cancelled.set(true);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("[SCHEDULER] Loops did not exit in 10s, interrupting");
                executor.shutdownNow();
                executor.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        executor = null;
        running = false;
        log.info("[SCHEDULER] Stopped");
    }

    public boolean isRunning() {
        return running;
    }

    // ═══════════════════════════════════════════════════════════════
    // TICKS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Calendar cadences due at {@code now}, plus the deployment check.
     *
     * @return number of jobs enqueued
     */
    public int tickFast(ZonedDateTime now) {
        ZonedDateTime local = now.withZoneSameInstant(zone);
        LocalDateTime slot = local.toLocalDateTime().truncatedTo(ChronoUnit.MINUTES);
        int enqueued = 0;

        for (Cadence cadence : cadences) {
            if (!cadence.matches(local)) {
                continue;
            }
            synchronized (stateLock) {
                if (slot.equals(lastFiredSlot.get(cadence.jobType()))) {
                    log.debug("[SCHEDULER] {} already fired for {}", cadence.jobType(), slot);
                    continue;
                }
            }
            Boolean result = enqueueCadence(cadence.jobType(), cadence, Map.of("scheduled_for", slot.toString()));
            if (result != null) {
                synchronized (stateLock) {
                    lastFiredSlot.put(cadence.jobType(), slot);
                }
                if (result) {
                    enqueued++;
                }
            }
        }

        if (!deploymentInterval.isZero()) {
            Boolean result = enqueueInterval(JobType.DEPLOYMENT, deploymentInterval);
            if (Boolean.TRUE.equals(result)) {
                enqueued++;
            }
        }
        return enqueued;
    }

    /**
     * Hourly cadences.
     *
     * @return number of jobs enqueued
     */
    public int tickHourly(ZonedDateTime now) {
        int enqueued = 0;
        for (Cadence cadence : cadences) {
            if (cadence.isHourly() && Boolean.TRUE.equals(enqueueCadence(cadence.jobType(), cadence, Map.of()))) {
                enqueued++;
            }
        }
        log.debug("[SCHEDULER] Hourly tick at {}: {} job(s) enqueued", now, enqueued);
        return enqueued;
    }

    /**
     * Enqueue sync_cycle if {@code now} falls on the recommended interval and this
     * minute has not synced yet.
     *
     * @return true if a sync job was enqueued
     */
    public boolean tickMarketSync(ZonedDateTime now) {
        Duration interval;
        if (detector == null) {
            interval = fallbackSyncInterval;
        } else {
            try {
                interval = detector.getSyncInterval(now);
            } catch (RuntimeException e) {
                log.warn("[SCHEDULER] Market-state detector failed, skipping sync tick: {}", e.getMessage());
                return false;
            }
        }

        if (interval == null || interval.isZero() || interval.isNegative()) {
            log.debug("[SCHEDULER] Markets closed at {}, no sync", now);
            return false;
        }

        long intervalMinutes = Math.max(1, interval.toMinutes());
        ZonedDateTime local = now.withZoneSameInstant(zone);
        int minuteOfDay = local.getHour() * 60 + local.getMinute();
        if (minuteOfDay % intervalMinutes != 0) {
            return false;
        }

        long epochMinute = now.toEpochSecond() / 60;
        synchronized (stateLock) {
            if (epochMinute == lastSyncMinute) {
                log.debug("[SCHEDULER] Sync already triggered for minute {}", local.toLocalTime());
                return false;
            }

            Job job = Job.builder(JobType.SYNC_CYCLE)
                .priority(JobCatalog.defaultPriority(JobType.SYNC_CYCLE))
                .createdAt(jobManager.getClock().instant())
                .maxRetries(jobManager.getDefaultMaxRetries())
                .payload(Map.of("sync_interval_minutes", intervalMinutes))
                .build();
            try {
                jobManager.enqueue(job);
            } catch (JobQueueException e) {
                log.warn("[SCHEDULER] Failed to enqueue {} [{}]: {}", job.getType(), job.getId(), e.getMessage());
                return false;
            }
            lastSyncMinute = epochMinute;
        }
        log.info("[SCHEDULER] Sync enqueued at {} (interval {}m)", local.toLocalTime(), intervalMinutes);
        return true;
    }

    // ═══════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════

    // null = enqueue failed, true = enqueued, false = guarded
    private Boolean enqueueCadence(JobType type, Cadence cadence, Map<String, Object> payload) {
        try {
            boolean enqueued = jobManager.enqueueIfShouldRun(type, cadence.priority(), cadence.guard(), payload);
            if (enqueued) {
                log.info("[SCHEDULER] {} cadence fired: {}", cadence.frequency(), type);
            }
            return enqueued;
        } catch (JobQueueException e) {
            log.warn("[SCHEDULER] Failed to enqueue {}: {}", type, e.getMessage());
            return null;
        }
    }

    private Boolean enqueueInterval(JobType type, Duration interval) {
        try {
            return jobManager.enqueueIfShouldRun(type, JobCatalog.defaultPriority(type), interval, Map.of());
        } catch (JobQueueException e) {
            log.warn("[SCHEDULER] Failed to enqueue {}: {}", type, e.getMessage());
            return null;
        }
    }

    private Runnable guarded(AtomicBoolean token, String loop, Runnable tick) {
        return () -> {
            if (token.get()) {
                return;
            }
            try {
                tick.run();
            } catch (RuntimeException e) {
                // An escaping exception would cancel the periodic task
                log.error("[SCHEDULER] {} loop tick failed", loop, e);
            }
        };
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock).withZoneSameInstant(zone);
    }

    private long millisUntilNextMinute() {
        long nowMillis = clock.millis();
        return MINUTE.toMillis() - (nowMillis % MINUTE.toMillis());
    }

    public List<Cadence> getCadences() {
        return cadences;
    }

    public ZoneId getZone() {
        return zone;
    }

    public static Builder builder(JobManager jobManager) {
        return new Builder(jobManager);
    }

    public static class Builder {
        private final JobManager jobManager;
        private MarketStateDetector detector;
        private List<Cadence> cadences = CadenceTable.defaults(2);
        private ZoneId zone = ZoneId.systemDefault();
        private Clock clock = Clock.systemUTC();
        private Duration fallbackSyncInterval = Duration.ofMinutes(5);
        private Duration deploymentInterval = Duration.ofMinutes(5);

        private Builder(JobManager jobManager) {
            this.jobManager = Objects.requireNonNull(jobManager, "jobManager");
        }

        public Builder marketStateDetector(MarketStateDetector detector) {
            this.detector = detector;
            return this;
        }

        public Builder cadences(List<Cadence> cadences) {
            this.cadences = Objects.requireNonNull(cadences, "cadences");
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone, "zone");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder fallbackSyncInterval(Duration interval) {
            this.fallbackSyncInterval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        /**
         * Zero disables the deployment check.
         */
        public Builder deploymentInterval(Duration interval) {
            this.deploymentInterval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        public TimeScheduler build() {
            return new TimeScheduler(this);
        }
    }
}
