package com.sentinel.service.queue;

import com.sentinel.domain.job.Job;
import com.sentinel.domain.job.JobPriority;
import com.sentinel.domain.job.JobType;
import com.sentinel.infrastructure.metrics.JobMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the job queue.
 *
 * Producers (scheduler loops, event listeners, the HTTP trigger) and consumers
 * (worker pool) call concurrently; every queue access goes through this class.
 *
 * Availability and FIFO order are judged against {@link #getClock()}; producers stamp
 * {@code createdAt} from that clock, not from the wall clock.
 *
 * Cadence primitive:
 * <pre>
 * // Safe to call every minute: enqueues at most once per hour
 * jobManager.enqueueIfShouldRun(JobType.HOURLY_BACKUP, JobPriority.MEDIUM, Duration.ofHours(1), Map.of());
 * </pre>
 */
public final class JobManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobManager.class);

    private final PriorityJobQueue queue;
    private final Clock clock;
    private final int capacity;
    private final int defaultMaxRetries;
    private final JobMetrics metrics;

    // Last successful enqueue per type, for enqueueIfShouldRun
    private final Map<JobType, Instant> lastEnqueued = new ConcurrentHashMap<>();
    private final Object cadenceLock = new Object();

    public JobManager() {
        this(Clock.systemUTC(), 0, 3, JobMetrics.NOOP);
    }

    /**
     * @param clock time source for availability and cadence checks
     * @param capacity max queued jobs, 0 for unbounded
     * @param defaultMaxRetries retry budget for jobs created by enqueueIfShouldRun
     * @param metrics metrics sink
     */
    public JobManager(Clock clock, int capacity, int defaultMaxRetries, JobMetrics metrics) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.capacity = capacity;
        this.defaultMaxRetries = defaultMaxRetries;
        this.metrics = metrics == null ? JobMetrics.NOOP : metrics;
        this.queue = new PriorityJobQueue(clock, capacity);
    }

    /**
     * Insert a job. Never blocks.
     *
     * @throws NullPointerException if job is null
     * @throws QueueFullException if a bounded queue is at capacity
     * @throws QueueClosedException if the manager is closed
     */
    public void enqueue(Job job) {
        Objects.requireNonNull(job, "job");
        try {
            queue.add(job);
        } catch (QueueFullException e) {
            metrics.recordRejected(job.getType().id(), "FULL");
            throw e;
        } catch (QueueClosedException e) {
            metrics.recordRejected(job.getType().id(), "CLOSED");
            throw e;
        }
        metrics.recordEnqueued(job.getType().id(), job.getPriority().name());
        metrics.setQueueDepth(queue.size());
        log.debug("[QUEUE] Enqueued {} (priority={}, availableAt={})",
            job.getId(), job.getPriority(), job.getAvailableAt());
    }

    /**
     * Enqueue a fresh job of this type unless one was enqueued less than {@code interval} ago.
     *
     * Tracks the last successful enqueue, not completion. A failed enqueue leaves the
     * timestamp untouched, so the next call tries again.
     *
     * @return true if a job was enqueued
     * @throws JobQueueException if the queue rejected the job
     */
    public boolean enqueueIfShouldRun(JobType type, JobPriority priority, Duration interval,
                                      Map<String, Object> payload) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(interval, "interval");

        synchronized (cadenceLock) {
            Instant now = clock.instant();
            Instant last = lastEnqueued.get(type);
            if (last != null && Duration.between(last, now).compareTo(interval) < 0) {
                log.debug("[QUEUE] Skipping {}: last enqueued {} ago (interval {})",
                    type, Duration.between(last, now), interval);
                return false;
            }

            Job job = Job.builder(type)
                .priority(priority)
                .payload(payload)
                .createdAt(now)
                .maxRetries(defaultMaxRetries)
                .build();
            enqueue(job);
            lastEnqueued.put(type, now);
            return true;
        }
    }

    /**
     * Enqueue unless a job of the same type is still waiting in the queue.
     * Collapses bursts of identical work into one pending job.
     *
     * @return true if enqueued, false if an equivalent job was already pending
     * @throws JobQueueException if the queue rejected the job
     */
    public boolean enqueueIfNotPending(Job job) {
        Objects.requireNonNull(job, "job");
        boolean added;
        try {
            added = queue.addIfNotPending(job);
        } catch (QueueFullException e) {
            metrics.recordRejected(job.getType().id(), "FULL");
            throw e;
        } catch (QueueClosedException e) {
            metrics.recordRejected(job.getType().id(), "CLOSED");
            throw e;
        }
        if (!added) {
            log.debug("[QUEUE] {} already pending, dropped duplicate {}", job.getType(), job.getId());
            return false;
        }
        metrics.recordEnqueued(job.getType().id(), job.getPriority().name());
        metrics.setQueueDepth(queue.size());
        return true;
    }

    /**
     * Block until a job is ready.
     *
     * @return the highest-priority ready job, or null once the manager is closed
     */
    public Job dequeue() throws InterruptedException {
        return afterDequeue(queue.take());
    }

    /**
     * Block up to {@code timeout} for a ready job.
     *
     * @return the job, or null on timeout or close
     */
    public Job dequeue(Duration timeout) throws InterruptedException {
        return afterDequeue(queue.poll(timeout));
    }

    /**
     * Non-blocking dequeue.
     */
    public Optional<Job> tryDequeue() {
        return Optional.ofNullable(afterDequeue(queue.pollReady()));
    }

    public Optional<Instant> getLastEnqueueTime(JobType type) {
        return Optional.ofNullable(lastEnqueued.get(type));
    }

    public boolean isPending(JobType type) {
        return queue.containsType(type);
    }

    public int size() {
        return queue.size();
    }

    public Map<JobPriority, Integer> pendingByPriority() {
        return queue.countsByPriority();
    }

    public List<Job> pendingJobs() {
        return queue.snapshot();
    }

    public int getCapacity() {
        return capacity;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public Clock getClock() {
        return clock;
    }

    public boolean isClosed() {
        return queue.isClosed();
    }

    /**
     * Reject further enqueues and release blocked dequeuers. Idempotent.
     */
    @Override
    public void close() {
        if (!queue.isClosed()) {
            queue.close();
            log.info("[QUEUE] Job manager closed with {} job(s) still queued", queue.size());
        }
    }

    private Job afterDequeue(Job job) {
        if (job != null) {
            metrics.setQueueDepth(queue.size());
            log.debug("[QUEUE] Dequeued {} (priority={})", job.getId(), job.getPriority());
        }
        return job;
    }
}
