package com.sentinel.service.queue;

import com.sentinel.domain.common.EventType;
import com.sentinel.domain.event.JobStatusData;
import com.sentinel.domain.job.Job;
import com.sentinel.domain.job.JobCatalog;
import com.sentinel.infrastructure.metrics.JobMetrics;
import com.sentinel.service.core.EventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pulls jobs from the job manager and runs their handlers.
 *
 * Per job:
 * - unknown type: JOB_FAILED at once, never retried
 * - JOB_STARTED, then the handler with a progress reporter bound to the job
 * - success: JOB_COMPLETED with the attempt duration
 * - failure (exception, error, timeout): retries++, re-queued with backoff while
 *   retries <= maxRetries, else JOB_FAILED and the job is dropped
 *
 * stop() stops pulling new jobs and waits for in-flight ones up to the drain timeout.
 *
 * Usage:
 * <pre>
 * WorkerPool pool = WorkerPool.builder(jobManager, registry, eventService)
 *     .workers(2)
 *     .retryPolicy(RetryPolicy.builder().build())
 *     .build();
 * pool.start();
 * ...
 * pool.stop();
 * </pre>
 */
public final class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    static final String MODULE = "queue";

    // How long an idle worker blocks before re-checking the running flag
    private static final Duration POLL_INTERVAL = Duration.ofMillis(200);

    /**
     * What happened to a job after one pass through {@link #execute(Job)}.
     */
    public enum Outcome {
        COMPLETED,
        RETRY_SCHEDULED,
        FAILED
    }

    private final JobManager jobManager;
    private final JobRegistry registry;
    private final EventService events;
    private final RetryPolicy retryPolicy;
    private final int workerCount;
    private final Duration defaultTimeout;
    private final Duration progressThrottle;
    private final Duration drainTimeout;
    private final JobMetrics metrics;

    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong completedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private final AtomicLong retryCount = new AtomicLong();
    private final AtomicLong abandonedCount = new AtomicLong();

    private final Object lifecycleLock = new Object();
    private volatile boolean running = false;
    private ExecutorService workerExecutor;
    private ExecutorService handlerExecutor;

    /**
     * A job currently being executed, for status reporting.
     */
    public record InFlight(String jobId, String jobType, String worker, int attempt, Instant startedAt) {}

    private WorkerPool(Builder builder) {
        this.jobManager = builder.jobManager;
        this.registry = builder.registry;
        this.events = builder.events;
        this.retryPolicy = builder.retryPolicy;
        this.workerCount = builder.workers;
        this.defaultTimeout = builder.defaultTimeout;
        this.progressThrottle = builder.progressThrottle;
        this.drainTimeout = builder.drainTimeout;
        this.metrics = builder.metrics;
    }

    /**
     * Start the worker threads. Calling it while running does nothing.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.warn("[WORKER] Worker pool already running");
                return;
            }

            AtomicInteger workerSeq = new AtomicInteger();
            workerExecutor = Executors.newFixedThreadPool(workerCount, r -> {
                Thread t = new Thread(r, "job-worker-" + workerSeq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            AtomicInteger handlerSeq = new AtomicInteger();
            handlerExecutor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "job-handler-" + handlerSeq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });

            running = true;
            for (int i = 0; i < workerCount; i++) {
                workerExecutor.execute(this::runLoop);
            }
            log.info("[WORKER] Started {} worker(s) (default timeout: {}, drain timeout: {}s)",
                workerCount, defaultTimeout == null ? "none" : defaultTimeout, drainTimeout.toSeconds());
        }
    }

    /**
     * Stop pulling jobs, let in-flight jobs finish within the drain timeout, then
     * interrupt whatever is left. Idempotent.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            log.info("[WORKER] Stopping worker pool ({} job(s) in flight)", inFlight.size());

            workerExecutor.shutdown();
            try {
                if (!workerExecutor.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("[WORKER] Drain timeout reached, interrupting {} job(s)", inFlight.size());
                    workerExecutor.shutdownNow();
                    workerExecutor.awaitTermination(5, TimeUnit.SECONDS);
                }
            } catch (InterruptedException e) {
                workerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            } finally {
                handlerExecutor.shutdownNow();
            }
            log.info("[WORKER] Worker pool stopped (completed={}, failed={}, retried={})",
                completedCount.get(), failedCount.get(), retryCount.get());
        }
    }

    /**
     * Run one attempt of a job on the calling thread.
     */
    public Outcome execute(Job job) {
        Objects.requireNonNull(job, "job");
        String type = job.getType().id();
        String description = JobCatalog.describe(job.getType());

        JobRegistry.Registration registration;
        try {
            registration = registry.resolve(job.getType());
        } catch (UnknownJobTypeException e) {
            log.error("[WORKER] {} [{}]: {} - dropping without retry", type, job.getId(), e.getMessage());
            events.emit(EventType.JOB_FAILED, MODULE,
                JobStatusData.failed(job.getId(), type, description, 0L, e.getMessage()));
            metrics.recordFailed(type, Duration.ZERO);
            failedCount.incrementAndGet();
            return Outcome.FAILED;
        }

        int attempt = job.getRetries() + 1;
        inFlight.put(job.getId(), new InFlight(job.getId(), type, Thread.currentThread().getName(),
            attempt, Instant.now()));
        events.emit(EventType.JOB_STARTED, MODULE, JobStatusData.started(job.getId(), type, description));
        metrics.recordStarted(type);
        log.info("[WORKER] Running {} [{}] (attempt {}/{})", type, job.getId(), attempt, job.getMaxRetries() + 1);

        long startNanos = System.nanoTime();
        Throwable failure;
        try {
            invoke(job, registration);
            failure = null;
        } catch (VirtualMachineError fatal) {
            throw fatal;
        } catch (Throwable t) {
            failure = t;
        } finally {
            inFlight.remove(job.getId());
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);

        if (failure == null) {
            events.emit(EventType.JOB_COMPLETED, MODULE,
                JobStatusData.completed(job.getId(), type, description, duration.toMillis()));
            metrics.recordCompleted(type, duration);
            completedCount.incrementAndGet();
            log.info("[WORKER] ✓ {} [{}] completed in {}ms", type, job.getId(), duration.toMillis());
            return Outcome.COMPLETED;
        }

        return handleFailure(job, failure, duration, description);
    }

    public boolean isRunning() {
        return running;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public List<InFlight> getInFlight() {
        return List.copyOf(inFlight.values());
    }

    public long getCompletedCount() { return completedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public long getRetryCount() { return retryCount.get(); }

    /**
     * Timed-out handlers that were still running when their attempt was given up.
     */
    public long getAbandonedHandlerCount() { return abandonedCount.get(); }

    private void runLoop() {
        while (running) {
            Job job;
            try {
                job = jobManager.dequeue(POLL_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            if (job == null) {
                if (jobManager.isClosed()) {
                    log.info("[WORKER] Job manager closed, {} exiting", Thread.currentThread().getName());
                    break;
                }
                continue;
            }

            try {
                execute(job);
            } catch (Exception e) {
                // execute() handles handler failures itself; this is a bug in the engine
                log.error("[WORKER] Unexpected error processing {}: {}", job.getId(), e.getMessage(), e);
            }

            if (Thread.currentThread().isInterrupted()) {
                break;
            }
        }
    }

    private void invoke(Job job, JobRegistry.Registration registration) throws Exception {
        ProgressReporter progress = new ProgressReporter(events, job.getId(), job.getType(), progressThrottle);
        Duration timeout = registration.timeout() != null ? registration.timeout() : defaultTimeout;

        ExecutorService executor = handlerExecutor;
        if (timeout == null || timeout.isZero() || executor == null || executor.isShutdown()) {
            registration.handler().handle(job.getPayload(), progress);
            return;
        }

        AtomicReference<Thread> handlerThread = new AtomicReference<>();
        Future<?> future = executor.submit(() -> {
            handlerThread.set(Thread.currentThread());
            try {
                registration.handler().handle(job.getPayload(), progress);
            } finally {
                handlerThread.set(null);
            }
            return null;
        });
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            Thread abandoned = handlerThread.get();
            if (abandoned != null) {
                // Interrupt is only a request; a handler that ignores it overlaps the retry.
                abandonedCount.incrementAndGet();
                log.warn("[WORKER] ⚠ {} [{}] timed out after {}ms, handler thread {} interrupted and abandoned",
                    job.getType(), job.getId(), timeout.toMillis(), abandoned.getName());
            }
            throw new JobTimeoutException(job.getId(), timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private Outcome handleFailure(Job job, Throwable failure, Duration duration, String description) {
        String type = job.getType().id();
        String error = describe(failure);
        int retries = job.recordFailure();

        if (job.canRetry()) {
            Duration delay = retryPolicy.delayFor(retries);
            job.deferUntil(jobManager.getClock().instant().plus(delay));
            try {
                jobManager.enqueue(job);
                metrics.recordRetry(type);
                retryCount.incrementAndGet();
                log.warn("[WORKER] ⚠ {} [{}] failed (retry {}/{} in {}ms): {}",
                    type, job.getId(), retries, job.getMaxRetries(), delay.toMillis(), error);
                return Outcome.RETRY_SCHEDULED;
            } catch (JobQueueException e) {
                log.error("[WORKER] Could not re-queue {} [{}] for retry: {}", type, job.getId(), e.getMessage());
            }
        }

        events.emit(EventType.JOB_FAILED, MODULE,
            JobStatusData.failed(job.getId(), type, description, duration.toMillis(), error));
        metrics.recordFailed(type, duration);
        failedCount.incrementAndGet();
        log.error("[WORKER] ✗ {} [{}] failed after {} attempt(s): {}",
            type, job.getId(), retries, error, failure);
        return Outcome.FAILED;
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        if (t instanceof Exception && message != null) {
            return message;
        }
        // Errors and message-less exceptions: keep the type, it is the useful part
        return message == null ? t.getClass().getSimpleName() : t.getClass().getSimpleName() + ": " + message;
    }

    public static Builder builder(JobManager jobManager, JobRegistry registry, EventService events) {
        return new Builder(jobManager, registry, events);
    }

    public static class Builder {
        private final JobManager jobManager;
        private final JobRegistry registry;
        private final EventService events;
        private RetryPolicy retryPolicy = RetryPolicy.builder().build();
        private int workers = 1;
        private Duration defaultTimeout = null;
        private Duration progressThrottle = ProgressReporter.DEFAULT_MIN_INTERVAL;
        private Duration drainTimeout = Duration.ofSeconds(30);
        private JobMetrics metrics = JobMetrics.NOOP;

        private Builder(JobManager jobManager, JobRegistry registry, EventService events) {
            this.jobManager = Objects.requireNonNull(jobManager, "jobManager");
            this.registry = Objects.requireNonNull(registry, "registry");
            this.events = Objects.requireNonNull(events, "events");
        }

        public Builder workers(int workers) {
            if (workers < 1) {
                throw new IllegalArgumentException("workers must be >= 1, got " + workers);
            }
            this.workers = workers;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
            return this;
        }

        /**
         * Handler timeout for types registered without one. Null or zero disables it.
         */
        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder progressThrottle(Duration progressThrottle) {
            this.progressThrottle = progressThrottle;
            return this;
        }

        public Builder drainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        public Builder metrics(JobMetrics metrics) {
            this.metrics = metrics == null ? JobMetrics.NOOP : metrics;
            return this;
        }

        public WorkerPool build() {
            return new WorkerPool(this);
        }
    }
}
