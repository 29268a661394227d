package com.sentinel.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of JobMetrics.
 *
 * Key Metrics:
 * - sentinel_jobs_enqueued_total{job_type, priority}
 * - sentinel_jobs_rejected_total{job_type, reason} - FULL / CLOSED
 * - sentinel_job_attempts_total{job_type} - every handler invocation
 * - sentinel_jobs_completed_total{job_type}
 * - sentinel_jobs_failed_total{job_type} - terminal failures only
 * - sentinel_job_retries_total{job_type}
 * - sentinel_job_duration_seconds{job_type, outcome}
 * - sentinel_queue_depth
 *
 * Usage:
 * <pre>
 * PrometheusJobMetrics metrics = new PrometheusJobMetrics();
 * JobManager jobManager = new JobManager(clock, 0, 3, metrics);
 *
 * // Expose at /metrics endpoint
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusJobMetrics implements JobMetrics {

    private final CollectorRegistry registry;

    private final Counter enqueuedCounter;
    private final Counter rejectedCounter;
    private final Counter attemptCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter retryCounter;
    private final Histogram duration;
    private final Gauge queueDepth;

    public PrometheusJobMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusJobMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.enqueuedCounter = Counter.build()
            .name("sentinel_jobs_enqueued_total")
            .help("Jobs accepted by the queue")
            .labelNames("job_type", "priority")
            .register(registry);

        this.rejectedCounter = Counter.build()
            .name("sentinel_jobs_rejected_total")
            .help("Jobs refused by the queue")
            .labelNames("job_type", "reason")
            .register(registry);

        this.attemptCounter = Counter.build()
            .name("sentinel_job_attempts_total")
            .help("Handler invocations, retries included")
            .labelNames("job_type")
            .register(registry);

        this.completedCounter = Counter.build()
            .name("sentinel_jobs_completed_total")
            .help("Jobs completed successfully")
            .labelNames("job_type")
            .register(registry);

        this.failedCounter = Counter.build()
            .name("sentinel_jobs_failed_total")
            .help("Jobs abandoned after exhausting retries or with no handler")
            .labelNames("job_type")
            .register(registry);

        this.retryCounter = Counter.build()
            .name("sentinel_job_retries_total")
            .help("Failed attempts re-queued for retry")
            .labelNames("job_type")
            .register(registry);

        this.duration = Histogram.build()
            .name("sentinel_job_duration_seconds")
            .help("Handler duration of completed and terminally failed attempts")
            .labelNames("job_type", "outcome")
            .buckets(0.1, 0.5, 1.0, 5.0, 15.0, 60.0, 300.0, 900.0)
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("sentinel_queue_depth")
            .help("Jobs waiting in the queue, delayed retries included")
            .register(registry);
    }

    @Override
    public void recordEnqueued(String jobType, String priority) {
        enqueuedCounter.labels(jobType, priority).inc();
    }

    @Override
    public void recordRejected(String jobType, String reason) {
        rejectedCounter.labels(jobType, reason).inc();
    }

    @Override
    public void recordStarted(String jobType) {
        attemptCounter.labels(jobType).inc();
    }

    @Override
    public void recordCompleted(String jobType, Duration elapsed) {
        completedCounter.labels(jobType).inc();
        duration.labels(jobType, "completed").observe(seconds(elapsed));
    }

    @Override
    public void recordFailed(String jobType, Duration elapsed) {
        failedCounter.labels(jobType).inc();
        duration.labels(jobType, "failed").observe(seconds(elapsed));
    }

    @Override
    public void recordRetry(String jobType) {
        retryCounter.labels(jobType).inc();
    }

    @Override
    public void setQueueDepth(int depth) {
        queueDepth.set(depth);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    private static double seconds(Duration d) {
        return d.toNanos() / 1_000_000_000.0;
    }
}
