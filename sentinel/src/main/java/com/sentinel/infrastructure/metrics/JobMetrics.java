package com.sentinel.infrastructure.metrics;

import java.time.Duration;

/**
 * Job engine metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Enqueue / rejection counts per job type
 * - Attempt outcomes per job type
 * - Handler duration distribution
 * - Queue depth
 */
public interface JobMetrics {

    /**
     * Metrics sink that records nothing.
     */
    JobMetrics NOOP = new JobMetrics() {
        @Override public void recordEnqueued(String jobType, String priority) {}
        @Override public void recordRejected(String jobType, String reason) {}
        @Override public void recordStarted(String jobType) {}
        @Override public void recordCompleted(String jobType, Duration duration) {}
        @Override public void recordFailed(String jobType, Duration duration) {}
        @Override public void recordRetry(String jobType) {}
        @Override public void setQueueDepth(int depth) {}
    };

    /**
     * Record a job accepted by the queue.
     *
     * @param jobType Job type id
     * @param priority Priority name
     */
    void recordEnqueued(String jobType, String priority);

    /**
     * Record a job the queue refused.
     *
     * @param jobType Job type id
     * @param reason FULL, CLOSED, ...
     */
    void recordRejected(String jobType, String reason);

    void recordStarted(String jobType);

    void recordCompleted(String jobType, Duration duration);

    /**
     * Record a job abandoned after its final attempt (or an unknown type).
     */
    void recordFailed(String jobType, Duration duration);

    /**
     * Record a failed attempt that was re-queued.
     */
    void recordRetry(String jobType);

    void setQueueDepth(int depth);
}
