package com.sentinel.service.queue;

import com.sentinel.domain.job.Job;

/**
 * Thrown when a bounded queue is at capacity. Enqueue never blocks the caller.
 */
public class QueueFullException extends JobQueueException {

    private final String jobId;
    private final int capacity;

    public QueueFullException(Job job, int capacity) {
        super(String.format("Queue full (capacity %d), rejected %s [%s]", capacity, job.getType(), job.getId()));
        this.jobId = job.getId();
        this.capacity = capacity;
    }

    public String getJobId() {
        return jobId;
    }

    public int getCapacity() {
        return capacity;
    }
}
