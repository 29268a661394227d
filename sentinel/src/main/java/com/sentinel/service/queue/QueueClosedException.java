package com.sentinel.service.queue;

import com.sentinel.domain.job.Job;

/**
 * Thrown when enqueueing into a closed job manager.
 */
public class QueueClosedException extends JobQueueException {

    public QueueClosedException(Job job) {
        super(String.format("Job manager closed, rejected %s [%s]", job.getType(), job.getId()));
    }
}
