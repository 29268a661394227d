package com.sentinel.service.queue;

import java.time.Duration;

/**
 * A handler ran past its timeout. Counts as a normal, retryable failure.
 */
public class JobTimeoutException extends JobQueueException {

    public JobTimeoutException(String jobId, Duration timeout) {
        super(String.format("Job %s timed out after %dms", jobId, timeout.toMillis()));
    }
}
