package com.sentinel.service.queue;

/**
 * Base class for job queue failures.
 */
public class JobQueueException extends RuntimeException {

    public JobQueueException(String message) {
        super(message);
    }

    public JobQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
