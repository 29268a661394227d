package com.sentinel.service.queue;

import java.util.Map;

/**
 * Business logic for one job type.
 *
 * Returning normally completes the job. Throwing anything counts as a failed
 * attempt and is retried within the job's retry budget.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * @param payload the job payload, read-only
     * @param progress reporter bound to this job run
     * @throws Exception if the attempt failed
     */
    void handle(Map<String, Object> payload, ProgressReporter progress) throws Exception;
}
