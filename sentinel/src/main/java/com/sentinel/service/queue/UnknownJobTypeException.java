package com.sentinel.service.queue;

import com.sentinel.domain.job.JobType;

/**
 * No handler registered for a job type. A configuration error, never retried.
 */
public class UnknownJobTypeException extends JobQueueException {

    private final JobType jobType;

    public UnknownJobTypeException(JobType jobType) {
        super("No handler registered for job type: " + jobType);
        this.jobType = jobType;
    }

    public JobType getJobType() {
        return jobType;
    }
}
