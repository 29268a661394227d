package com.sentinel.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of JOB_STARTED / JOB_PROGRESS / JOB_COMPLETED / JOB_FAILED.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobStatusData(
    @JsonProperty("job_id")
    String jobId,

    @JsonProperty("job_type")
    String jobType,

    @JsonProperty("status")
    String status,          // started | progress | completed | failed

    @JsonProperty("description")
    String description,

    @JsonProperty("progress")
    ProgressInfo progress,

    @JsonProperty("duration_ms")
    Long durationMs,

    @JsonProperty("error")
    String error
) implements EventData {

    public static final String STATUS_STARTED = "started";
    public static final String STATUS_PROGRESS = "progress";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    public static JobStatusData started(String jobId, String jobType, String description) {
        return new JobStatusData(jobId, jobType, STATUS_STARTED, description, null, null, null);
    }

    public static JobStatusData progress(String jobId, String jobType, String description, ProgressInfo progress) {
        return new JobStatusData(jobId, jobType, STATUS_PROGRESS, description, progress, null, null);
    }

    public static JobStatusData completed(String jobId, String jobType, String description, long durationMs) {
        return new JobStatusData(jobId, jobType, STATUS_COMPLETED, description, null, durationMs, null);
    }

    public static JobStatusData failed(String jobId, String jobType, String description, long durationMs, String error) {
        return new JobStatusData(jobId, jobType, STATUS_FAILED, description, null, durationMs, error);
    }
}
