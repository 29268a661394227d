package com.sentinel.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of a running job's progress.
 * total == 0 means indeterminate progress.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProgressInfo(
    @JsonProperty("current")
    int current,

    @JsonProperty("total")
    int total,

    @JsonProperty("message")
    String message,

    @JsonProperty("phase")
    String phase,           // Optional stage label for multi-stage jobs

    @JsonProperty("sub_phase")
    String subPhase,

    @JsonProperty("details")
    Map<String, Object> details
) {
    public ProgressInfo {
        details = details == null || details.isEmpty()
            ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ProgressInfo of(int current, int total, String message) {
        return new ProgressInfo(current, total, message, null, null, null);
    }

    public boolean isIndeterminate() {
        return total == 0;
    }

    public boolean isComplete() {
        return total > 0 && current == total;
    }
}
