package com.sentinel.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RECOMMENDATIONS_READY payload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecommendationsReadyData(
    @JsonProperty("portfolio_hash")
    String portfolioHash,

    @JsonProperty("count")
    int count
) implements EventData {
}
