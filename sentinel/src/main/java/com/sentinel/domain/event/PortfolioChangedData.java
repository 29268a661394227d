package com.sentinel.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * STATE_CHANGED payload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PortfolioChangedData(
    @JsonProperty("sync_completed")
    boolean syncCompleted,

    @JsonProperty("portfolio_hash")
    String portfolioHash
) implements EventData {
}
