package com.sentinel.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * DIVIDEND_DETECTED payload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DividendDetectedData(
    @JsonProperty("symbol")
    String symbol,

    @JsonProperty("amount")
    BigDecimal amount,

    @JsonProperty("currency")
    String currency
) implements EventData {
}
