package com.marketengine.common.cogs;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Category-level fulfillment fee range per unit. */
public record FeeEstimate(
    @JsonProperty("low") double low,
    @JsonProperty("high") double high,
    @JsonProperty("label") String label
) {
    public double midpoint() {
        return (low + high) / 2.0;
    }
}
