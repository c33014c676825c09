package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fulfillment fee for one unit.
 *
 * @param exact true only for a live quote from the marketplace fee service
 */
public record FeeQuote(
    @JsonProperty("amount") double amount,
    @JsonProperty("exact") boolean exact
) {
    public static FeeQuote exactQuote(double amount) {
        return new FeeQuote(amount, true);
    }
}
