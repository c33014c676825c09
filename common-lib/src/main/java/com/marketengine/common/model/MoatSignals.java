package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MoatSignals(
    @JsonProperty("revenueConcentration") boolean revenueConcentration,
    @JsonProperty("slotControl") boolean slotControl,
    @JsonProperty("reviewLadder") boolean reviewLadder,
    @JsonProperty("priceImmunity") boolean priceImmunity
) {
    public static MoatSignals none() {
        return new MoatSignals(false, false, false, false);
    }
}
