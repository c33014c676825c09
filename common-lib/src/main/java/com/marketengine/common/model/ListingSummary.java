package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ListingSummary(
    @JsonProperty("avgPrice") Double avgPrice,
    @JsonProperty("avgReviews") double avgReviews,
    @JsonProperty("avgRating") Double avgRating,
    @JsonProperty("sponsoredPct") double sponsoredPct,
    @JsonProperty("totalListings") int totalListings,
    @JsonProperty("fulfillmentMix") Map<Fulfillment, Integer> fulfillmentMix
) {}
