package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Page-level Tier-1 aggregates returned alongside the per-listing products.
 *
 * @param totalMarketRevenue the heuristic market total the per-listing revenue was allocated from
 * @param avgPrice           null when no listing carried a price
 */
public record Tier1Aggregates(
    @JsonProperty("totalUnits") long totalUnits,
    @JsonProperty("totalRevenue") long totalRevenue,
    @JsonProperty("totalMarketRevenue") long totalMarketRevenue,
    @JsonProperty("avgPrice") Double avgPrice,
    @JsonProperty("avgReviews") Double avgReviews,
    @JsonProperty("avgRating") Double avgRating,
    @JsonProperty("sponsoredCount") int sponsoredCount,
    @JsonProperty("fulfillmentMix") Map<Fulfillment, Integer> fulfillmentMix,
    @JsonProperty("demand") PageOneDemand demand
) {}
