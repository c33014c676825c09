package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tier-1 per-listing estimate. Units and revenue come from organic rank (or page
 * position) and price only; rank-in-category never feeds this record.
 */
public record Tier1Product(
    @JsonProperty("asin") String asin,
    @JsonProperty("title") String title,
    @JsonProperty("brand") String brand,
    @JsonProperty("price") Double price,
    @JsonProperty("rating") Double rating,
    @JsonProperty("reviewCount") Integer reviewCount,
    @JsonProperty("fulfillment") Fulfillment fulfillment,
    @JsonProperty("organicRank") Integer organicRank,
    @JsonProperty("pagePosition") int pagePosition,
    @JsonProperty("sponsored") boolean sponsored,
    @JsonProperty("estimatedMonthlyUnits") long estimatedMonthlyUnits,
    @JsonProperty("estimatedMonthlyRevenue") long estimatedMonthlyRevenue
) {}
