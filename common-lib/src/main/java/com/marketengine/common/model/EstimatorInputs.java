package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Page-level market signals consumed by the heuristic baselines and the
 * calibration model.
 *
 * @param avgPrice  null when no listing carried a price
 * @param rawUnits  Tier-1 page total, input to the revenue baseline
 * @param rawRevenue Tier-1 page total, input to the revenue baseline
 */
public record EstimatorInputs(
    @JsonProperty("page1Count") int page1Count,
    @JsonProperty("avgReviews") double avgReviews,
    @JsonProperty("reviewDispersion") double reviewDispersion,
    @JsonProperty("sponsoredCount") int sponsoredCount,
    @JsonProperty("avgPrice") Double avgPrice,
    @JsonProperty("priceMin") double priceMin,
    @JsonProperty("priceMax") double priceMax,
    @JsonProperty("category") String category,
    @JsonProperty("rawUnits") long rawUnits,
    @JsonProperty("rawRevenue") long rawRevenue
) {
    /** Sponsored listings as a percentage of page one, 0-100. */
    @JsonIgnore
    public double sponsoredPct() {
        return page1Count > 0 ? (sponsoredCount * 100.0) / page1Count : 0.0;
    }

    @JsonIgnore
    public double avgReviewsLog() {
        return avgReviews > 0 ? Math.log(avgReviews + 1) : 0.0;
    }

    /** Feature vector in the order {@link ModelCoefficients} expects. */
    @JsonIgnore
    public double[] features() {
        return new double[] {
            page1Count,
            avgReviewsLog(),
            sponsoredPct(),
            avgPrice != null ? avgPrice : 0.0
        };
    }
}
