package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Map;

/**
 * Linear correction weights over the calibration feature vector
 * {@code [page1_count, log(avg_reviews + 1), sponsored_pct, avg_price]}.
 *
 * @param categoryMultipliers optional per-category scale factors; keyed by lower-case category
 */
public record ModelCoefficients(
    @JsonProperty("intercept") double intercept,
    @JsonProperty("page1CountCoef") double page1CountCoef,
    @JsonProperty("avgReviewsLogCoef") double avgReviewsLogCoef,
    @JsonProperty("sponsoredPctCoef") double sponsoredPctCoef,
    @JsonProperty("avgPriceCoef") double avgPriceCoef,
    @JsonProperty("categoryMultipliers") Map<String, Double> categoryMultipliers
) {
    public ModelCoefficients {
        categoryMultipliers = categoryMultipliers == null ? Map.of() : Map.copyOf(categoryMultipliers);
    }

    /** {@code intercept + sum coef_i * feature_i}. */
    public double adjustment(double[] features) {
        return intercept
            + page1CountCoef    * features[0]
            + avgReviewsLogCoef * features[1]
            + sponsoredPctCoef  * features[2]
            + avgPriceCoef      * features[3];
    }

    public double categoryMultiplier(String category) {
        if (category == null) {
            return 1.0;
        }
        return categoryMultipliers.getOrDefault(category.trim().toLowerCase(Locale.ROOT), 1.0);
    }
}
