package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Minimal page-one row consumed by the brand moat classifier.
 *
 * @param position 1-based page-one position; null falls back to input order
 */
public record PageOneListing(
    @JsonProperty("asin") String asin,
    @JsonProperty("brand") String brand,
    @JsonProperty("estimatedMonthlyRevenue") double estimatedMonthlyRevenue,
    @JsonProperty("reviewCount") Integer reviewCount,
    @JsonProperty("price") Double price,
    @JsonProperty("position") Integer position
) {
    public static PageOneListing from(Tier1Product product) {
        return new PageOneListing(product.asin(), product.brand(),
            product.estimatedMonthlyRevenue(), product.reviewCount(), product.price(),
            product.pagePosition() > 0 ? product.pagePosition() : null);
    }
}
