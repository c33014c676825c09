package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Brand revenue concentration over the Tier-1 products.
 *
 * @param top5SharePct cumulative revenue share of the five largest brands, 0-100
 * @param brands       per-brand shares, largest first (at most ten)
 */
public record BrandDominance(
    @JsonProperty("top5SharePct") double top5SharePct,
    @JsonProperty("brands") List<BrandShare> brands
) {}
