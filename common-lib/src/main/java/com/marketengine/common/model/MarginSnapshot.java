package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Margin range for one analysis.
 *
 * <p>Margins are floored at 0%. When costs exceed the price the floor hides the
 * loss in the percentages, so {@code belowBreakeven} and the breakeven prices
 * carry it instead.
 *
 * @param assumptions ordered, human-readable notes for every substituted value
 * @param request     inputs the snapshot was built from
 */
public record MarginSnapshot(
    @JsonProperty("mode") MarginMode mode,
    @JsonProperty("assumedPrice") double assumedPrice,
    @JsonProperty("priceSource") PriceSource priceSource,
    @JsonProperty("cogsMin") double cogsMin,
    @JsonProperty("cogsMax") double cogsMax,
    @JsonProperty("cogsSource") CogsSource cogsSource,
    @JsonProperty("fbaFee") double fbaFee,
    @JsonProperty("fbaFeeSource") FeeSource fbaFeeSource,
    @JsonProperty("netMarginMinPct") double netMarginMinPct,
    @JsonProperty("netMarginMaxPct") double netMarginMaxPct,
    @JsonProperty("breakevenPriceMin") double breakevenPriceMin,
    @JsonProperty("breakevenPriceMax") double breakevenPriceMax,
    @JsonProperty("belowBreakeven") boolean belowBreakeven,
    @JsonProperty("confidenceTier") ConfidenceTier confidenceTier,
    @JsonProperty("confidenceReason") String confidenceReason,
    @JsonProperty("assumptions") List<String> assumptions,
    @JsonProperty("request") MarginRequest request
) {}
