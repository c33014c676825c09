package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Brand moat classification for one page-one listing set.
 *
 * <p>The raw numbers always describe the top-revenue brand. {@code dominantBrand}
 * is only named when the level is SOFT or HARD.
 */
public record BrandMoatVerdict(
    @JsonProperty("level") MoatLevel level,
    @JsonProperty("dominantBrand") String dominantBrand,
    @JsonProperty("signals") MoatSignals signals,
    @JsonProperty("revenueSharePct") double revenueSharePct,
    @JsonProperty("pageOneSlots") int pageOneSlots,
    @JsonProperty("top10Slots") int top10Slots
) {
    public static BrandMoatVerdict none() {
        return new BrandMoatVerdict(MoatLevel.NONE, null, MoatSignals.none(), 0.0, 0, 0);
    }
}
