package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What one analysis produced. Every field is nullable: a Tier-2 step that
 * failed simply leaves its output absent.
 *
 * @param rankDerivedRevenue revenue from the category-rank curve; preferred as the
 *                           revenue training reference when present
 */
public record ObservationOutputs(
    @JsonProperty("tier1TotalUnits") Long tier1TotalUnits,
    @JsonProperty("tier1TotalRevenue") Long tier1TotalRevenue,
    @JsonProperty("searchVolumeLow") Long searchVolumeLow,
    @JsonProperty("searchVolumeHigh") Long searchVolumeHigh,
    @JsonProperty("revenueLow") Long revenueLow,
    @JsonProperty("revenueHigh") Long revenueHigh,
    @JsonProperty("calibratedUnits") Long calibratedUnits,
    @JsonProperty("rankDerivedRevenue") Long rankDerivedRevenue,
    @JsonProperty("confidenceScore") Integer confidenceScore
) {}
