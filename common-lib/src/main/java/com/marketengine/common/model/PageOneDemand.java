package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Page-one demand band: total units clamped into the band of the detected
 * competition level, revenue derived from the median page-one price.
 */
public record PageOneDemand(
    @JsonProperty("competitionLevel") CompetitionLevel competitionLevel,
    @JsonProperty("organicCount") int organicCount,
    @JsonProperty("medianReviews") double medianReviews,
    @JsonProperty("unitsMin") long unitsMin,
    @JsonProperty("unitsMax") long unitsMax,
    @JsonProperty("totalUnits") long totalUnits,
    @JsonProperty("totalRevenue") long totalRevenue
) {}
