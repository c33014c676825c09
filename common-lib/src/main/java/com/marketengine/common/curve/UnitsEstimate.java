package com.marketengine.common.curve;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Monthly unit estimate derived from a category rank.
 *
 * @param units          smoothed and clamped units, within [5, 100000]
 * @param rawUnits       unsmoothed curve output
 * @param clamped        true when the smoothed value fell outside the band
 * @param categoryKey    normalized category key used for the lookup
 * @param defaultCurve   true when the category had no dedicated curve
 */
public record UnitsEstimate(
    @JsonProperty("units") long units,
    @JsonProperty("rawUnits") double rawUnits,
    @JsonProperty("clamped") boolean clamped,
    @JsonProperty("categoryKey") String categoryKey,
    @JsonProperty("defaultCurve") boolean defaultCurve
) {}
