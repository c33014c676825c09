package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

/**
 * Immutable record of one completed analysis, appended once and used only as
 * calibration training data.
 */
public record MarketObservation(
    @JsonProperty("id") Long id,
    @JsonProperty("marketplace") String marketplace,
    @JsonProperty("keyword") String keyword,
    @JsonProperty("normalizedKeyword") String normalizedKeyword,
    @JsonProperty("page") int page,
    @JsonProperty("snapshotId") String snapshotId,
    @JsonProperty("summary") ListingSummary summary,
    @JsonProperty("inputs") EstimatorInputs inputs,
    @JsonProperty("outputs") ObservationOutputs outputs,
    @JsonProperty("dataQuality") DataQuality dataQuality,
    @JsonProperty("createdAt") Instant createdAt
) {
    public static String normalizeKeyword(String keyword) {
        return keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
    }
}
