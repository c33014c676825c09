package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Asynchronous refinement of one Tier-1 snapshot.
 *
 * <p>Every step is optional: a step that failed leaves its fields null and its
 * name in {@code failedSteps}. The Tier-1 snapshot is never modified; this record
 * is stored separately under the same {@code snapshotId}.
 *
 * @param rankDerivedUnits   sum of curve units over listings that carried a category rank; null without rank data
 * @param rankCoverage       number of listings that carried a usable category rank
 */
public record Tier2Refinement(
    @JsonProperty("snapshotId") String snapshotId,
    @JsonProperty("calibratedUnits") Long calibratedUnits,
    @JsonProperty("calibratedRevenue") Long calibratedRevenue,
    @JsonProperty("calibratedRevenueLow") Long calibratedRevenueLow,
    @JsonProperty("calibratedRevenueHigh") Long calibratedRevenueHigh,
    @JsonProperty("calibrationSource") String calibrationSource,
    @JsonProperty("modelVersion") String modelVersion,
    @JsonProperty("searchVolumeLow") Long searchVolumeLow,
    @JsonProperty("searchVolumeHigh") Long searchVolumeHigh,
    @JsonProperty("rankDerivedUnits") Long rankDerivedUnits,
    @JsonProperty("rankDerivedRevenue") Long rankDerivedRevenue,
    @JsonProperty("rankCoverage") int rankCoverage,
    @JsonProperty("confidenceScore") Integer confidenceScore,
    @JsonProperty("confidenceLevel") ConfidenceLevel confidenceLevel,
    @JsonProperty("algorithmBoosts") List<AlgorithmBoost> algorithmBoosts,
    @JsonProperty("brandDominance") BrandDominance brandDominance,
    @JsonProperty("failedSteps") List<String> failedSteps,
    @JsonProperty("completedAt") Instant completedAt
) {}
