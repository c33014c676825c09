package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Synchronous Tier-1 result for one analysis. {@code snapshotId} keys the
 * Tier-2 refinement produced later for the same analysis.
 */
public record Tier1Snapshot(
    @JsonProperty("snapshotId") String snapshotId,
    @JsonProperty("keyword") String keyword,
    @JsonProperty("marketplace") String marketplace,
    @JsonProperty("products") List<Tier1Product> products,
    @JsonProperty("aggregates") Tier1Aggregates aggregates,
    @JsonProperty("createdAt") Instant createdAt
) {}
