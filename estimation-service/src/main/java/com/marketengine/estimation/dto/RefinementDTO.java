package com.marketengine.estimation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketengine.common.model.BrandMoatVerdict;
import com.marketengine.common.model.Tier2Refinement;

/**
 * Stored Tier-2 result for one analysis, returned by
 * {@code GET /api/v1/analyze/{snapshotId}/refinement}.
 */
public record RefinementDTO(
    @JsonProperty("snapshotId")  String snapshotId,
    @JsonProperty("refinement")  Tier2Refinement refinement,
    @JsonProperty("brandMoat")   BrandMoatVerdict brandMoat
) {}
