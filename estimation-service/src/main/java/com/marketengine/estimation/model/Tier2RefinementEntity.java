package com.marketengine.estimation.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Stored Tier-2 result for one analysis, keyed by the Tier-1 snapshot id.
 * Written through an upsert, so a repeated refinement replaces the row.
 */
@Data
@NoArgsConstructor
@Table("tier2_refinements")
public class Tier2RefinementEntity {

    @Id
    private String snapshotId;

    private String marketplace;

    private String keyword;

    /** JSON-serialised {@code Tier2Refinement} */
    private String refinement;

    /** JSON-serialised {@code BrandMoatVerdict}; null when classification did not run */
    private String moatVerdict;

    private LocalDateTime completedAt;
}
