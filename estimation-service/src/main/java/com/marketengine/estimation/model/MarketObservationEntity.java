package com.marketengine.estimation.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Append-only training observation.
 *
 * summary    : JSON-serialised {@code ListingSummary}
 * inputs     : JSON-serialised {@code EstimatorInputs}
 * outputs    : JSON-serialised {@code ObservationOutputs}
 * dataQuality: JSON-serialised {@code DataQuality}
 */
@Data
@NoArgsConstructor
@Table("market_observations")
public class MarketObservationEntity {

    @Id
    private Long id;

    private String marketplace;

    private String keyword;

    private String normalizedKeyword;

    private int page;

    private String snapshotId;

    private String summary;

    private String inputs;

    private String outputs;

    private String dataQuality;

    private LocalDateTime createdAt;
}
