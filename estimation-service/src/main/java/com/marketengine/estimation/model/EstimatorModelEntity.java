package com.marketengine.estimation.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One immutable trained model version. Rows are inserted, never updated; the
 * active version per (marketplace, model_type) lives in
 * {@code active_estimator_models}.
 *
 * coefficients       : JSON-serialised {@code ModelCoefficients}
 * trainingDiagnostics: JSON-serialised {@code TrainingDiagnostics}
 */
@Data
@NoArgsConstructor
@Table("estimator_models")
public class EstimatorModelEntity {

    @Id
    private Long id;

    private String marketplace;

    /** Wire key of the model type, e.g. {@code revenue_estimate}. */
    private String modelType;

    private String modelVersion;

    private String coefficients;

    private LocalDateTime trainedAt;

    private int trainingRows;

    private String trainingDiagnostics;

    private LocalDateTime createdAt;
}
