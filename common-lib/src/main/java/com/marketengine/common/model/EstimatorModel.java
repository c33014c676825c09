package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One immutable, versioned calibration model. Which version is active for a
 * (marketplace, model type) pair is tracked outside this record.
 *
 * @param id           storage id; null until persisted
 * @param modelVersion derived from the training timestamp, e.g. {@code v2.0.20261019.031500}
 */
public record EstimatorModel(
    @JsonProperty("id") Long id,
    @JsonProperty("marketplace") String marketplace,
    @JsonProperty("modelType") ModelType modelType,
    @JsonProperty("modelVersion") String modelVersion,
    @JsonProperty("coefficients") ModelCoefficients coefficients,
    @JsonProperty("trainedAt") Instant trainedAt,
    @JsonProperty("trainingRowCount") int trainingRowCount,
    @JsonProperty("diagnostics") TrainingDiagnostics diagnostics
) {
    public EstimatorModel withId(Long newId) {
        return new EstimatorModel(newId, marketplace, modelType, modelVersion, coefficients,
            trainedAt, trainingRowCount, diagnostics);
    }
}
