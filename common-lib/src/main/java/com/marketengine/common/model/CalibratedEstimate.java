package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Range output of the self-calibrating estimator.
 *
 * @param source       {@code heuristic_v1} when no trained model was active, {@code model_v2} otherwise
 * @param confidence   driven only by the active model's training row count
 * @param modelVersion version of the active model, or the heuristic's version tag
 */
public record CalibratedEstimate(
    @JsonProperty("modelType") ModelType modelType,
    @JsonProperty("low") long low,
    @JsonProperty("center") long center,
    @JsonProperty("high") long high,
    @JsonProperty("baseline") long baseline,
    @JsonProperty("source") String source,
    @JsonProperty("confidence") ConfidenceLevel confidence,
    @JsonProperty("modelVersion") String modelVersion
) {}
