package com.marketengine.estimation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketengine.common.model.EstimatorModel;

import java.util.List;

/**
 * Outcome of one retraining pass.
 *
 * @param activated model versions trained and activated in this pass; empty when every type was skipped
 */
public record RetrainResultDTO(
    @JsonProperty("marketplace") String marketplace,
    @JsonProperty("activated")   List<EstimatorModel> activated
) {}
