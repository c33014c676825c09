package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TrainingDiagnostics(
    @JsonProperty("rSquared") double rSquared,
    @JsonProperty("meanAbsoluteError") double meanAbsoluteError
) {}
