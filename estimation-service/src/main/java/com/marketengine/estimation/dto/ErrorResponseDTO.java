package com.marketengine.estimation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponseDTO(
    @JsonProperty("error")   String error,
    @JsonProperty("message") String message
) {}
