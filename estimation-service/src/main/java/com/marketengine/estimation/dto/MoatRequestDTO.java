package com.marketengine.estimation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketengine.common.model.PageOneListing;

import java.util.List;

public record MoatRequestDTO(
    @JsonProperty("listings") List<PageOneListing> listings
) {}
