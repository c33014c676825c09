package com.marketengine.estimation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/v1/analyze/keyword}.
 *
 * @param marketplace defaults to {@code US} when absent
 * @param category    optional category hint for multipliers and the rank curve
 * @param page        results page, defaults to 1
 */
public record AnalyzeRequestDTO(
    @JsonProperty("keyword")     String keyword,
    @JsonProperty("marketplace") String marketplace,
    @JsonProperty("category")    String category,
    @JsonProperty("page")        Integer page
) {}
