package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** An ASIN the marketplace surfaced more than once in one page-one scan. */
public record AlgorithmBoost(
    @JsonProperty("asin") String asin,
    @JsonProperty("appearances") int appearances
) {}
