package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BrandShare(
    @JsonProperty("brand") String brand,
    @JsonProperty("revenue") long revenue,
    @JsonProperty("revenueSharePct") double revenueSharePct
) {}
