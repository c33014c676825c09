package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DataQuality(
    @JsonProperty("hasListings") boolean hasListings,
    @JsonProperty("listingsCount") int listingsCount,
    @JsonProperty("invalidAsinCount") int invalidAsinCount,
    @JsonProperty("missingFields") List<String> missingFields,
    @JsonProperty("fallbackUsed") boolean fallbackUsed
) {}
