package com.marketengine.estimation.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Category rank and category name for one ASIN, as returned by the enrichment service. */
public record RankEnrichment(
    @JsonProperty("asin") String asin,
    @JsonProperty("rankInCategory") Integer rankInCategory,
    @JsonProperty("category") String category
) {}
