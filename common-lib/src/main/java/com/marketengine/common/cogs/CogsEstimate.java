package com.marketengine.common.cogs;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketengine.common.model.ConfidenceLevel;

/**
 * COGS range in currency for one selling price.
 *
 * @param bandKey   the COGS band that produced the percentages
 * @param rationale human-readable explanation of the band choice
 */
public record CogsEstimate(
    @JsonProperty("low") double low,
    @JsonProperty("high") double high,
    @JsonProperty("lowPct") double lowPct,
    @JsonProperty("highPct") double highPct,
    @JsonProperty("confidence") ConfidenceLevel confidence,
    @JsonProperty("bandKey") String bandKey,
    @JsonProperty("rationale") String rationale
) {}
