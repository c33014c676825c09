package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Everything a margin snapshot is built from. Kept on the snapshot so that a
 * refinement can rebuild every derived field from the same inputs.
 *
 * @param asinPrice      single-listing price, read only in ASIN mode
 * @param marketAvgPrice page-one average price, read only in KEYWORD mode
 * @param feeQuote       optional fee figure; see {@link FeeQuote#exact()}
 */
public record MarginRequest(
    @JsonProperty("mode") MarginMode mode,
    @JsonProperty("sourcingModel") SourcingModel sourcingModel,
    @JsonProperty("category") String category,
    @JsonProperty("asinPrice") Double asinPrice,
    @JsonProperty("marketAvgPrice") Double marketAvgPrice,
    @JsonProperty("feeQuote") FeeQuote feeQuote,
    @JsonProperty("overrides") CostOverrides overrides
) {
    public MarginRequest {
        if (sourcingModel == null) {
            sourcingModel = SourcingModel.UNKNOWN;
        }
        if (overrides == null) {
            overrides = CostOverrides.none();
        }
    }

    public MarginRequest withOverrides(CostOverrides newOverrides) {
        return new MarginRequest(mode, sourcingModel, category, asinPrice, marketAvgPrice, feeQuote, newOverrides);
    }

    public MarginRequest withFeeQuote(FeeQuote newQuote) {
        return new MarginRequest(mode, sourcingModel, category, asinPrice, marketAvgPrice, newQuote, overrides);
    }
}
