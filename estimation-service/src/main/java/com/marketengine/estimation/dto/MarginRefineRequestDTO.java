package com.marketengine.estimation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketengine.common.model.CostOverrides;
import com.marketengine.common.model.FeeQuote;
import com.marketengine.common.model.MarginSnapshot;

/**
 * @param previous  snapshot being refined; its embedded request is rebuilt
 * @param overrides new user figures, merged field-wise over the previous ones
 * @param feeQuote  optional new fee quote
 */
public record MarginRefineRequestDTO(
    @JsonProperty("previous")  MarginSnapshot previous,
    @JsonProperty("overrides") CostOverrides overrides,
    @JsonProperty("feeQuote")  FeeQuote feeQuote
) {}
