package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-supplied cost figures. Null fields are "not supplied".
 */
public record CostOverrides(
    @JsonProperty("cogs") Double cogs,
    @JsonProperty("price") Double price,
    @JsonProperty("fbaFee") Double fbaFee
) {
    public static CostOverrides none() {
        return new CostOverrides(null, null, null);
    }

    public static CostOverrides cogs(double cogs) {
        return new CostOverrides(cogs, null, null);
    }

    /** Field-wise merge; values present in {@code newer} win. */
    public CostOverrides mergedWith(CostOverrides newer) {
        if (newer == null) {
            return this;
        }
        return new CostOverrides(
            newer.cogs != null ? newer.cogs : cogs,
            newer.price != null ? newer.price : price,
            newer.fbaFee != null ? newer.fbaFee : fbaFee);
    }

    public boolean isEmpty() {
        return cogs == null && price == null && fbaFee == null;
    }
}
