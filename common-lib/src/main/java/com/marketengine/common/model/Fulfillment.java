package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * How a listing is fulfilled.
 *
 * <p>{@link #UNKNOWN} is a first-class value: it is what every listing gets when
 * no explicit fulfillment or seller field says otherwise. A Prime badge alone is
 * never mapped to {@link #FBA}.
 */
public enum Fulfillment {
    FBA,
    FBM,
    AMAZON,
    UNKNOWN;

    /**
     * Maps an explicit fulfillment field from the listing source. Also the JSON
     * creator, so listing payloads accept any case and the seller-side aliases.
     *
     * @param raw e.g. "FBA", "fbm", "Amazon", "merchant"; may be null
     * @return the matching value, {@link #UNKNOWN} when absent or unrecognised
     */
    @JsonCreator
    public static Fulfillment fromExplicit(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "FBA":
            case "FULFILLED_BY_AMAZON":
                return FBA;
            case "FBM":
            case "MERCHANT":
            case "FULFILLED_BY_MERCHANT":
                return FBM;
            case "AMAZON":
            case "AMAZON_RETAIL":
                return AMAZON;
            default:
                return UNKNOWN;
        }
    }
}
