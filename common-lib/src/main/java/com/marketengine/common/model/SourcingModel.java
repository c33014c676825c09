package com.marketengine.common.model;

import java.util.Locale;

/** How the seller sources inventory; drives the COGS percent-of-price band. */
public enum SourcingModel {
    PRIVATE_LABEL,
    WHOLESALE_ARBITRAGE,
    RETAIL_ARBITRAGE,
    DROPSHIPPING,
    UNKNOWN;

    /** Lenient parse: accepts enum names, snake/kebab case and "not_sure"; anything else is UNKNOWN. */
    public static SourcingModel fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if ("NOT_SURE".equals(normalized)) {
            return UNKNOWN;
        }
        for (SourcingModel model : values()) {
            if (model.name().equals(normalized)) {
                return model;
            }
        }
        return UNKNOWN;
    }
}
