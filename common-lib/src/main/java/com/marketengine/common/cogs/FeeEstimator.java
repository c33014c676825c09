package com.marketengine.common.cogs;

import java.util.List;
import java.util.Locale;

/**
 * Size-class fulfillment fee estimate from a category hint, used when no fee
 * quote is available.
 */
public final class FeeEstimator {

    private static final List<String> SMALL_HINTS =
        List.of("small", "lightweight", "accessory", "jewelry", "phone case");
    private static final List<String> OVERSIZED_HINTS =
        List.of("oversized", "large", "furniture", "appliance", "mattress");

    static final FeeEstimate SMALL = new FeeEstimate(6, 9, "small/lightweight");
    static final FeeEstimate OVERSIZED = new FeeEstimate(12, 18, "oversized");
    static final FeeEstimate STANDARD = new FeeEstimate(8, 12, "standard size");

    private FeeEstimator() {}

    public static FeeEstimate estimate(String categoryHint) {
        if (categoryHint == null || categoryHint.isBlank()) {
            return STANDARD;
        }
        String normalized = categoryHint.trim().toLowerCase(Locale.ROOT);
        if (SMALL_HINTS.stream().anyMatch(normalized::contains)) {
            return SMALL;
        }
        if (OVERSIZED_HINTS.stream().anyMatch(normalized::contains)) {
            return OVERSIZED;
        }
        return STANDARD;
    }
}
