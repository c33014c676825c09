package com.marketengine.common.cogs;

import java.util.List;
import java.util.Locale;

/**
 * Coarse product family inferred from free-text category names.
 *
 * <p>Inference is a case-insensitive substring match against each family's
 * keyword list, checked in declaration order; the first match wins and no
 * match yields {@link #DEFAULT}.
 */
public enum ProductCategory {
    ELECTRONICS("electronics", List.of("electronic", "tech", "computer", "phone", "tablet", "audio", "camera")),
    HOME_GOODS("home_goods", List.of("home", "kitchen", "household", "cookware", "appliance", "decor")),
    BEAUTY("beauty", List.of("beauty", "cosmetic", "skincare", "skin care", "makeup", "hair", "fragrance", "personal care")),
    HEALTH("health", List.of("health", "vitamin", "supplement", "wellness", "medical")),
    DEFAULT("default", List.of());

    private final String key;
    private final List<String> keywords;

    ProductCategory(String key, List<String> keywords) {
        this.key = key;
        this.keywords = keywords;
    }

    public String key() {
        return key;
    }

    public static ProductCategory infer(String category) {
        if (category == null || category.isBlank()) {
            return DEFAULT;
        }
        String normalized = category.trim().toLowerCase(Locale.ROOT);
        for (ProductCategory candidate : values()) {
            for (String keyword : candidate.keywords) {
                if (normalized.contains(keyword)) {
                    return candidate;
                }
            }
        }
        return DEFAULT;
    }
}
