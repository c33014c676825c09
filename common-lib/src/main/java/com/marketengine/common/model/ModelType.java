package com.marketengine.common.model;

import java.util.Locale;

/**
 * Estimate families that carry their own calibration model. The wire value is
 * the key stored alongside every persisted model version.
 */
public enum ModelType {
    SEARCH_VOLUME("search_volume"),
    REVENUE("revenue_estimate");

    private final String key;

    ModelType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static ModelType fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("model type key is required");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (ModelType type : values()) {
            if (type.key.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown model type: " + key);
    }
}
