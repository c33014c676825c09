package com.marketengine.common.model;

public enum PriceSource {
    ASIN_PRICE,
    PAGE1_AVG,
    USER_OVERRIDE,
    FALLBACK
}
