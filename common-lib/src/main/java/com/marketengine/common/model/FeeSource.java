package com.marketengine.common.model;

public enum FeeSource {
    /** Live fee quote from the marketplace fee service. */
    EXACT_QUOTE,
    USER_PROVIDED,
    CATEGORY_ESTIMATE
}
