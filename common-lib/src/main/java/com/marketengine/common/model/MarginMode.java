package com.marketengine.common.model;

/**
 * Which price signal a margin snapshot is bound to. ASIN snapshots read only the
 * single-listing price, KEYWORD snapshots only the page-one average.
 */
public enum MarginMode {
    ASIN,
    KEYWORD
}
