package com.marketengine.common.model;

/**
 * Degree to which a single brand structurally dominates page one.
 * Ordered from weakest to strongest.
 */
public enum MoatLevel {
    NONE,
    SOFT,
    HARD
}
