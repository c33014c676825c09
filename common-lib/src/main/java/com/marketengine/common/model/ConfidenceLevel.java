package com.marketengine.common.model;

public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH
}
