package com.marketengine.common.model;

public enum CompetitionLevel {
    LOW,
    MEDIUM,
    HIGH
}
