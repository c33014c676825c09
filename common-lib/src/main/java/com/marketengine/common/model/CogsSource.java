package com.marketengine.common.model;

public enum CogsSource {
    ASSUMPTION_ENGINE,
    USER_OVERRIDE
}
