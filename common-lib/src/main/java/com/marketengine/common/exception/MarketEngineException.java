package com.marketengine.common.exception;

public class MarketEngineException extends RuntimeException {
    private final String component;

    public MarketEngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public MarketEngineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
