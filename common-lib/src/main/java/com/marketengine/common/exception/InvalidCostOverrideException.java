package com.marketengine.common.exception;

/**
 * A user-supplied cost override that cannot be applied, e.g. COGS at or above the
 * selling price. The message is the reason shown to the user.
 */
public class InvalidCostOverrideException extends MarketEngineException {

    private final String reason;

    public InvalidCostOverrideException(String reason) {
        super("MarginSnapshotBuilder", reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
