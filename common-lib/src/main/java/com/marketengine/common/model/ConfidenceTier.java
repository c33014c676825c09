package com.marketengine.common.model;

/**
 * Provenance of a margin snapshot's cost inputs: ESTIMATED &lt; REFINED &lt; EXACT.
 */
public enum ConfidenceTier {
    ESTIMATED,
    REFINED,
    EXACT;

    public boolean isAtLeast(ConfidenceTier other) {
        return ordinal() >= other.ordinal();
    }

    public ConfidenceTier downgrade() {
        return this == ESTIMATED ? ESTIMATED : values()[ordinal() - 1];
    }
}
