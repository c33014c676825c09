package com.marketengine.common.config;

/** COGS as a percent-of-price band, both bounds in [0, 100]. */
public record CogsBand(double lowPct, double highPct) {}
