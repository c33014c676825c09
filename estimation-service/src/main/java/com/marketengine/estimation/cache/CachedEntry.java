package com.marketengine.estimation.cache;

import java.time.Instant;

/** Cache entry with the instant it was stored and the instant it stops being served. */
public record CachedEntry<V>(
    V value,
    Instant storedAt,
    Instant expiresAt
) {}
