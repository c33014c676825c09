package com.marketengine.estimation.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Keyed cache with per-entry lifetime and in-flight request collapsing.
 *
 * @param <V> cached value type
 */
public interface TtlCache<V> {

    /** @return the live value, or {@code null} when absent or expired */
    V get(String key);

    void put(String key, V value, Duration ttl);

    /**
     * Runs {@code factory} at most once per key while a previous call for the
     * same key is still in flight; concurrent callers share its result.
     */
    Mono<V> dedupe(String key, Supplier<Mono<V>> factory);
}
