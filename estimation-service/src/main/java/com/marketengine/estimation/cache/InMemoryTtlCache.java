package com.marketengine.estimation.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-local {@link TtlCache}.
 *
 * <p>Expired entries are evicted on read, and swept from the whole map on
 * {@code put} once per {@link #SWEEP_PERIOD} or whenever the map reaches
 * {@code maxEntries}. A full map with nothing expired drops the entry closest
 * to expiry. {@link #dedupe} keeps one
 * shared, replaying {@link Mono} per key until it terminates, so concurrent
 * lookups for the same key collapse into a single upstream subscription.
 */
public class InMemoryTtlCache<V> implements TtlCache<V> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTtlCache.class);

    static final int DEFAULT_MAX_ENTRIES = 50_000;
    static final Duration SWEEP_PERIOD = Duration.ofHours(1);

    private final String name;
    private final Clock clock;
    private final int maxEntries;
    private volatile Instant lastSweep;
    private final ConcurrentHashMap<String, CachedEntry<V>> store = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Mono<V>> inFlight = new ConcurrentHashMap<>();

    public InMemoryTtlCache(String name) {
        this(name, Clock.systemUTC(), DEFAULT_MAX_ENTRIES);
    }

    public InMemoryTtlCache(String name, Clock clock) {
        this(name, clock, DEFAULT_MAX_ENTRIES);
    }

    public InMemoryTtlCache(String name, Clock clock, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        this.name = name;
        this.clock = clock;
        this.maxEntries = maxEntries;
        this.lastSweep = clock.instant();
    }

    @Override
    public V get(String key) {
        CachedEntry<V> entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            store.remove(key, entry);
            log.debug("CACHE_EXPIRED cache={} key={}", name, key);
            return null;
        }
        return entry.value();
    }

    @Override
    public void put(String key, V value, Duration ttl) {
        if (value == null) {
            return;
        }
        Instant now = clock.instant();
        if (store.size() >= maxEntries || !now.isBefore(lastSweep.plus(SWEEP_PERIOD))) {
            sweep(now);
        }
        if (store.size() >= maxEntries && !store.containsKey(key)) {
            evictSoonestExpiring();
        }
        store.put(key, new CachedEntry<>(value, now, now.plus(ttl)));
        log.debug("CACHE_REFRESH cache={} key={} ttlSeconds={}", name, key, ttl.toSeconds());
    }

    @Override
    public Mono<V> dedupe(String key, Supplier<Mono<V>> factory) {
        return inFlight.computeIfAbsent(key, k -> factory.get()
            .doFinally(signal -> inFlight.remove(k))
            .cache());
    }

    private void sweep(Instant now) {
        int before = store.size();
        store.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
        lastSweep = now;
        int removed = before - store.size();
        if (removed > 0) {
            log.info("CACHE_SWEEP cache={} removed={} remaining={}", name, removed, store.size());
        }
    }

    private void evictSoonestExpiring() {
        store.entrySet().stream()
            .min(Comparator.comparing((Map.Entry<String, CachedEntry<V>> e) -> e.getValue().expiresAt()))
            .ifPresent(e -> {
                store.remove(e.getKey(), e.getValue());
                log.debug("CACHE_EVICTED cache={} key={} reason=capacity", name, e.getKey());
            });
    }

    int size() {
        return store.size();
    }
}
