package com.yuzhi.sqlguard.platform.service.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Small TTL cache shared by the RLS registries. Loads happen on the calling thread inside
 * {@link ConcurrentHashMap#compute}, so two callers never load the same key at once and a reader never sees a
 * half-built value. A loader that throws leaves the key absent. A zero or negative TTL disables caching.
 */
public final class ExpiringCache<K, V> {

    private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public ExpiringCache(Duration ttl, Clock clock) {
        this.ttl = ttl == null ? Duration.ZERO : ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public V get(K key, Function<? super K, ? extends V> loader) {
        Entry<V> entry = entries.get(key);
        if (entry != null && isFresh(entry)) {
            return entry.value();
        }
        Entry<V> loaded = entries.compute(key, (k, current) -> {
            if (current != null && isFresh(current)) {
                return current;
            }
            V value = loader.apply(k);
            return new Entry<>(Objects.requireNonNull(value, "cache loader returned null"), clock.instant());
        });
        V value = loaded.value();
        if (!cachingEnabled()) {
            entries.remove(key, loaded);
        }
        return value;
    }

    /** Stores a value directly, replacing whatever was cached for the key. */
    public void put(K key, V value) {
        if (cachingEnabled()) {
            entries.put(key, new Entry<>(Objects.requireNonNull(value, "value"), clock.instant()));
        }
    }

    public void invalidate(K key) {
        entries.remove(key);
    }

    public void invalidateAll() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public Duration ttl() {
        return ttl;
    }

    private boolean cachingEnabled() {
        return !ttl.isZero() && !ttl.isNegative();
    }

    private boolean isFresh(Entry<V> entry) {
        return cachingEnabled() && Duration.between(entry.loadedAt(), clock.instant()).compareTo(ttl) < 0;
    }

    private record Entry<V>(V value, Instant loadedAt) {}
}
