package com.flagship.cashback_ledger.common;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Small in-process cache with an explicit entry cap and time-to-live.
 *
 * Thin wrapper over Caffeine so that callers state capacity and expiry at
 * construction instead of trimming maps by hand.
 */
public class BoundedCache<K, V> {

    private final Cache<K, V> cache;
    private final long capacity;
    private final Duration ttl;

    public BoundedCache(long capacity, Duration ttl) {
        this(capacity, ttl, Ticker.systemTicker());
    }

    BoundedCache(long capacity, Duration ttl, Ticker ticker) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        this.capacity = capacity;
        this.ttl = ttl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(capacity)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    /**
     * Returns the cached value, computing and caching it when absent.
     * A loader returning null caches nothing.
     */
    public V get(K key, Function<? super K, ? extends V> loader) {
        return cache.get(key, loader);
    }

    public void put(K key, V value) {
        cache.put(key, value);
    }

    public void invalidate(K key) {
        cache.invalidate(key);
    }

    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public long capacity() {
        return capacity;
    }

    public Duration ttl() {
        return ttl;
    }
}
