package com.meshgate.gateway.cache;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Single-process response cache.
 * <p>
 * Guava bounds the size and evicts least-recently-used entries; the per-entry TTL is checked on read.
 * A zero or negative TTL stores nothing.
 * </p>
 */
public class InMemoryResponseCache implements IResponseCache {
    private final Cache<String, Entry> cache;
    private final Clock clock;

    public InMemoryResponseCache(long maximumSize, Clock clock) {
        this.cache = CacheBuilder.newBuilder()
            .maximumSize(maximumSize)
            .build();
        this.clock = clock;
    }

    public InMemoryResponseCache() {
        this(10_000, Clock.systemUTC());
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> {
            Entry entry = cache.getIfPresent(key);
            if (entry == null) {
                return null;
            }
            if (clock.millis() >= entry.expiresAt()) {
                cache.invalidate(key);
                return null;
            }
            return entry.value();
        });
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return Mono.empty();
        }
        return Mono.fromRunnable(() -> cache.put(key, new Entry(value, clock.millis() + ttl.toMillis())));
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> cache.invalidate(key));
    }

    public long size() {
        return cache.size();
    }

    @Override
    public void close() {
        cache.invalidateAll();
    }

    private record Entry(String value, long expiresAt) {
    }
}
