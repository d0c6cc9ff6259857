package com.meshgate.gateway.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Key/value store for cached backend responses.
 */
public interface IResponseCache {

    /**
     * @return the cached value, or empty on a miss
     */
    Mono<String> get(String key);

    Mono<Void> set(String key, String value, Duration ttl);

    Mono<Void> delete(String key);

    void close();
}
