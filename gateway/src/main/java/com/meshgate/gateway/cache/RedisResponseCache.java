package com.meshgate.gateway.cache;

import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Response cache shared by all gateway instances, backed by Redis.
 * <p>
 * All operations are non-blocking using Lettuce reactive API. Entries expire with millisecond precision;
 * a zero or negative TTL stores nothing.
 * </p>
 */
public class RedisResponseCache implements IResponseCache {
    private static final Logger log = LoggerFactory.getLogger(RedisResponseCache.class);

    private final RedisReactiveCommands<String, String> commands;
    private final Runnable shutdown;

    public RedisResponseCache(String redisUrl) {
        this(RedisClient.create(redisUrl));
        log.info("Connected to Redis: {}", redisUrl);
    }

    private RedisResponseCache(RedisClient client) {
        this(client, client.connect());
    }

    private RedisResponseCache(RedisClient client, StatefulRedisConnection<String, String> connection) {
        this(connection.reactive(), () -> {
            connection.close();
            client.shutdown();
        });
    }

    RedisResponseCache(RedisReactiveCommands<String, String> commands, Runnable shutdown) {
        this.commands = commands;
        this.shutdown = shutdown;
    }

    @Override
    public Mono<String> get(String key) {
        return commands.get(key);
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return Mono.empty();
        }
        return commands.psetex(key, ttl.toMillis(), value).then();
    }

    @Override
    public Mono<Void> delete(String key) {
        return commands.del(key).then();
    }

    @Override
    public void close() {
        shutdown.run();
        log.info("Redis connection closed");
    }
}
