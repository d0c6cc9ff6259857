package com.meshgate.gateway.cache;

import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RedisResponseCacheTest {

    private final List<String> calls = new CopyOnWriteArrayList<>();
    private boolean closed;
    private RedisResponseCache cache;

    @BeforeEach
    void setUp() {
        cache = new RedisResponseCache(recordingCommands(), () -> closed = true);
    }

    @Test
    void testSetUsesMillisecondTtl() {
        StepVerifier.create(cache.set("k", "v", Duration.ofMillis(1500))).verifyComplete();

        assertEquals(List.of("psetex [k, 1500, v]"), calls);
    }

    @Test
    void testNonPositiveTtlSkipsTheWrite() {
        StepVerifier.create(cache.set("k", "v", Duration.ZERO)).verifyComplete();
        StepVerifier.create(cache.set("k", "v", Duration.ofSeconds(-5))).verifyComplete();

        assertTrue(calls.isEmpty());
    }

    @Test
    void testCloseShutsDownTheConnection() {
        cache.close();

        assertTrue(closed);
    }

    @SuppressWarnings("unchecked")
    private RedisReactiveCommands<String, String> recordingCommands() {
        return (RedisReactiveCommands<String, String>) Proxy.newProxyInstance(
            getClass().getClassLoader(),
            new Class<?>[]{RedisReactiveCommands.class},
            (proxy, method, args) -> {
                calls.add(method.getName() + " " + Arrays.toString(args));
                return Mono.just("OK");
            });
    }
}
