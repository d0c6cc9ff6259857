package com.meshgate.gateway.cache;

import com.meshgate.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class InMemoryResponseCacheTest {

    private MutableClock clock;
    private InMemoryResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = new InMemoryResponseCache(100, clock);
    }

    @Test
    void testEntryExpiresAfterTtl() {
        StepVerifier.create(cache.set("k", "v", Duration.ofSeconds(30))).verifyComplete();

        clock.advance(Duration.ofSeconds(29));
        StepVerifier.create(cache.get("k")).expectNext("v").verifyComplete();

        clock.advance(Duration.ofSeconds(1));
        StepVerifier.create(cache.get("k")).verifyComplete();
        assertEquals(0, cache.size());
    }

    @Test
    void testDeleteAndMiss() {
        StepVerifier.create(cache.get("missing")).verifyComplete();

        StepVerifier.create(cache.set("k", "v", Duration.ofMinutes(1))
                .then(cache.delete("k"))
                .then(cache.get("k")))
            .verifyComplete();
    }

    @Test
    void testNonPositiveTtlIsNotStored() {
        StepVerifier.create(cache.set("k", "v", Duration.ZERO)).verifyComplete();
        StepVerifier.create(cache.set("j", "v", Duration.ofSeconds(-1))).verifyComplete();

        StepVerifier.create(cache.get("k")).verifyComplete();
        assertEquals(0, cache.size());
    }

    @Test
    void testSizeBound() {
        for (int i = 0; i < 500; i++) {
            cache.set("k" + i, "v", Duration.ofMinutes(1)).block();
        }
        assertEquals(true, cache.size() <= 100);
    }
}
