package com.meshgate.core.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JitterBackoffTest {

    @Test
    void testExponentialGrowthWithoutJitter() {
        Duration base = Duration.ofMillis(100);

        assertEquals(100, JitterBackoff.next(0, base, null, Duration.ZERO).toMillis());
        assertEquals(200, JitterBackoff.next(1, base, null, Duration.ZERO).toMillis());
        assertEquals(400, JitterBackoff.next(2, base, null, Duration.ZERO).toMillis());
        assertEquals(800, JitterBackoff.next(3, base, null, Duration.ZERO).toMillis());
    }

    @Test
    void testCapLimitsExponentialComponent() {
        Duration delay = JitterBackoff.next(10, Duration.ofMillis(100), Duration.ofSeconds(5), Duration.ZERO);

        assertEquals(5000, delay.toMillis());
    }

    @Test
    void testUncappedLargeAttemptDoesNotOverflow() {
        Duration delay = JitterBackoff.next(200, Duration.ofMillis(1), null, Duration.ZERO);

        assertEquals(1L << 20, delay.toMillis());
    }

    @Test
    void testJitterStaysWithinBound() {
        for (int i = 0; i < 1000; i++) {
            long ms = JitterBackoff.next(1, Duration.ofMillis(100), Duration.ofSeconds(5), Duration.ofMillis(100)).toMillis();
            assertTrue(ms >= 200 && ms < 300, "Delay out of range: " + ms);
        }
    }

    @Test
    void testDefaults() {
        long ms = JitterBackoff.next(1).toMillis();
        assertTrue(ms >= 200 && ms < 300, "Delay out of range: " + ms);
    }
}
