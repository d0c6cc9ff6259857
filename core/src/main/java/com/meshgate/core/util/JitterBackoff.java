package com.meshgate.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff calculator for retries.
 * <p>
 * <b>Formula:</b> {@code t = min(cap, base * 2^attempt) + uniform(0, jitterMax)}
 * <ul>
 *   <li>{@code base}: Initial delay</li>
 *   <li>{@code cap}: Maximum delay before jitter; {@code null} means unbounded</li>
 *   <li>{@code jitterMax}: Maximum jitter to add</li>
 * </ul>
 * </p>
 * <p>
 * <b>Jitter rationale:</b> Prevents synchronized retry storms when many requests fail together.
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the next backoff delay with jitter.
     *
     * @param attempt   Retry attempt number
     * @param base      Base delay
     * @param cap       Maximum delay before jitter, or null for no cap
     * @param jitterMax Maximum jitter to add (exclusive)
     * @return Computed delay
     */
    public static Duration next(int attempt, Duration base, Duration cap, Duration jitterMax) {
        // Exponential component: base * 2^attempt
        long baseMs = base.toMillis();
        long expMs = baseMs * (1L << Math.min(Math.max(attempt, 0), 20)); // Cap exponent to avoid overflow

        long cappedMs = cap == null ? expMs : Math.min(expMs, cap.toMillis());

        long jitterBound = jitterMax == null ? 0 : jitterMax.toMillis();
        long jitterMs = jitterBound > 0 ? ThreadLocalRandom.current().nextLong(jitterBound) : 0;

        return Duration.ofMillis(cappedMs + jitterMs);
    }

    /**
     * Convenience method with the gateway defaults (base=100ms, cap=5s, jitter=100ms).
     *
     * @param attempt Retry attempt number
     * @return Computed delay
     */
    public static Duration next(int attempt) {
        return next(
                attempt,
                Duration.ofMillis(100),  // base
                Duration.ofSeconds(5),   // cap
                Duration.ofMillis(100)   // jitterMax
        );
    }
}
