package com.meshgate.gateway.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-service circuit breaker tuning.
 */
@Value
@Builder(toBuilder = true)
public class CircuitBreakerConfig {

    /**
     * Overall budget of one routed call, retries and backoff included.
     */
    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);

    @Builder.Default
    int errorThresholdPercentage = 50;

    /**
     * Time spent OPEN before a probe call is admitted.
     */
    @Builder.Default
    Duration resetTimeout = Duration.ofSeconds(30);

    /**
     * Minimum outcomes in the rolling window before the error percentage is considered.
     */
    @Builder.Default
    int volumeThreshold = 10;

    /**
     * Consecutive call timeouts that trip the breaker regardless of volume.
     */
    @Builder.Default
    int timeoutThreshold = 3;

    @Builder.Default
    Duration rollingWindow = Duration.ofSeconds(10);

    @Builder.Default
    int rollingBuckets = 10;

    public static CircuitBreakerConfig defaults() {
        return CircuitBreakerConfig.builder().build();
    }
}
