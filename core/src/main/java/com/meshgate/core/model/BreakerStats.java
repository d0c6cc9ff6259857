package com.meshgate.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Circuit breaker state with its rolling-window counters.
 */
@Value
@Builder
public class BreakerStats {
    CircuitState state;
    long successful;
    long failed;
    long rejected;
    long timeout;

    public static BreakerStats closed() {
        return BreakerStats.builder().state(CircuitState.CLOSED).build();
    }
}
