package com.meshgate.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of one endpoint, as reported by the health API.
 */
@Value
@Builder
public class EndpointSnapshot {
    String id;
    String path;
    String target;
    int weight;
    EndpointStatus status;
    boolean healthy;
    int failures;

    /**
     * Epoch millis of the last probe or live outcome.
     */
    long lastCheck;

    int activeConnections;
}
