package com.meshgate.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Metrics view of a registered service.
 */
@Value
@Builder
public class ServiceMetrics {
    String name;
    long success;
    long failure;
    long timeout;
    long rejected;
    CircuitState circuitState;
    int healthyEndpoints;
    int totalEndpoints;
    MetricsSample latency;
}
