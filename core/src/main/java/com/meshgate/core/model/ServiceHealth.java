package com.meshgate.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Health view of a registered service.
 */
@Value
@Builder
public class ServiceHealth {
    String name;
    boolean active;

    /**
     * Share of routable endpoints, 0..100; 0 when the service has no endpoints.
     */
    double healthPercentage;

    BreakerStats circuitBreaker;
    List<EndpointSnapshot> endpoints;
}
