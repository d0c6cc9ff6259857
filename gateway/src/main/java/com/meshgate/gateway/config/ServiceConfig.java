package com.meshgate.gateway.config;

import com.meshgate.core.model.LoadBalancingStrategy;
import com.meshgate.gateway.health.HealthProbe;
import com.meshgate.gateway.router.RequestMiddleware;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Registration data of a service, with the gateway defaults.
 */
@Value
@Builder(toBuilder = true)
public class ServiceConfig {
    String name;

    @Singular
    List<EndpointConfig> endpoints;

    /**
     * Per-attempt dispatch timeout.
     */
    @Builder.Default
    Duration timeout = Duration.ofSeconds(5);

    /**
     * Attempts per routed call are {@code max(1, maxRetries)}.
     */
    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    LoadBalancingStrategy strategy = LoadBalancingStrategy.ROUND_ROBIN;

    @Builder.Default
    Duration cacheTtl = Duration.ofSeconds(300);

    @Singular("middleware")
    List<RequestMiddleware> middleware;

    /**
     * Path prefixes routed to this service. Empty means the endpoints' paths.
     */
    @Singular
    List<String> routes;

    @Singular
    Set<String> tags;

    @Builder.Default
    String version = "1.0.0";

    HealthProbe healthProbe;

    @Builder.Default
    CircuitBreakerConfig circuitBreaker = CircuitBreakerConfig.defaults();

    // Retry backoff: min(cap, base * 2^attempt) + uniform(0, jitter)
    @Builder.Default
    Duration backoffBase = Duration.ofMillis(100);
    @Builder.Default
    Duration backoffCap = Duration.ofSeconds(5);
    @Builder.Default
    Duration backoffJitter = Duration.ofMillis(100);
}
