package com.meshgate.gateway.health;

import com.meshgate.gateway.registry.Endpoint;
import reactor.core.publisher.Mono;

/**
 * Active health check of one endpoint.
 * <p>
 * {@code false} means the endpoint answered unhealthy; an error signal means the probe itself failed.
 * </p>
 */
@FunctionalInterface
public interface HealthProbe {
    Mono<Boolean> probe(Endpoint endpoint);
}
