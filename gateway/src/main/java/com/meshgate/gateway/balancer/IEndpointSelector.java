package com.meshgate.gateway.balancer;

import com.meshgate.gateway.registry.Endpoint;

import java.util.List;

/**
 * One load-balancing strategy.
 */
public interface IEndpointSelector {

    /**
     * @param serviceName owner of the candidates, for strategies that keep per-service state
     * @param candidates  non-empty list of routable endpoints
     * @return the chosen endpoint
     */
    Endpoint select(String serviceName, List<Endpoint> candidates);

    /**
     * Drops per-service state.
     */
    default void forget(String serviceName) {
    }
}
