package com.meshgate.gateway.balancer;

import com.meshgate.gateway.registry.Endpoint;
import com.meshgate.gateway.registry.Service;

/**
 * Endpoint selection for the request router (Dependency Inversion Principle).
 */
public interface ILoadBalancer {

    /**
     * Picks a routable endpoint with the service's strategy.
     *
     * @return the endpoint, or null when no endpoint is routable
     */
    Endpoint select(Service service);

    /**
     * Picks uniformly among all endpoints regardless of health.
     *
     * @return the endpoint, or null when the service has none
     */
    Endpoint selectAny(Service service);

    void forget(String serviceName);
}
