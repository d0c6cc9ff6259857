package com.meshgate.gateway.balancer;

import com.meshgate.gateway.registry.Endpoint;

import java.util.List;

/**
 * Fewest active connections; ties go to the earliest candidate.
 */
public class LeastConnectionsSelector implements IEndpointSelector {

    @Override
    public Endpoint select(String serviceName, List<Endpoint> candidates) {
        Endpoint best = candidates.get(0);
        for (Endpoint candidate : candidates) {
            if (candidate.getActiveConnections() < best.getActiveConnections()) {
                best = candidate;
            }
        }
        return best;
    }
}
