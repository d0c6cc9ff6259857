package com.meshgate.gateway.balancer;

import com.meshgate.gateway.registry.Endpoint;

import java.util.List;
import java.util.Random;

/**
 * Weight-proportional random choice. Endpoints with weight 0 are never chosen, unless no candidate has a
 * positive weight, in which case the first candidate is returned.
 */
public class WeightedSelector implements IEndpointSelector {
    private final Random random;

    public WeightedSelector(Random random) {
        this.random = random;
    }

    @Override
    public Endpoint select(String serviceName, List<Endpoint> candidates) {
        long total = 0;
        for (Endpoint candidate : candidates) {
            total += Math.max(0, candidate.getWeight());
        }
        if (total <= 0) {
            return candidates.get(0);
        }

        double remaining = random.nextDouble() * total;
        Endpoint last = null;
        for (Endpoint candidate : candidates) {
            if (candidate.getWeight() <= 0) {
                continue;
            }
            last = candidate;
            remaining -= candidate.getWeight();
            if (remaining <= 0) {
                return candidate;
            }
        }
        return last;
    }
}
