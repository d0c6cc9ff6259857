package com.meshgate.gateway.balancer;

import com.meshgate.gateway.registry.Endpoint;

import java.util.List;
import java.util.Random;

public class RandomSelector implements IEndpointSelector {
    private final Random random;

    public RandomSelector(Random random) {
        this.random = random;
    }

    @Override
    public Endpoint select(String serviceName, List<Endpoint> candidates) {
        return candidates.get(random.nextInt(candidates.size()));
    }
}
