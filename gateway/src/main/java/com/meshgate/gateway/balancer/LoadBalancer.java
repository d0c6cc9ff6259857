package com.meshgate.gateway.balancer;

import com.meshgate.core.model.LoadBalancingStrategy;
import com.meshgate.core.msg.GatewayEvent;
import com.meshgate.core.msg.GatewayEvents;
import com.meshgate.gateway.event.GatewayEventListener;
import com.meshgate.gateway.registry.Endpoint;
import com.meshgate.gateway.registry.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Dispatches selection to the strategy configured on each service.
 * <p>
 * Selection is pure and non-blocking; the only state is the round-robin cursor per service, dropped
 * when the service is unregistered.
 * </p>
 */
public class LoadBalancer implements ILoadBalancer, GatewayEventListener {
    private final Map<LoadBalancingStrategy, IEndpointSelector> selectors = new EnumMap<>(LoadBalancingStrategy.class);
    private final Random random;

    public LoadBalancer() {
        this(new Random());
    }

    public LoadBalancer(Random random) {
        this.random = random;
        selectors.put(LoadBalancingStrategy.ROUND_ROBIN, new RoundRobinSelector());
        selectors.put(LoadBalancingStrategy.LEAST_CONNECTIONS, new LeastConnectionsSelector());
        selectors.put(LoadBalancingStrategy.WEIGHTED, new WeightedSelector(random));
        selectors.put(LoadBalancingStrategy.RANDOM, new RandomSelector(random));
    }

    @Override
    public Endpoint select(Service service) {
        List<Endpoint> candidates = service.healthyEndpoints();
        if (candidates.isEmpty()) {
            return null;
        }
        return selectors.get(service.getStrategy()).select(service.getName(), candidates);
    }

    @Override
    public Endpoint selectAny(Service service) {
        List<Endpoint> endpoints = service.getEndpoints();
        if (endpoints.isEmpty()) {
            return null;
        }
        return endpoints.get(random.nextInt(endpoints.size()));
    }

    @Override
    public void forget(String serviceName) {
        selectors.values().forEach(selector -> selector.forget(serviceName));
    }

    @Override
    public void onEvent(GatewayEvent event) {
        if (event instanceof GatewayEvents.ServiceUnregistered) {
            forget(event.getServiceName());
        }
    }
}
