package com.meshgate.gateway.registry;

import com.meshgate.core.model.LoadBalancingStrategy;
import com.meshgate.gateway.config.CircuitBreakerConfig;
import com.meshgate.gateway.config.EndpointConfig;
import com.meshgate.gateway.config.ServiceConfig;
import com.meshgate.gateway.health.HealthProbe;
import com.meshgate.gateway.router.RequestMiddleware;
import lombok.Getter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A registered service: immutable settings plus its endpoints.
 */
@Getter
public class Service {
    private final String name;
    private final long registrationOrder;
    private final List<Endpoint> endpoints;
    private final Duration timeout;
    private final int maxRetries;
    private final LoadBalancingStrategy strategy;
    private final Duration cacheTtl;
    private final List<RequestMiddleware> middleware;
    private final List<String> routes;
    private final Set<String> tags;
    private final String version;
    private final HealthProbe healthProbe;
    private final CircuitBreakerConfig circuitBreaker;
    private final Duration backoffBase;
    private final Duration backoffCap;
    private final Duration backoffJitter;

    Service(ServiceConfig config, long registrationOrder) {
        if (config.getName() == null || config.getName().isBlank()) {
            throw new IllegalArgumentException("Service name is required");
        }
        if (config.getMaxRetries() < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 for service " + config.getName());
        }

        this.name = config.getName();
        this.registrationOrder = registrationOrder;

        Set<String> ids = new HashSet<>();
        List<Endpoint> built = new ArrayList<>();
        for (EndpointConfig endpointConfig : config.getEndpoints()) {
            String id = endpointConfig.resolveId();
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Endpoint of " + name + " needs an id, target or path");
            }
            if (!ids.add(id)) {
                throw new IllegalArgumentException("Duplicate endpoint " + id + " in service " + name);
            }
            built.add(new Endpoint(name, endpointConfig));
        }
        this.endpoints = List.copyOf(built);

        this.timeout = config.getTimeout();
        this.maxRetries = config.getMaxRetries();
        this.strategy = config.getStrategy() != null ? config.getStrategy() : LoadBalancingStrategy.ROUND_ROBIN;
        this.cacheTtl = config.getCacheTtl();
        this.middleware = List.copyOf(config.getMiddleware());
        this.routes = config.getRoutes().isEmpty() ? endpointPaths(built) : List.copyOf(config.getRoutes());
        this.tags = Set.copyOf(config.getTags());
        this.version = config.getVersion();
        this.healthProbe = config.getHealthProbe();
        this.circuitBreaker = config.getCircuitBreaker();
        this.backoffBase = config.getBackoffBase();
        this.backoffCap = config.getBackoffCap();
        this.backoffJitter = config.getBackoffJitter();
    }

    private static List<String> endpointPaths(List<Endpoint> endpoints) {
        Set<String> paths = new LinkedHashSet<>();
        for (Endpoint endpoint : endpoints) {
            if (endpoint.getPath() != null && !endpoint.getPath().isEmpty()) {
                paths.add(endpoint.getPath());
            }
        }
        return List.copyOf(paths);
    }

    /**
     * Dispatch attempts per routed call.
     */
    public int getAttempts() {
        return Math.max(1, maxRetries);
    }

    public Optional<Endpoint> findEndpoint(String endpointId) {
        return endpoints.stream()
            .filter(endpoint -> endpoint.getId().equals(endpointId))
            .findFirst();
    }

    /**
     * Routable endpoints in registration order.
     */
    public List<Endpoint> healthyEndpoints() {
        return endpoints.stream()
            .filter(Endpoint::isHealthy)
            .collect(Collectors.toList());
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}
