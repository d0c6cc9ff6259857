package com.meshgate.gateway;

import com.meshgate.core.model.BreakerStats;
import com.meshgate.core.model.GatewayRequest;
import com.meshgate.core.model.GatewayResponse;
import com.meshgate.core.model.ServiceHealth;
import com.meshgate.core.model.ServiceMetrics;
import com.meshgate.core.msg.GatewayEvents;
import com.meshgate.gateway.balancer.LoadBalancer;
import com.meshgate.gateway.breaker.CircuitBreaker;
import com.meshgate.gateway.breaker.CircuitBreakerRegistry;
import com.meshgate.gateway.cache.IResponseCache;
import com.meshgate.gateway.config.GatewayConfig;
import com.meshgate.gateway.config.ServiceConfig;
import com.meshgate.gateway.event.GatewayEventBus;
import com.meshgate.gateway.event.GatewayEventListener;
import com.meshgate.gateway.health.HealthMonitor;
import com.meshgate.gateway.health.HealthProbe;
import com.meshgate.gateway.metrics.MetricsCollector;
import com.meshgate.gateway.metrics.MicrometerMetricsSink;
import com.meshgate.gateway.registry.Endpoint;
import com.meshgate.gateway.registry.IServiceRegistry;
import com.meshgate.gateway.registry.Service;
import com.meshgate.gateway.registry.ServiceHandle;
import com.meshgate.gateway.registry.ServiceRegistry;
import com.meshgate.gateway.router.IEndpointDispatcher;
import com.meshgate.gateway.router.RequestRouter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Wires the routing engine together. One instance per process; explicitly constructed and owned by the
 * caller.
 */
public class Gateway implements IGateway {
    private static final Logger log = LoggerFactory.getLogger(Gateway.class);

    private final GatewayEventBus eventBus = new GatewayEventBus();
    private final IServiceRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final HealthMonitor healthMonitor;
    private final MetricsCollector metricsCollector;
    private final RequestRouter router;

    public Gateway(
        GatewayConfig config,
        IResponseCache cache,
        IEndpointDispatcher dispatcher,
        HealthProbe defaultProbe,
        MeterRegistry meterRegistry
    ) {
        this(config, cache, dispatcher, defaultProbe, meterRegistry, Clock.systemUTC(), new Random());
    }

    public Gateway(
        GatewayConfig config,
        IResponseCache cache,
        IEndpointDispatcher dispatcher,
        HealthProbe defaultProbe,
        MeterRegistry meterRegistry,
        Clock clock,
        Random random
    ) {
        this.registry = new ServiceRegistry(config, eventBus, clock);
        this.breakers = new CircuitBreakerRegistry(registry, clock, eventBus);
        this.metricsCollector = new MetricsCollector(registry);
        this.healthMonitor = new HealthMonitor(config, registry, defaultProbe, eventBus, clock);

        LoadBalancer loadBalancer = new LoadBalancer(random);
        MicrometerMetricsSink metricsSink = new MicrometerMetricsSink(meterRegistry, registry);

        eventBus.subscribe(healthMonitor);
        eventBus.subscribe(breakers);
        eventBus.subscribe(loadBalancer);
        eventBus.subscribe(metricsSink);
        eventBus.subscribe(event -> {
            if (event instanceof GatewayEvents.ServiceUnregistered) {
                metricsCollector.remove(event.getServiceName());
            }
        });

        this.router = new RequestRouter(
            config,
            registry,
            breakers,
            loadBalancer,
            healthMonitor,
            metricsCollector,
            metricsSink,
            cache,
            dispatcher,
            clock
        );
    }

    @Override
    public ServiceHandle registerService(ServiceConfig config) {
        ServiceHandle handle = registry.register(config);
        breakers.forService(registry.lookup(handle.name()));
        return handle;
    }

    @Override
    public boolean unregisterService(String name) {
        return registry.unregister(name);
    }

    @Override
    public Mono<GatewayResponse> route(GatewayRequest request) {
        return router.route(request);
    }

    @Override
    public Map<String, ServiceHealth> getHealth() {
        Map<String, ServiceHealth> health = new LinkedHashMap<>();
        for (Service service : registry.services()) {
            health.put(service.getName(), health(service));
        }
        return health;
    }

    @Override
    public ServiceHealth getHealth(String serviceName) {
        return health(registry.lookup(serviceName));
    }

    @Override
    public Map<String, ServiceMetrics> getMetrics() {
        Map<String, ServiceMetrics> metrics = new LinkedHashMap<>();
        for (Service service : registry.services()) {
            BreakerStats stats = breakerStats(service);
            metrics.put(service.getName(), ServiceMetrics.builder()
                .name(service.getName())
                .success(stats.getSuccessful())
                .failure(stats.getFailed())
                .timeout(stats.getTimeout())
                .rejected(stats.getRejected())
                .circuitState(stats.getState())
                .healthyEndpoints(service.healthyEndpoints().size())
                .totalEndpoints(service.getEndpoints().size())
                .latency(metricsCollector.snapshot(service.getName()))
                .build());
        }
        return metrics;
    }

    @Override
    public void resetCircuitBreaker(String serviceName) {
        breakers.forService(registry.lookup(serviceName)).reset();
    }

    @Override
    public void updateEndpointWeights(String serviceName, Map<String, Integer> weights) {
        Service service = registry.lookup(serviceName);

        Map<Endpoint, Integer> resolved = new LinkedHashMap<>();
        weights.forEach((endpointId, weight) -> {
            Endpoint endpoint = service.findEndpoint(endpointId).orElseThrow(() ->
                new IllegalArgumentException("Unknown endpoint " + endpointId + " in service " + serviceName));
            if (weight == null || weight < 0) {
                throw new IllegalArgumentException("Invalid weight " + weight + " for endpoint " + endpointId);
            }
            resolved.put(endpoint, weight);
        });

        resolved.forEach(Endpoint::setWeight);
        log.info("Updated endpoint weights of {}: {}", serviceName, weights);
    }

    @Override
    public List<ServiceHealth> discoverServices(String tag, Boolean active) {
        return registry.discover(tag, null).stream()
            .map(this::health)
            .filter(health -> active == null || health.isActive() == active)
            .collect(Collectors.toList());
    }

    @Override
    public void addEventListener(GatewayEventListener listener) {
        eventBus.subscribe(listener);
    }

    @Override
    public void start() {
        healthMonitor.start();
        log.info("Gateway started with {} services", registry.services().size());
    }

    @Override
    public void stop() {
        healthMonitor.stop();
        log.info("Gateway stopped");
    }

    IServiceRegistry registry() {
        return registry;
    }

    HealthMonitor healthMonitor() {
        return healthMonitor;
    }

    CircuitBreakerRegistry breakers() {
        return breakers;
    }

    private ServiceHealth health(Service service) {
        return ServiceHealth.builder()
            .name(service.getName())
            .active(healthMonitor.isActive(service.getName()))
            .healthPercentage(healthMonitor.healthPercentage(service))
            .circuitBreaker(breakerStats(service))
            .endpoints(service.getEndpoints().stream().map(Endpoint::snapshot).collect(Collectors.toList()))
            .build();
    }

    private BreakerStats breakerStats(Service service) {
        return breakers.find(service.getName())
            .map(CircuitBreaker::getStats)
            .orElseGet(BreakerStats::closed);
    }
}
