package com.meshgate.gateway.health;

import com.meshgate.core.model.EndpointStatus;
import com.meshgate.core.msg.GatewayEvent;
import com.meshgate.core.msg.GatewayEvents;
import com.meshgate.gateway.config.GatewayConfig;
import com.meshgate.gateway.event.GatewayEventBus;
import com.meshgate.gateway.event.GatewayEventListener;
import com.meshgate.gateway.registry.Endpoint;
import com.meshgate.gateway.registry.IServiceRegistry;
import com.meshgate.gateway.registry.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks endpoint health from live outcomes and active probes, and derives service availability.
 * <p>
 * <b>Endpoint states:</b> REGISTERED and HEALTHY are routable; UNHEALTHY and ERROR are not.
 * <ul>
 *   <li>A failure on a routable endpoint increments its consecutive failures; at
 *       {@code failureThreshold} it becomes UNHEALTHY, or ERROR when the failing check was a probe
 *       that raised an error</li>
 *   <li>Any success resets the consecutive failures</li>
 *   <li>A live success on a routable endpoint makes it HEALTHY</li>
 *   <li>A live success on an UNHEALTHY/ERROR endpoint keeps its status; such an endpoint comes back
 *       through a successful probe</li>
 * </ul>
 * </p>
 * <p>
 * A service is active while it has at least one routable endpoint and its breaker is not OPEN.
 * Breaker state is learned from circuit events. Activity changes are published in the order they
 * happen, and only for the registration currently holding the service name.
 * </p>
 */
public class HealthMonitor implements GatewayEventListener {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final GatewayConfig config;
    private final IServiceRegistry registry;
    private final HealthProbe defaultProbe;
    private final GatewayEventBus eventBus;
    private final Clock clock;

    private final Map<String, Boolean> lastActive = new ConcurrentHashMap<>();
    private final Set<String> openCircuits = ConcurrentHashMap.newKeySet();

    private volatile Disposable healthChecks;
    private volatile Disposable autoRecovery;

    private enum Outcome { SUCCESS, UNHEALTHY, PROBE_ERROR }

    public HealthMonitor(
        GatewayConfig config,
        IServiceRegistry registry,
        HealthProbe defaultProbe,
        GatewayEventBus eventBus,
        Clock clock
    ) {
        this.config = config;
        this.registry = registry;
        this.defaultProbe = defaultProbe;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public synchronized void start() {
        if (healthChecks != null) {
            return;
        }
        healthChecks = Flux.interval(config.getHealthCheckInterval())
            .onBackpressureDrop()
            .concatMap(tick -> runHealthChecks())
            .subscribe(null, err -> log.error("Health check loop terminated", err));

        if (config.isAutoRecoveryEnabled()) {
            autoRecovery = Flux.interval(config.getAutoRecoveryInterval())
                .onBackpressureDrop()
                .concatMap(tick -> runAutoRecovery())
                .subscribe(null, err -> log.error("Auto-recovery loop terminated", err));
        }
        log.info("Health monitor started: checks every {}, auto-recovery {}",
            config.getHealthCheckInterval(),
            config.isAutoRecoveryEnabled() ? "every " + config.getAutoRecoveryInterval() : "disabled");
    }

    public synchronized void stop() {
        if (healthChecks != null) {
            healthChecks.dispose();
            healthChecks = null;
        }
        if (autoRecovery != null) {
            autoRecovery.dispose();
            autoRecovery = null;
        }
        log.info("Health monitor stopped");
    }

    /**
     * Live dispatch succeeded.
     */
    public void markSuccess(Service service, Endpoint endpoint) {
        apply(service, endpoint, Outcome.SUCCESS, false);
    }

    /**
     * Live dispatch failed.
     */
    public void markFailure(Service service, Endpoint endpoint) {
        apply(service, endpoint, Outcome.UNHEALTHY, false);
    }

    /**
     * Probes one endpoint and applies the result.
     *
     * @return whether the endpoint answered healthy
     */
    public Mono<Boolean> checkEndpoint(Service service, Endpoint endpoint) {
        HealthProbe probe = resolveProbe(service, endpoint);
        if (probe == null) {
            // No probe and nothing to call: healthy by default
            apply(service, endpoint, Outcome.SUCCESS, true);
            return Mono.just(true);
        }

        return Mono.defer(() -> probe.probe(endpoint))
            .timeout(config.getProbeTimeout())
            .defaultIfEmpty(false)
            .map(healthy -> {
                apply(service, endpoint, healthy ? Outcome.SUCCESS : Outcome.UNHEALTHY, true);
                log.debug("Health check for {}: {}", endpoint, healthy ? "healthy" : "unhealthy");
                return healthy;
            })
            .onErrorResume(err -> {
                log.debug("Health probe for {} failed: {}", endpoint, err.toString());
                apply(service, endpoint, Outcome.PROBE_ERROR, true);
                return Mono.just(false);
            });
    }

    /**
     * Probes routable endpoints that were not checked within {@code recentCheckWindow}.
     */
    public Mono<Void> runHealthChecks() {
        long now = clock.millis();
        long recentMs = config.getRecentCheckWindow().toMillis();

        return Flux.fromIterable(registry.services())
            .flatMap(service -> Flux.fromIterable(service.getEndpoints())
                .filter(Endpoint::isHealthy)
                .filter(endpoint -> now - endpoint.getLastCheck() >= recentMs)
                .flatMap(endpoint -> checkEndpoint(service, endpoint)))
            .then();
    }

    /**
     * Re-probes every UNHEALTHY or ERROR endpoint.
     */
    public Mono<Void> runAutoRecovery() {
        return Flux.fromIterable(registry.services())
            .flatMap(service -> Flux.fromIterable(service.getEndpoints())
                .filter(endpoint -> !endpoint.isHealthy())
                .doOnNext(endpoint -> log.info("Attempting to recover {}", endpoint))
                .flatMap(endpoint -> checkEndpoint(service, endpoint)
                    .doOnNext(healthy -> {
                        if (healthy) {
                            log.info("Recovered {}", endpoint);
                        }
                    })))
            .then();
    }

    public boolean isActive(String serviceName) {
        return registry.find(serviceName).map(this::computeActive).orElse(false);
    }

    /**
     * Share of routable endpoints, 0 when the service has none.
     */
    public double healthPercentage(Service service) {
        List<Endpoint> endpoints = service.getEndpoints();
        if (endpoints.isEmpty()) {
            return 0.0;
        }
        return service.healthyEndpoints().size() * 100.0 / endpoints.size();
    }

    @Override
    public void onEvent(GatewayEvent event) {
        String name = event.getServiceName();
        if (event instanceof GatewayEvents.ServiceRegistered) {
            registry.find(name).ifPresent(service -> {
                synchronized (service) {
                    lastActive.put(name, computeActive(service));
                }
            });
        } else if (event instanceof GatewayEvents.ServiceUnregistered) {
            lastActive.remove(name);
            openCircuits.remove(name);
        } else if (event instanceof GatewayEvents.CircuitOpened) {
            openCircuits.add(name);
            registry.find(name).ifPresent(this::refreshActive);
        } else if (event instanceof GatewayEvents.CircuitHalfOpened || event instanceof GatewayEvents.CircuitClosed) {
            openCircuits.remove(name);
            registry.find(name).ifPresent(this::refreshActive);
        }
    }

    private HealthProbe resolveProbe(Service service, Endpoint endpoint) {
        if (endpoint.getProbe() != null) {
            return endpoint.getProbe();
        }
        if (service.getHealthProbe() != null) {
            return service.getHealthProbe();
        }
        return endpoint.getTarget() != null ? defaultProbe : null;
    }

    private void apply(Service service, Endpoint endpoint, Outcome outcome, boolean fromProbe) {
        EndpointStatus previous;
        EndpointStatus next;

        synchronized (endpoint) {
            previous = endpoint.getStatus();
            endpoint.setLastCheck(clock.millis());

            if (outcome == Outcome.SUCCESS) {
                endpoint.resetFailures();
                if (previous.isRoutable() || fromProbe) {
                    endpoint.setStatus(EndpointStatus.HEALTHY);
                }
            } else {
                int failures = endpoint.incrementFailures();
                if (previous.isRoutable() && failures >= config.getFailureThreshold()) {
                    endpoint.setStatus(outcome == Outcome.PROBE_ERROR ? EndpointStatus.ERROR : EndpointStatus.UNHEALTHY);
                }
            }
            next = endpoint.getStatus();
        }

        if (previous != next) {
            if (next.isRoutable()) {
                log.info("Endpoint {} of {} is now {} (was {})", endpoint.getId(), service.getName(), next, previous);
            } else {
                log.warn("Endpoint {} of {} is now {} after {} consecutive failures",
                    endpoint.getId(), service.getName(), next, endpoint.getConsecutiveFailures());
            }
            eventBus.publish(new GatewayEvents.EndpointMarked(
                service.getName(), endpoint.getId(), previous, next, clock.millis()));
            refreshActive(service);
        }
    }

    private boolean computeActive(Service service) {
        return !service.healthyEndpoints().isEmpty() && !openCircuits.contains(service.getName());
    }

    private void refreshActive(Service service) {
        String name = service.getName();
        synchronized (service) {
            boolean active = computeActive(service);
            Boolean[] previous = new Boolean[1];
            lastActive.compute(name, (key, current) -> {
                if (!isRegistered(service)) {
                    return current;
                }
                previous[0] = current;
                return active;
            });

            if (previous[0] != null && previous[0] != active) {
                log.info("Service {} is now {}", name, active ? "active" : "inactive");
                eventBus.publish(new GatewayEvents.ServiceStatusChanged(name, active, clock.millis()));
            }
        }
    }

    private boolean isRegistered(Service service) {
        return registry.find(service.getName()).filter(current -> current == service).isPresent();
    }
}
