package com.meshgate.gateway.registry;

import com.meshgate.core.error.DuplicateServiceException;
import com.meshgate.core.error.ServiceNotFoundException;
import com.meshgate.core.msg.GatewayEvents;
import com.meshgate.gateway.config.GatewayConfig;
import com.meshgate.gateway.config.ServiceConfig;
import com.meshgate.gateway.event.GatewayEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory service registry with a memoized path resolver.
 * <p>
 * Registration and removal publish {@code ServiceRegistered} / {@code ServiceUnregistered} on the event
 * bus. Delivery is synchronous, so the health, breaker and metrics state of an unregistered service is
 * gone when {@link #unregister(String)} returns.
 * </p>
 * <p>
 * Path resolutions are cached until the next register/unregister, or until {@code routeCacheTtl} has
 * passed since the last clear. Misses are not cached. Entries are stamped with the cache generation their
 * scan started in; a clear bumps the generation, so a scan that raced a registration cannot pin its result.
 * </p>
 */
public class ServiceRegistry implements IServiceRegistry {
    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final Map<String, Service> services = new ConcurrentHashMap<>();
    private final Map<String, RouteEntry> routeCache = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong routeGeneration = new AtomicLong();
    private final GatewayEventBus eventBus;
    private final Clock clock;
    private final long routeCacheTtlMs;

    private volatile long routeCacheClearedAt;

    public ServiceRegistry(GatewayConfig config, GatewayEventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
        this.routeCacheTtlMs = config.getRouteCacheTtl().toMillis();
        this.routeCacheClearedAt = clock.millis();
    }

    @Override
    public ServiceHandle register(ServiceConfig config) {
        Service service = new Service(config, sequence.incrementAndGet());

        Service existing = services.putIfAbsent(service.getName(), service);
        if (existing != null) {
            throw new DuplicateServiceException(service.getName());
        }
        clearRouteCache();

        log.info("Registered service {} v{} with {} endpoints, routes={}, strategy={}",
            service.getName(), service.getVersion(), service.getEndpoints().size(),
            service.getRoutes(), service.getStrategy());

        eventBus.publish(new GatewayEvents.ServiceRegistered(
            service.getName(), service.getVersion(), service.getEndpoints().size(), clock.millis()));

        return ServiceHandle.of(service);
    }

    @Override
    public boolean unregister(String name) {
        Service removed = name == null ? null : services.remove(name);
        if (removed == null) {
            log.debug("Unregister ignored, service {} is not registered", name);
            return false;
        }
        clearRouteCache();

        log.info("Unregistered service {}", name);
        eventBus.publish(new GatewayEvents.ServiceUnregistered(name, clock.millis()));
        return true;
    }

    @Override
    public Service lookup(String name) {
        return find(name).orElseThrow(() -> new ServiceNotFoundException(name));
    }

    @Override
    public Optional<Service> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(services.get(name));
    }

    @Override
    public String resolveByPath(String path) {
        if (path == null) {
            return null;
        }
        expireRouteCache();
        long generation = routeGeneration.get();

        RouteEntry cached = routeCache.get(path);
        if (cached != null && cached.generation() == generation && services.containsKey(cached.serviceName())) {
            return cached.serviceName();
        }

        String bestService = null;
        int bestLength = -1;
        for (Service service : services()) {
            for (String route : service.getRoutes()) {
                // Strictly longer wins, so an equal-length match keeps the earlier registration
                if (path.startsWith(route) && route.length() > bestLength) {
                    bestService = service.getName();
                    bestLength = route.length();
                }
            }
        }

        if (bestService != null && routeGeneration.get() == generation) {
            routeCache.put(path, new RouteEntry(bestService, generation));
        }
        return bestService;
    }

    @Override
    public List<Service> services() {
        return services.values().stream()
            .sorted(Comparator.comparingLong(Service::getRegistrationOrder))
            .collect(Collectors.toList());
    }

    @Override
    public List<Service> findByTag(String tag) {
        return discover(tag, null);
    }

    @Override
    public List<Service> discover(String tag, String version) {
        return services().stream()
            .filter(service -> tag == null || service.hasTag(tag))
            .filter(service -> version == null || version.equals(service.getVersion()))
            .collect(Collectors.toList());
    }

    private void expireRouteCache() {
        long now = clock.millis();
        if (now - routeCacheClearedAt >= routeCacheTtlMs) {
            clearRouteCache();
        }
    }

    private void clearRouteCache() {
        routeGeneration.incrementAndGet();
        routeCache.clear();
        routeCacheClearedAt = clock.millis();
    }

    private record RouteEntry(String serviceName, long generation) {
    }
}
