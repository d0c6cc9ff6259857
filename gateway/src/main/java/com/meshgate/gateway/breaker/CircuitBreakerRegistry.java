package com.meshgate.gateway.breaker;

import com.meshgate.core.msg.GatewayEvent;
import com.meshgate.core.msg.GatewayEvents;
import com.meshgate.gateway.event.GatewayEventBus;
import com.meshgate.gateway.event.GatewayEventListener;
import com.meshgate.gateway.registry.IServiceRegistry;
import com.meshgate.gateway.registry.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link CircuitBreaker} per registered service, created on registration and dropped on removal.
 * <p>
 * A breaker belongs to one registration. Calls still in flight for a service that was unregistered (or
 * unregistered and registered again) get a detached breaker, so they never recreate or reuse state of the
 * current registration.
 * </p>
 */
public class CircuitBreakerRegistry implements GatewayEventListener {
    private final Map<String, Binding> breakers = new ConcurrentHashMap<>();
    private final IServiceRegistry registry;
    private final Clock clock;
    private final GatewayEventBus eventBus;

    public CircuitBreakerRegistry(IServiceRegistry registry, Clock clock, GatewayEventBus eventBus) {
        this.registry = registry;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    public CircuitBreaker forService(Service service) {
        // Unregister removes the service before the removal event reaches this map, so a binding
        // created here for a registered service is always cleaned up
        Binding binding = breakers.compute(service.getName(), (name, existing) -> {
            if (existing != null && existing.service() == service) {
                return existing;
            }
            if (!isRegistered(service)) {
                return existing;
            }
            return new Binding(service, new CircuitBreaker(name, service.getCircuitBreaker(), clock, eventBus));
        });

        if (binding == null || binding.service() != service) {
            return detached(service);
        }
        return binding.breaker();
    }

    public Optional<CircuitBreaker> find(String serviceName) {
        return Optional.ofNullable(breakers.get(serviceName))
            .filter(binding -> isRegistered(binding.service()))
            .map(Binding::breaker);
    }

    @Override
    public void onEvent(GatewayEvent event) {
        if (event instanceof GatewayEvents.ServiceUnregistered) {
            breakers.remove(event.getServiceName());
        }
    }

    private boolean isRegistered(Service service) {
        return registry.find(service.getName()).filter(current -> current == service).isPresent();
    }

    // Transitions of a stale registration stay off the shared bus
    private CircuitBreaker detached(Service service) {
        return new CircuitBreaker(service.getName(), service.getCircuitBreaker(), clock, new GatewayEventBus());
    }

    private record Binding(Service service, CircuitBreaker breaker) {
    }
}
