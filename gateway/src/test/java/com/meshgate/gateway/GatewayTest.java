package com.meshgate.gateway;

import com.meshgate.core.error.CircuitOpenException;
import com.meshgate.core.error.ServiceNotFoundException;
import com.meshgate.core.metrics.MetricsNames;
import com.meshgate.core.metrics.MetricsTags;
import com.meshgate.core.model.CircuitState;
import com.meshgate.core.model.GatewayRequest;
import com.meshgate.core.model.GatewayResponse;
import com.meshgate.core.model.ServiceHealth;
import com.meshgate.core.model.ServiceMetrics;
import com.meshgate.core.msg.GatewayEvents;
import com.meshgate.gateway.cache.IResponseCache;
import com.meshgate.gateway.cache.InMemoryResponseCache;
import com.meshgate.gateway.config.CircuitBreakerConfig;
import com.meshgate.gateway.config.EndpointConfig;
import com.meshgate.gateway.config.GatewayConfig;
import com.meshgate.gateway.config.ServiceConfig;
import com.meshgate.gateway.registry.Endpoint;
import com.meshgate.gateway.registry.Service;
import com.meshgate.gateway.registry.ServiceHandle;
import com.meshgate.gateway.support.MutableClock;
import com.meshgate.gateway.support.RecordingListener;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GatewayTest {

    private SimpleMeterRegistry meterRegistry;
    private RecordingListener events;
    private Gateway gateway;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock();
        meterRegistry = new SimpleMeterRegistry();
        events = new RecordingListener();
        gateway = new Gateway(
            GatewayConfig.builder().build(),
            new InMemoryResponseCache(100, clock),
            (endpoint, request) -> Mono.just(GatewayResponse.ok("remote")),
            endpoint -> Mono.just(true),
            meterRegistry,
            clock,
            new Random(3)
        );
        gateway.addEventListener(events);
    }

    @Test
    @DisplayName("Health view reflects endpoint status and breaker state")
    void testHealthView() {
        gateway.registerService(users());
        Service service = gateway.registry().lookup("users");

        ServiceHealth health = gateway.getHealth("users");
        assertTrue(health.isActive());
        assertEquals(100.0, health.getHealthPercentage());
        assertEquals(CircuitState.CLOSED, health.getCircuitBreaker().getState());
        assertEquals(List.of("users-1", "users-2"),
            health.getEndpoints().stream().map(e -> e.getId()).collect(Collectors.toList()));

        Endpoint first = service.getEndpoints().get(0);
        for (int i = 0; i < 3; i++) {
            gateway.healthMonitor().markFailure(service, first);
        }

        health = gateway.getHealth().get("users");
        assertEquals(50.0, health.getHealthPercentage());
        assertTrue(health.isActive());
        assertFalse(health.getEndpoints().get(0).isHealthy());
        assertEquals(3, health.getEndpoints().get(0).getFailures());

        assertThrows(ServiceNotFoundException.class, () -> gateway.getHealth("ghost"));
    }

    @Test
    @DisplayName("Metrics view combines breaker counters, endpoint counts and latency")
    void testMetricsView() {
        gateway.registerService(users());

        StepVerifier.create(gateway.route(post("/users")))
            .assertNext(response -> assertEquals(200, response.getStatus()))
            .verifyComplete();

        ServiceMetrics metrics = gateway.getMetrics().get("users");
        assertEquals("users", metrics.getName());
        assertEquals(1, metrics.getSuccess());
        assertEquals(0, metrics.getFailure());
        assertEquals(CircuitState.CLOSED, metrics.getCircuitState());
        assertEquals(2, metrics.getHealthyEndpoints());
        assertEquals(2, metrics.getTotalEndpoints());
        assertEquals(1, metrics.getLatency().getRequestCount());
        assertEquals(1L, meterRegistry.get(MetricsNames.REQUEST_LATENCY)
            .tag(MetricsTags.SERVICE, "users").timer().count());
    }

    @Test
    @DisplayName("Unregistering removes all per-service state; re-registering starts fresh")
    void testUnregisterCascade() {
        gateway.registerService(users());
        gateway.route(post("/users")).block();
        assertNotNull(meterRegistry.find(MetricsNames.HEALTHY_ENDPOINTS).tag(MetricsTags.SERVICE, "users").gauge());

        assertTrue(gateway.unregisterService("users"));
        assertFalse(gateway.unregisterService("users"));

        assertFalse(gateway.getMetrics().containsKey("users"));
        assertFalse(gateway.getHealth().containsKey("users"));
        assertNull(meterRegistry.find(MetricsNames.HEALTHY_ENDPOINTS).tag(MetricsTags.SERVICE, "users").gauge());
        StepVerifier.create(gateway.route(post("/users")))
            .expectError(ServiceNotFoundException.class)
            .verify();

        gateway.registerService(users());
        ServiceMetrics metrics = gateway.getMetrics().get("users");
        assertEquals(0, metrics.getSuccess());
        assertEquals(0, metrics.getLatency().getRequestCount());
    }

    @Test
    @DisplayName("Manual reset closes a tripped breaker and reactivates the service")
    void testResetCircuitBreaker() {
        gateway.registerService(ServiceConfig.builder()
            .name("flaky")
            .maxRetries(0)
            .circuitBreaker(CircuitBreakerConfig.builder().volumeThreshold(2).build())
            .endpoint(EndpointConfig.builder().id("flaky-1").path("/flaky")
                .handler(request -> Mono.just(new GatewayResponse(500, Map.of(), "boom")))
                .build())
            .build());

        gateway.route(post("/flaky")).onErrorResume(e -> Mono.empty()).block();
        gateway.route(post("/flaky")).onErrorResume(e -> Mono.empty()).block();

        assertEquals(CircuitState.OPEN, gateway.getHealth("flaky").getCircuitBreaker().getState());
        assertFalse(gateway.getHealth("flaky").isActive());
        StepVerifier.create(gateway.route(post("/flaky")))
            .expectError(CircuitOpenException.class)
            .verify();

        gateway.resetCircuitBreaker("flaky");

        assertEquals(CircuitState.CLOSED, gateway.getHealth("flaky").getCircuitBreaker().getState());
        assertTrue(gateway.getHealth("flaky").isActive());
        assertTrue(events.eventsOf(GatewayEvents.CircuitClosed.class).get(0).isManual());
        assertEquals(List.of(false, true), events.eventsOf(GatewayEvents.ServiceStatusChanged.class).stream()
            .map(GatewayEvents.ServiceStatusChanged::isActive)
            .collect(Collectors.toList()));

        assertThrows(ServiceNotFoundException.class, () -> gateway.resetCircuitBreaker("ghost"));
    }

    @Test
    @DisplayName("Weight updates are validated as a whole before any is applied")
    void testUpdateEndpointWeights() {
        gateway.registerService(users());
        Service service = gateway.registry().lookup("users");

        Map<String, Integer> invalid = new LinkedHashMap<>();
        invalid.put("users-1", 5);
        invalid.put("users-9", 1);
        assertThrows(IllegalArgumentException.class, () -> gateway.updateEndpointWeights("users", invalid));
        assertEquals(1, service.getEndpoints().get(0).getWeight());

        assertThrows(IllegalArgumentException.class,
            () -> gateway.updateEndpointWeights("users", Map.of("users-1", -2)));

        gateway.updateEndpointWeights("users", Map.of("users-1", 5, "users-2", 0));
        assertEquals(5, service.getEndpoints().get(0).getWeight());
        assertEquals(0, service.getEndpoints().get(1).getWeight());

        assertThrows(ServiceNotFoundException.class,
            () -> gateway.updateEndpointWeights("ghost", Map.of("a", 1)));
    }

    @Test
    @DisplayName("Discovery filters by tag and derived active flag")
    void testDiscoverServices() {
        gateway.registerService(users());
        gateway.registerService(ServiceConfig.builder().name("billing").tag("core").build());
        gateway.registerService(ServiceConfig.builder().name("search").tag("edge")
            .endpoint(EndpointConfig.builder().id("s-1").path("/search").build())
            .build());

        assertEquals(List.of("users", "billing"), names(gateway.discoverServices("core", null)));
        assertEquals(List.of("users"), names(gateway.discoverServices("core", true)));
        assertEquals(List.of("billing"), names(gateway.discoverServices(null, false)));
        assertEquals(List.of("users", "search"), names(gateway.discoverServices(null, true)));
    }

    @Test
    @DisplayName("Listeners and meters see registrations")
    void testRegistrationEventsAndGauges() {
        ServiceHandle handle = gateway.registerService(users());
        gateway.registerService(ServiceConfig.builder().name("billing").build());

        assertEquals("users", handle.name());
        assertEquals(List.of("/users"), handle.routes());
        assertEquals(2, events.eventsOf(GatewayEvents.ServiceRegistered.class).size());
        assertEquals(2.0, meterRegistry.get(MetricsNames.REGISTERED_SERVICES).gauge().value());
        assertEquals(2.0, meterRegistry.get(MetricsNames.HEALTHY_ENDPOINTS)
            .tag(MetricsTags.SERVICE, "users").gauge().value());
    }

    @Test
    @DisplayName("A call finishing after unregister leaves the next registration with fresh state")
    void testInFlightCallAcrossReregistration() {
        Sinks.One<GatewayResponse> upstream = Sinks.one();
        gateway.registerService(ServiceConfig.builder()
            .name("users")
            .endpoint(EndpointConfig.builder().id("slow").path("/users")
                .handler(request -> upstream.asMono()).build())
            .build());

        StepVerifier.create(gateway.route(post("/users")))
            .then(() -> {
                assertTrue(gateway.unregisterService("users"));
                gateway.registerService(users());
                upstream.tryEmitValue(GatewayResponse.ok("late"));
            })
            .assertNext(response -> assertEquals(200, response.getStatus()))
            .verifyComplete();

        ServiceMetrics metrics = gateway.getMetrics().get("users");
        assertEquals(0, metrics.getSuccess());
        assertEquals(0, metrics.getLatency().getRequestCount());
        assertEquals(CircuitState.CLOSED, metrics.getCircuitState());
    }

    @Test
    @DisplayName("Unregistering during a cache lookup does not recreate the circuit breaker")
    void testUnregisterDuringCacheLookup() {
        PendingCache cache = new PendingCache();
        Gateway cached = new Gateway(
            GatewayConfig.builder().build(),
            cache,
            (endpoint, request) -> Mono.just(GatewayResponse.ok("remote")),
            endpoint -> Mono.just(true),
            new SimpleMeterRegistry(),
            new MutableClock(),
            new Random(3)
        );
        cached.registerService(users());
        assertTrue(cached.breakers().find("users").isPresent());

        StepVerifier.create(cached.route(GatewayRequest.builder().method("GET").path("/users").build()))
            .then(() -> {
                assertTrue(cached.unregisterService("users"));
                cache.lookup.tryEmitEmpty();
            })
            .assertNext(response -> assertEquals("remote", response.getBody()))
            .verifyComplete();

        assertFalse(cached.breakers().find("users").isPresent());

        cached.registerService(users());
        assertEquals(0, cached.getMetrics().get("users").getSuccess());
        assertEquals(0, cached.getMetrics().get("users").getLatency().getRequestCount());
    }

    private static ServiceConfig users() {
        return ServiceConfig.builder()
            .name("users")
            .tag("core")
            .endpoint(EndpointConfig.builder().id("users-1").path("/users").target("http://users-1:8080").build())
            .endpoint(EndpointConfig.builder().id("users-2").path("/users").target("http://users-2:8080").build())
            .build();
    }

    private static GatewayRequest post(String path) {
        return GatewayRequest.builder().method("POST").path(path).build();
    }

    private static List<String> names(List<ServiceHealth> services) {
        return services.stream().map(ServiceHealth::getName).collect(Collectors.toList());
    }

    private static class PendingCache implements IResponseCache {
        final Sinks.One<String> lookup = Sinks.one();

        @Override
        public Mono<String> get(String key) {
            return lookup.asMono();
        }

        @Override
        public Mono<Void> set(String key, String value, Duration ttl) {
            return Mono.empty();
        }

        @Override
        public Mono<Void> delete(String key) {
            return Mono.empty();
        }

        @Override
        public void close() {
        }
    }
}
