package com.meshgate.gateway.metrics;

import com.meshgate.core.model.MetricsSample;
import com.meshgate.gateway.config.GatewayConfig;
import com.meshgate.gateway.config.ServiceConfig;
import com.meshgate.gateway.event.GatewayEventBus;
import com.meshgate.gateway.registry.Service;
import com.meshgate.gateway.registry.ServiceRegistry;
import com.meshgate.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsCollectorTest {

    private ServiceRegistry registry;
    private MetricsCollector collector;
    private Service users;

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry(GatewayConfig.builder().build(), new GatewayEventBus(), new MutableClock());
        collector = new MetricsCollector(registry);
        registry.register(ServiceConfig.builder().name("users").build());
        users = registry.lookup("users");
    }

    @Test
    @DisplayName("p95 of latencies 1..100 is 96")
    void testP95() {
        for (int latency = 1; latency <= 100; latency++) {
            collector.recordRequest(users, latency, true);
        }

        MetricsSample sample = collector.snapshot("users");
        assertEquals(96.0, sample.getP95ResponseTime());
        assertEquals(50.5, sample.getAvgResponseTime(), 1e-9);
        assertEquals(100, sample.getRequestCount());
    }

    @Test
    @DisplayName("p95 stays 0 until more than 10 samples are buffered")
    void testP95NeedsSamples() {
        for (int i = 0; i < 10; i++) {
            collector.recordRequest(users, 500, true);
        }
        assertEquals(0.0, collector.snapshot("users").getP95ResponseTime());

        collector.recordRequest(users, 500, true);
        assertEquals(500.0, collector.snapshot("users").getP95ResponseTime());
    }

    @Test
    @DisplayName("The p95 window keeps only the last 100 samples while the mean covers all")
    void testRingBufferEviction() {
        for (int i = 0; i < 100; i++) {
            collector.recordRequest(users, 1000, true);
        }
        for (int i = 0; i < 100; i++) {
            collector.recordRequest(users, 10, true);
        }

        MetricsSample sample = collector.snapshot("users");
        assertEquals(10.0, sample.getP95ResponseTime());
        assertEquals(505.0, sample.getAvgResponseTime(), 1e-9);
    }

    @Test
    @DisplayName("Availability uses the +1 smoothed formula")
    void testAvailability() {
        assertEquals(100.0, collector.snapshot("users").getAvailabilityPercentage());

        collector.recordRequest(users, 5, true);
        collector.recordRequest(users, 5, true);
        collector.recordRequest(users, 5, false);

        MetricsSample sample = collector.snapshot("users");
        assertEquals(1, sample.getErrorCount());
        assertEquals(75.0, sample.getAvailabilityPercentage(), 1e-9);
    }

    @Test
    @DisplayName("Cache hits are counted apart from requests")
    void testCacheHits() {
        collector.recordCacheHit(users);
        collector.recordCacheHit(users);

        MetricsSample sample = collector.snapshot("users");
        assertEquals(2, sample.getCacheHits());
        assertEquals(0, sample.getRequestCount());
    }

    @Test
    @DisplayName("Removing a service drops its sample")
    void testRemove() {
        collector.recordRequest(users, 5, false);
        collector.remove("users");

        assertEquals(0, collector.snapshot("users").getRequestCount());
        assertEquals(0, collector.snapshot("users").getErrorCount());
    }

    @Test
    @DisplayName("Outcomes of a removed or replaced registration are dropped")
    void testStaleRegistration() {
        collector.recordRequest(users, 5, true);
        registry.unregister("users");
        collector.remove("users");

        collector.recordRequest(users, 5, false);
        collector.recordCacheHit(users);
        assertEquals(0, collector.snapshot("users").getRequestCount());

        registry.register(ServiceConfig.builder().name("users").build());
        Service current = registry.lookup("users");
        collector.recordRequest(users, 5, false);
        assertEquals(0, collector.snapshot("users").getRequestCount());
        assertEquals(0, collector.snapshot("users").getCacheHits());

        collector.recordRequest(current, 7, true);
        MetricsSample sample = collector.snapshot("users");
        assertEquals(1, sample.getRequestCount());
        assertEquals(0, sample.getErrorCount());
    }
}
