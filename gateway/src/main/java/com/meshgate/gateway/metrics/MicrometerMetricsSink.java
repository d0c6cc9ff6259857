package com.meshgate.gateway.metrics;

import com.meshgate.core.error.GatewayException;
import com.meshgate.core.metrics.MetricsNames;
import com.meshgate.core.metrics.MetricsTags;
import com.meshgate.core.model.CircuitState;
import com.meshgate.core.msg.GatewayEvent;
import com.meshgate.core.msg.GatewayEvents;
import com.meshgate.gateway.event.GatewayEventListener;
import com.meshgate.gateway.registry.IServiceRegistry;
import com.meshgate.gateway.registry.Service;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed sink.
 * <p>
 * Also listens to registry and breaker events: it maintains one healthy-endpoint gauge per registered
 * service and counts breaker transitions.
 * </p>
 */
public class MicrometerMetricsSink implements IMetricsSink, GatewayEventListener {
    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsSink.class);

    private final MeterRegistry meterRegistry;
    private final IServiceRegistry serviceRegistry;
    private final Map<String, Gauge> healthyEndpointGauges = new ConcurrentHashMap<>();

    public MicrometerMetricsSink(MeterRegistry meterRegistry, IServiceRegistry serviceRegistry) {
        this.meterRegistry = meterRegistry;
        this.serviceRegistry = serviceRegistry;

        Gauge.builder(MetricsNames.REGISTERED_SERVICES, serviceRegistry, registry -> registry.services().size())
            .description("Registered services")
            .register(meterRegistry);
    }

    @Override
    public void trackRequest(String serviceName, double latencyMs, int statusCode, String path) {
        Timer.builder(MetricsNames.REQUEST_LATENCY)
            .tag(MetricsTags.SERVICE, serviceName)
            .tag(MetricsTags.STATUS, String.valueOf(statusCode))
            .register(meterRegistry)
            .record((long) (latencyMs * 1_000_000), TimeUnit.NANOSECONDS);
    }

    @Override
    public void trackError(String serviceName, Throwable error, String path) {
        int status = error instanceof GatewayException gatewayError ? gatewayError.getStatusCode() : 500;
        Counter.builder(MetricsNames.REQUEST_ERRORS_TOTAL)
            .tag(MetricsTags.SERVICE, serviceName)
            .tag(MetricsTags.STATUS, String.valueOf(status))
            .tag(MetricsTags.REASON, error.getClass().getSimpleName())
            .register(meterRegistry)
            .increment();
        log.debug("Request to {} on {} failed: {}", serviceName, path, error.toString());
    }

    @Override
    public void trackCacheHit(String serviceName) {
        meterRegistry.counter(MetricsNames.CACHE_HITS_TOTAL, MetricsTags.SERVICE, serviceName).increment();
    }

    @Override
    public void trackRetry(String serviceName) {
        meterRegistry.counter(MetricsNames.RETRIES_TOTAL, MetricsTags.SERVICE, serviceName).increment();
    }

    @Override
    public void trackDegradedDispatch(String serviceName) {
        meterRegistry.counter(MetricsNames.DEGRADED_DISPATCH_TOTAL, MetricsTags.SERVICE, serviceName).increment();
    }

    @Override
    public void trackBreakerTransition(String serviceName, CircuitState state) {
        meterRegistry.counter(MetricsNames.BREAKER_TRANSITIONS_TOTAL,
            MetricsTags.SERVICE, serviceName,
            MetricsTags.STATE, state.name().toLowerCase()).increment();
    }

    @Override
    public void onEvent(GatewayEvent event) {
        if (event instanceof GatewayEvents.ServiceRegistered registered) {
            serviceRegistry.find(registered.getServiceName()).ifPresent(this::registerHealthGauge);
        } else if (event instanceof GatewayEvents.ServiceUnregistered) {
            Gauge gauge = healthyEndpointGauges.remove(event.getServiceName());
            if (gauge != null) {
                meterRegistry.remove(gauge);
            }
        } else if (event instanceof GatewayEvents.CircuitOpened) {
            trackBreakerTransition(event.getServiceName(), CircuitState.OPEN);
        } else if (event instanceof GatewayEvents.CircuitHalfOpened) {
            trackBreakerTransition(event.getServiceName(), CircuitState.HALF_OPEN);
        } else if (event instanceof GatewayEvents.CircuitClosed) {
            trackBreakerTransition(event.getServiceName(), CircuitState.CLOSED);
        }
    }

    private void registerHealthGauge(Service service) {
        Gauge gauge = Gauge.builder(MetricsNames.HEALTHY_ENDPOINTS, service, s -> s.healthyEndpoints().size())
            .tag(MetricsTags.SERVICE, service.getName())
            .description("Routable endpoints per service")
            .register(meterRegistry);
        healthyEndpointGauges.put(service.getName(), gauge);
    }
}
