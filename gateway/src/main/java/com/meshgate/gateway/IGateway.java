package com.meshgate.gateway;

import com.meshgate.core.model.GatewayRequest;
import com.meshgate.core.model.GatewayResponse;
import com.meshgate.core.model.ServiceHealth;
import com.meshgate.core.model.ServiceMetrics;
import com.meshgate.gateway.config.ServiceConfig;
import com.meshgate.gateway.event.GatewayEventListener;
import com.meshgate.gateway.registry.ServiceHandle;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Public surface of the routing engine.
 */
public interface IGateway {

    ServiceHandle registerService(ServiceConfig config);

    /**
     * Removes a service with its health, breaker and metrics state. Unknown names are ignored.
     */
    boolean unregisterService(String name);

    Mono<GatewayResponse> route(GatewayRequest request);

    /**
     * Health of every service, in registration order.
     */
    Map<String, ServiceHealth> getHealth();

    ServiceHealth getHealth(String serviceName);

    /**
     * Metrics of every service, in registration order.
     */
    Map<String, ServiceMetrics> getMetrics();

    void resetCircuitBreaker(String serviceName);

    /**
     * Replaces the weights of the given endpoints; all ids must exist and weights must be {@code >= 0}.
     */
    void updateEndpointWeights(String serviceName, Map<String, Integer> weights);

    /**
     * Services carrying {@code tag} (any when null) whose derived active flag equals {@code active}
     * (any when null).
     */
    List<ServiceHealth> discoverServices(String tag, Boolean active);

    void addEventListener(GatewayEventListener listener);

    void start();

    void stop();
}
