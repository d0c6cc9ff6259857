package com.meshgate.gateway.config;

import com.meshgate.gateway.health.HealthProbe;
import com.meshgate.gateway.router.EndpointHandler;
import lombok.Builder;
import lombok.Value;

/**
 * Registration data of one endpoint.
 * <p>
 * An endpoint is served either by an in-process {@link #handler} or by forwarding to {@link #target}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class EndpointConfig {
    /**
     * Unique within the service. Defaults to the target, then to the path.
     */
    String id;

    String path;

    /**
     * Base URL of the backend, e.g. {@code http://users-1:8080}.
     */
    String target;

    @Builder.Default
    int weight = 1;

    EndpointHandler handler;

    /**
     * Endpoint-specific probe; overrides the service probe.
     */
    HealthProbe probe;

    public String resolveId() {
        if (id != null && !id.isBlank()) {
            return id;
        }
        return target != null && !target.isBlank() ? target : path;
    }
}
