package com.meshgate.gateway.router;

import com.meshgate.core.model.GatewayRequest;
import com.meshgate.core.model.GatewayResponse;
import reactor.core.publisher.Mono;

/**
 * In-process implementation of an endpoint, used instead of forwarding to a target URL.
 */
@FunctionalInterface
public interface EndpointHandler {
    Mono<GatewayResponse> handle(GatewayRequest request);
}
