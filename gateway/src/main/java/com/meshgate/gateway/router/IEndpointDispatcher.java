package com.meshgate.gateway.router;

import com.meshgate.core.model.GatewayRequest;
import com.meshgate.core.model.GatewayResponse;
import com.meshgate.gateway.registry.Endpoint;
import reactor.core.publisher.Mono;

/**
 * Sends a request to a remote endpoint.
 */
public interface IEndpointDispatcher {
    Mono<GatewayResponse> dispatch(Endpoint endpoint, GatewayRequest request);
}
