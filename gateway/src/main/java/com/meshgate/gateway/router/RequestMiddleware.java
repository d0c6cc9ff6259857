package com.meshgate.gateway.router;

import com.meshgate.core.model.GatewayRequest;
import reactor.core.publisher.Mono;

/**
 * Pre-request hook run in registration order before any dispatch.
 * <p>
 * A hook may return a modified request; an empty result keeps the request unchanged. An error aborts
 * the routed call without dispatching it.
 * </p>
 */
@FunctionalInterface
public interface RequestMiddleware {
    Mono<GatewayRequest> apply(GatewayRequest request);
}
