package com.meshgate.gateway.health;

import com.meshgate.gateway.registry.Endpoint;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Default probe: {@code GET {target}/health}, healthy on HTTP 200.
 */
public class HttpHealthProbe implements HealthProbe {
    private final HttpClient client;

    public HttpHealthProbe(Duration timeout) {
        this.client = HttpClient.create()
            .responseTimeout(timeout);
    }

    @Override
    public Mono<Boolean> probe(Endpoint endpoint) {
        if (endpoint.getTarget() == null) {
            return Mono.just(true);
        }
        return client.get()
            .uri(stripTrailingSlash(endpoint.getTarget()) + "/health")
            .responseSingle((response, body) -> body.then(Mono.just(response.status().code() == 200)));
    }

    private static String stripTrailingSlash(String target) {
        return target.endsWith("/") ? target.substring(0, target.length() - 1) : target;
    }
}
