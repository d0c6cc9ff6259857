package com.meshgate.gateway.router;

import com.meshgate.core.model.GatewayRequest;
import com.meshgate.core.model.GatewayResponse;
import com.meshgate.gateway.registry.Endpoint;
import io.netty.handler.codec.http.HttpMethod;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Forwards requests to {@code {target}{path}?{query}} with Reactor Netty.
 */
public class HttpEndpointDispatcher implements IEndpointDispatcher {
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
        "connection", "keep-alive", "transfer-encoding", "upgrade", "host", "content-length");

    private final HttpClient client;

    public HttpEndpointDispatcher() {
        this(HttpClient.create());
    }

    public HttpEndpointDispatcher(HttpClient client) {
        this.client = client;
    }

    @Override
    public Mono<GatewayResponse> dispatch(Endpoint endpoint, GatewayRequest request) {
        if (endpoint.getTarget() == null) {
            return Mono.error(new IllegalStateException(
                "Endpoint " + endpoint.getId() + " has neither a target nor a handler"));
        }

        HttpClient.RequestSender sender = client
            .headers(headers -> request.getHeaders().forEach((name, value) -> {
                if (!HOP_BY_HOP_HEADERS.contains(name.toLowerCase())) {
                    headers.set(name, value);
                }
            }))
            .request(HttpMethod.valueOf(request.getMethod().toUpperCase()))
            .uri(stripTrailingSlash(endpoint.getTarget()) + request.getUri());

        String body = request.getBody();
        HttpClient.ResponseReceiver<?> receiver = body == null || body.isEmpty()
            ? sender
            : sender.send(ByteBufFlux.fromString(Mono.just(body)));

        return receiver.responseSingle((response, content) -> content.asString()
                .defaultIfEmpty("")
                .map(text -> {
                    Map<String, String> headers = new LinkedHashMap<>();
                    response.responseHeaders().forEach(entry -> {
                        if (!HOP_BY_HOP_HEADERS.contains(entry.getKey().toLowerCase())) {
                            headers.put(entry.getKey().toLowerCase(), entry.getValue());
                        }
                    });
                    return new GatewayResponse(response.status().code(), headers, text);
                }));
    }

    private static String stripTrailingSlash(String target) {
        return target.endsWith("/") ? target.substring(0, target.length() - 1) : target;
    }
}
