package com.meshgate.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.HashMap;
import java.util.Map;

/**
 * A request entering the gateway.
 */
@Value
@Builder(toBuilder = true)
@With
public class GatewayRequest {
    /**
     * HTTP method, upper case.
     */
    @Builder.Default
    String method = "GET";

    /**
     * Request path including the leading slash; used for service resolution and cache keys.
     */
    String path;

    /**
     * Optional query string without the leading '?'.
     */
    String query;

    /**
     * Explicit target service. When absent the service is resolved from {@link #path}.
     */
    String serviceName;

    @Singular
    Map<String, String> headers;

    String body;

    public boolean isGet() {
        return "GET".equalsIgnoreCase(method);
    }

    /**
     * Path plus query string, as forwarded to a backend.
     */
    public String getUri() {
        return query == null || query.isEmpty() ? path : path + "?" + query;
    }

    public GatewayRequest withAddedHeader(String name, String value) {
        Map<String, String> copy = new HashMap<>(headers);
        copy.put(name, value);
        return withHeaders(copy);
    }
}
