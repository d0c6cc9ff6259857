package com.meshgate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * A backend response returned to the caller; also the value stored in the response cache.
 */
@Value
@Builder(toBuilder = true)
@With
public class GatewayResponse {
    @JsonProperty("status")
    int status;

    @JsonProperty("headers")
    Map<String, String> headers;

    @JsonProperty("body")
    String body;

    @JsonCreator
    public GatewayResponse(
        @JsonProperty("status") int status,
        @JsonProperty("headers") Map<String, String> headers,
        @JsonProperty("body") String body
    ) {
        this.status = status;
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.body = body;
    }

    public static GatewayResponse ok(String body) {
        return new GatewayResponse(200, Map.of(), body);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    @JsonIgnore
    public boolean isServerError() {
        return status >= 500;
    }
}
