package com.meshgate.core.error;

import java.time.Duration;

public class UpstreamTimeoutException extends GatewayException {
    private final String endpointId;

    public UpstreamTimeoutException(String serviceName, String endpointId, Duration timeout) {
        super(serviceName, "Request to " + serviceName
            + (endpointId != null ? " (" + endpointId + ")" : "")
            + " timed out after " + timeout.toMillis() + "ms");
        this.endpointId = endpointId;
    }

    public String getEndpointId() {
        return endpointId;
    }

    @Override
    public int getStatusCode() {
        return 504;
    }

    @Override
    public String getErrorLabel() {
        return "Gateway Timeout";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
