package com.meshgate.core.error;

/**
 * The backend answered with a failure status, or the dispatch itself failed (connection refused, reset, ...).
 */
public class UpstreamException extends GatewayException {
    private final String endpointId;
    private final int upstreamStatus;

    public UpstreamException(String serviceName, String endpointId, int upstreamStatus) {
        super(serviceName, "Service " + serviceName + " returned " + upstreamStatus
            + (endpointId != null ? " from " + endpointId : ""));
        this.endpointId = endpointId;
        this.upstreamStatus = upstreamStatus;
    }

    public UpstreamException(String serviceName, String endpointId, Throwable cause) {
        super(serviceName, "Request to " + serviceName
            + (endpointId != null ? " (" + endpointId + ")" : "")
            + " failed: " + cause.getMessage(), cause);
        this.endpointId = endpointId;
        this.upstreamStatus = 0;
    }

    public String getEndpointId() {
        return endpointId;
    }

    /**
     * Status returned by the backend, or 0 when no response was received.
     */
    public int getUpstreamStatus() {
        return upstreamStatus;
    }

    @Override
    public int getStatusCode() {
        return 502;
    }

    @Override
    public String getErrorLabel() {
        return "Bad Gateway";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
