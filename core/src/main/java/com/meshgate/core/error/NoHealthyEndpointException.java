package com.meshgate.core.error;

/**
 * The healthy endpoint set is empty and the degraded-mode attempt is unavailable or already failed.
 */
public class NoHealthyEndpointException extends GatewayException {

    public NoHealthyEndpointException(String serviceName) {
        super(serviceName, "No healthy endpoints available for " + serviceName);
    }

    public NoHealthyEndpointException(String serviceName, Throwable cause) {
        super(serviceName, "No healthy endpoints available for " + serviceName, cause);
    }

    @Override
    public int getStatusCode() {
        return 503;
    }

    @Override
    public String getErrorLabel() {
        return "Service Unavailable";
    }
}
