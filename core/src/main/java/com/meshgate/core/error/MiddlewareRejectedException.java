package com.meshgate.core.error;

/**
 * A pre-request hook failed; the request was never dispatched.
 */
public class MiddlewareRejectedException extends GatewayException {

    public MiddlewareRejectedException(String serviceName, Throwable cause) {
        super(serviceName, "Middleware rejected request for " + serviceName + ": " + cause.getMessage(), cause);
    }

    @Override
    public int getStatusCode() {
        return 502;
    }

    @Override
    public String getErrorLabel() {
        return "Bad Gateway";
    }
}
