package com.meshgate.core.error;

/**
 * Raised by the circuit breaker when it rejects a call without dispatching it.
 */
public class CircuitOpenException extends GatewayException {

    public CircuitOpenException(String serviceName) {
        super(serviceName, "Circuit breaker is open for " + serviceName);
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
