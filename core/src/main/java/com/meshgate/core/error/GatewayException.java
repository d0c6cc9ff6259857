package com.meshgate.core.error;

/**
 * Base of the gateway error taxonomy.
 * <p>
 * Each subtype carries the HTTP status the caller sees and whether the request router may retry it.
 * </p>
 */
public abstract class GatewayException extends RuntimeException {
    private final String serviceName;

    protected GatewayException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
    }

    protected GatewayException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }

    /**
     * HTTP status reported to the caller.
     */
    public abstract int getStatusCode();

    /**
     * Short error label used in JSON error bodies ("Service Unavailable", "Gateway Timeout", ...).
     */
    public abstract String getErrorLabel();

    public boolean isRetryable() {
        return false;
    }
}
