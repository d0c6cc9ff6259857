package com.meshgate.core.model;

/**
 * Health state of a single endpoint.
 */
public enum EndpointStatus {
    /**
     * Freshly registered, not probed yet. Routable.
     */
    REGISTERED,

    /**
     * Last probe or live request succeeded. Routable.
     */
    HEALTHY,

    /**
     * Failure threshold reached because the backend reported itself unhealthy or requests failed.
     */
    UNHEALTHY,

    /**
     * Failure threshold reached and the last failure came from the health check itself raising.
     */
    ERROR;

    public boolean isRoutable() {
        return this == REGISTERED || this == HEALTHY;
    }
}
