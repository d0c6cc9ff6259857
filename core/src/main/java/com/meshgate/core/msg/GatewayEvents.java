package com.meshgate.core.msg;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.meshgate.core.model.EndpointStatus;
import lombok.Value;

/**
 * Event variants exchanged between the circuit breaker, the health monitor and observers.
 */
public final class GatewayEvents {
    private GatewayEvents() {
    }

    /**
     * Breaker tripped; calls are rejected until the reset timeout elapses.
     */
    @Value
    public static class CircuitOpened implements GatewayEvent {
        @JsonProperty("serviceName")
        String serviceName;

        /**
         * Failure percentage over the rolling window at the moment of tripping.
         */
        @JsonProperty("errorPercentage")
        double errorPercentage;

        @JsonProperty("ts")
        long ts;
    }

    /**
     * Reset timeout elapsed; the next call is admitted as a probe.
     */
    @Value
    public static class CircuitHalfOpened implements GatewayEvent {
        @JsonProperty("serviceName")
        String serviceName;

        @JsonProperty("ts")
        long ts;
    }

    /**
     * Probe succeeded or an operator reset the breaker.
     */
    @Value
    public static class CircuitClosed implements GatewayEvent {
        @JsonProperty("serviceName")
        String serviceName;

        @JsonProperty("manual")
        boolean manual;

        @JsonProperty("ts")
        long ts;
    }

    /**
     * An endpoint changed health status.
     */
    @Value
    public static class EndpointMarked implements GatewayEvent {
        @JsonProperty("serviceName")
        String serviceName;

        @JsonProperty("endpointId")
        String endpointId;

        @JsonProperty("previousStatus")
        EndpointStatus previousStatus;

        @JsonProperty("status")
        EndpointStatus status;

        @JsonProperty("ts")
        long ts;

        public boolean isHealthy() {
            return status.isRoutable();
        }
    }

    /**
     * The derived "active" flag of a service flipped.
     */
    @Value
    public static class ServiceStatusChanged implements GatewayEvent {
        @JsonProperty("serviceName")
        String serviceName;

        @JsonProperty("active")
        boolean active;

        @JsonProperty("ts")
        long ts;
    }

    @Value
    public static class ServiceRegistered implements GatewayEvent {
        @JsonProperty("serviceName")
        String serviceName;

        @JsonProperty("version")
        String version;

        @JsonProperty("endpoints")
        int endpoints;

        @JsonProperty("ts")
        long ts;
    }

    @Value
    public static class ServiceUnregistered implements GatewayEvent {
        @JsonProperty("serviceName")
        String serviceName;

        @JsonProperty("ts")
        long ts;
    }
}
