package com.meshgate.core.msg;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * State-change notification emitted by the routing engine.
 * <p>
 * The engine's variants live in {@link GatewayEvents}; only those are registered for JSON. Events are
 * delivered in-process to listeners and optionally broadcast to other gateway instances as JSON.
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = GatewayEvents.CircuitOpened.class, name = "circuit-opened"),
    @JsonSubTypes.Type(value = GatewayEvents.CircuitHalfOpened.class, name = "circuit-half-opened"),
    @JsonSubTypes.Type(value = GatewayEvents.CircuitClosed.class, name = "circuit-closed"),
    @JsonSubTypes.Type(value = GatewayEvents.EndpointMarked.class, name = "endpoint-marked"),
    @JsonSubTypes.Type(value = GatewayEvents.ServiceStatusChanged.class, name = "service-status"),
    @JsonSubTypes.Type(value = GatewayEvents.ServiceRegistered.class, name = "service-registered"),
    @JsonSubTypes.Type(value = GatewayEvents.ServiceUnregistered.class, name = "service-unregistered")
})
public interface GatewayEvent {

    /**
     * Name of the service the event concerns; also the broadcast partition key.
     */
    String getServiceName();

    /**
     * Epoch millis when the transition happened.
     */
    long getTs();
}
