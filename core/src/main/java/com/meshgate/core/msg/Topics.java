package com.meshgate.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Broadcast topic for {@link GatewayEvent}s, keyed by service name.
     * Published by every gateway instance; consumption is optional.
     */
    public static final String GATEWAY_EVENTS = "gateway.events";
}
