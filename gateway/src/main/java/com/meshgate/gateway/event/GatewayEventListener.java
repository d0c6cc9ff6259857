package com.meshgate.gateway.event;

import com.meshgate.core.msg.GatewayEvent;

@FunctionalInterface
public interface GatewayEventListener {
    void onEvent(GatewayEvent event);
}
