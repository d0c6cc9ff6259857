package com.meshgate.gateway.event;

import com.meshgate.core.msg.GatewayEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process fan-out of {@link GatewayEvent}s.
 * <p>
 * Delivery is synchronous on the publishing thread, in subscription order. A failing listener is
 * logged and does not prevent delivery to the others.
 * </p>
 */
public class GatewayEventBus {
    private static final Logger log = LoggerFactory.getLogger(GatewayEventBus.class);

    private final List<GatewayEventListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(GatewayEventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(GatewayEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(GatewayEvent event) {
        log.debug("Publishing {} for service {}", event.getClass().getSimpleName(), event.getServiceName());
        for (GatewayEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed on {} for service {}",
                    event.getClass().getSimpleName(), event.getServiceName(), e);
            }
        }
    }
}
