package com.meshgate.gateway.kafka;

import com.meshgate.core.msg.GatewayEvent;
import reactor.core.publisher.Mono;

/**
 * Interface for broadcasting gateway events to other instances (Dependency Inversion Principle).
 */
public interface IEventPublisher {
    Mono<Void> publish(GatewayEvent event);

    void close();
}
