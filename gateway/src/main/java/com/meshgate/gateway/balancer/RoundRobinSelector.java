package com.meshgate.gateway.balancer;

import com.meshgate.gateway.registry.Endpoint;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rotates through the candidates with a per-service cursor: picks {@code candidates[(cursor + 1) % n]}
 * and advances the cursor on every call.
 */
public class RoundRobinSelector implements IEndpointSelector {
    private final Map<String, AtomicLong> cursors = new ConcurrentHashMap<>();

    @Override
    public Endpoint select(String serviceName, List<Endpoint> candidates) {
        long cursor = cursors.computeIfAbsent(serviceName, name -> new AtomicLong()).incrementAndGet();
        return candidates.get((int) Math.floorMod(cursor, (long) candidates.size()));
    }

    @Override
    public void forget(String serviceName) {
        cursors.remove(serviceName);
    }
}
