package com.meshgate.gateway.registry;

import com.meshgate.core.model.EndpointSnapshot;
import com.meshgate.core.model.EndpointStatus;
import com.meshgate.gateway.config.EndpointConfig;
import com.meshgate.gateway.health.HealthProbe;
import com.meshgate.gateway.router.EndpointHandler;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runtime state of one endpoint of a registered service.
 * <p>
 * Counters are atomic. Status and failure transitions belong to the health monitor, which serializes
 * them per endpoint by locking the endpoint instance.
 * </p>
 */
@Getter
public class Endpoint {
    private final String serviceName;
    private final String id;
    private final String path;
    private final String target;
    private final EndpointHandler handler;
    private final HealthProbe probe;

    private volatile int weight;
    private volatile EndpointStatus status = EndpointStatus.REGISTERED;
    private volatile long lastCheck;

    @Getter(AccessLevel.NONE)
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    @Getter(AccessLevel.NONE)
    private final AtomicInteger activeConnections = new AtomicInteger();

    public Endpoint(String serviceName, EndpointConfig config) {
        if (config.getWeight() < 0) {
            throw new IllegalArgumentException("Endpoint weight must be >= 0: " + config.resolveId());
        }
        this.serviceName = serviceName;
        this.id = config.resolveId();
        this.path = config.getPath();
        this.target = config.getTarget();
        this.handler = config.getHandler();
        this.probe = config.getProbe();
        this.weight = config.getWeight();
    }

    public boolean isHealthy() {
        return status.isRoutable();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public void setWeight(int weight) {
        if (weight < 0) {
            throw new IllegalArgumentException("Endpoint weight must be >= 0: " + id);
        }
        this.weight = weight;
    }

    public void acquireConnection() {
        activeConnections.incrementAndGet();
    }

    public void releaseConnection() {
        activeConnections.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    public void setStatus(EndpointStatus status) {
        this.status = status;
    }

    public void setLastCheck(long lastCheck) {
        this.lastCheck = lastCheck;
    }

    public int incrementFailures() {
        return consecutiveFailures.incrementAndGet();
    }

    public void resetFailures() {
        consecutiveFailures.set(0);
    }

    public EndpointSnapshot snapshot() {
        return EndpointSnapshot.builder()
            .id(id)
            .path(path)
            .target(target)
            .weight(weight)
            .status(status)
            .healthy(isHealthy())
            .failures(consecutiveFailures.get())
            .lastCheck(lastCheck)
            .activeConnections(activeConnections.get())
            .build();
    }

    @Override
    public String toString() {
        return serviceName + "/" + id + " [" + status + "]";
    }
}
