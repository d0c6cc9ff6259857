package com.meshgate.gateway.metrics;

import com.meshgate.core.model.CircuitState;

/**
 * Destination for per-request telemetry (Dependency Inversion Principle).
 */
public interface IMetricsSink {
    void trackRequest(String serviceName, double latencyMs, int statusCode, String path);

    void trackError(String serviceName, Throwable error, String path);

    void trackCacheHit(String serviceName);

    void trackRetry(String serviceName);

    void trackDegradedDispatch(String serviceName);

    void trackBreakerTransition(String serviceName, CircuitState state);
}
