package com.meshgate.core.metrics;

/**
 * Micrometer metric names used across the gateway.
 * <p>
 * <b>Naming convention:</b> {@code gateway.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Timer: end-to-end routed request latency.
     * <p>
     * Tags: service, status
     * </p>
     */
    public static final String REQUEST_LATENCY = "gateway.request.latency";

    /**
     * Counter: failed routed requests.
     * <p>
     * Tags: service, reason (exception simple name)
     * </p>
     */
    public static final String REQUEST_ERRORS_TOTAL = "gateway.request.errors.total";

    /**
     * Counter: GET requests answered from the response cache.
     * <p>
     * Tags: service
     * </p>
     */
    public static final String CACHE_HITS_TOTAL = "gateway.cache.hits.total";

    /**
     * Counter: dispatches to an arbitrary endpoint because no healthy endpoint was left.
     * <p>
     * Tags: service
     * </p>
     */
    public static final String DEGRADED_DISPATCH_TOTAL = "gateway.degraded.dispatch.total";

    /**
     * Counter: retry attempts after a failed dispatch.
     * <p>
     * Tags: service
     * </p>
     */
    public static final String RETRIES_TOTAL = "gateway.retries.total";

    /**
     * Counter: circuit breaker transitions.
     * <p>
     * Tags: service, state (open/half_open/closed)
     * </p>
     */
    public static final String BREAKER_TRANSITIONS_TOTAL = "gateway.breaker.transitions.total";

    /**
     * Gauge: number of registered services.
     * <p>
     * Tags: (none)
     * </p>
     */
    public static final String REGISTERED_SERVICES = "gateway.registry.services";

    /**
     * Gauge: routable endpoints of a service.
     * <p>
     * Tags: service
     * </p>
     */
    public static final String HEALTHY_ENDPOINTS = "gateway.health.endpoints.healthy";
}
