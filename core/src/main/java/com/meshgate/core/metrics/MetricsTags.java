package com.meshgate.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Consistent tagging enables aggregation and filtering in Prometheus/Grafana.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for gateway instance identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for the routed service name.
     */
    public static final String SERVICE = "service";

    /**
     * Tag key for the HTTP status returned to the caller.
     */
    public static final String STATUS = "status";

    /**
     * Tag key for failure reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for circuit breaker state.
     */
    public static final String STATE = "state";
}
