package com.meshgate.core.model;

/**
 * Endpoint selection algorithm used by a service.
 */
public enum LoadBalancingStrategy {
    /**
     * Per-service cursor, advanced on every selection.
     */
    ROUND_ROBIN,

    /**
     * Fewest in-flight requests; ties go to the first endpoint in list order.
     */
    LEAST_CONNECTIONS,

    /**
     * Weighted random draw over endpoints with a positive weight.
     */
    WEIGHTED,

    /**
     * Uniform random pick.
     */
    RANDOM;

    /**
     * Parses the dashed lower-case names used in service definition files
     * ({@code round-robin}, {@code least-connections}, ...). Unknown values fall back to round-robin.
     */
    public static LoadBalancingStrategy fromName(String name) {
        if (name == null || name.isBlank()) {
            return ROUND_ROBIN;
        }
        String normalized = name.trim().replace('-', '_').toUpperCase();
        for (LoadBalancingStrategy strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return strategy;
            }
        }
        return ROUND_ROBIN;
    }
}
