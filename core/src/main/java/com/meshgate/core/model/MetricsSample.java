package com.meshgate.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Latency and error accounting for one service.
 */
@Value
@Builder(toBuilder = true)
public class MetricsSample {
    long requestCount;
    long errorCount;
    long cacheHits;

    /**
     * Exact running mean of all recorded latencies, in milliseconds.
     */
    double avgResponseTime;

    /**
     * 95th percentile over the last 100 latencies; stays 0 until more than 10 samples exist.
     */
    double p95ResponseTime;

    /**
     * {@code (requestCount + 1 - errorCount) / (requestCount + 1) * 100}.
     */
    double availabilityPercentage;

    public static MetricsSample empty() {
        return MetricsSample.builder().availabilityPercentage(100.0).build();
    }
}
