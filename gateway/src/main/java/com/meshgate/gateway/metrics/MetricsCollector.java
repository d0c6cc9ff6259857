package com.meshgate.gateway.metrics;

import com.google.common.collect.EvictingQueue;
import com.meshgate.core.model.MetricsSample;
import com.meshgate.gateway.registry.IServiceRegistry;
import com.meshgate.gateway.registry.Service;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-service latency and availability accounting.
 * <p>
 * Keeps an exact running mean over every recorded request and a ring buffer of the last
 * {@value #WINDOW_SIZE} latencies for the p95. The p95 is only computed once more than
 * {@value #MIN_SAMPLES_FOR_P95} samples are buffered.
 * </p>
 * <p>
 * Samples are tied to one registration: outcomes reported for a service that is no longer registered
 * (or was replaced by a new registration under the same name) are dropped.
 * </p>
 */
public class MetricsCollector {
    static final int WINDOW_SIZE = 100;
    static final int MIN_SAMPLES_FOR_P95 = 10;

    private final Map<String, ServiceSample> samples = new ConcurrentHashMap<>();
    private final IServiceRegistry registry;

    public MetricsCollector(IServiceRegistry registry) {
        this.registry = registry;
    }

    public void recordRequest(Service service, double latencyMs, boolean success) {
        ServiceSample sample = sampleFor(service);
        if (sample != null) {
            sample.record(latencyMs, success);
        }
    }

    public void recordCacheHit(Service service) {
        ServiceSample sample = sampleFor(service);
        if (sample != null) {
            sample.recordCacheHit();
        }
    }

    public MetricsSample snapshot(String serviceName) {
        ServiceSample sample = samples.get(serviceName);
        return sample != null && isRegistered(sample.owner) ? sample.snapshot() : MetricsSample.empty();
    }

    public void remove(String serviceName) {
        samples.remove(serviceName);
    }

    private ServiceSample sampleFor(Service service) {
        ServiceSample sample = samples.compute(service.getName(), (name, existing) -> {
            if (existing != null && existing.owner == service) {
                return existing;
            }
            return isRegistered(service) ? new ServiceSample(service) : existing;
        });
        return sample != null && sample.owner == service ? sample : null;
    }

    private boolean isRegistered(Service service) {
        return registry.find(service.getName()).filter(current -> current == service).isPresent();
    }

    private static final class ServiceSample {
        private final Service owner;
        private final EvictingQueue<Double> recent = EvictingQueue.create(WINDOW_SIZE);
        private long requestCount;
        private long errorCount;
        private long cacheHits;
        private double avgResponseTime;
        private double p95ResponseTime;

        ServiceSample(Service owner) {
            this.owner = owner;
        }

        synchronized void record(double latencyMs, boolean success) {
            requestCount++;
            if (!success) {
                errorCount++;
            }
            avgResponseTime += (latencyMs - avgResponseTime) / requestCount;

            recent.add(latencyMs);
            if (recent.size() > MIN_SAMPLES_FOR_P95) {
                double[] sorted = recent.stream().mapToDouble(Double::doubleValue).toArray();
                Arrays.sort(sorted);
                p95ResponseTime = sorted[(int) Math.floor(0.95 * sorted.length)];
            }
        }

        synchronized void recordCacheHit() {
            cacheHits++;
        }

        synchronized MetricsSample snapshot() {
            return MetricsSample.builder()
                .requestCount(requestCount)
                .errorCount(errorCount)
                .cacheHits(cacheHits)
                .avgResponseTime(avgResponseTime)
                .p95ResponseTime(p95ResponseTime)
                .availabilityPercentage((requestCount + 1 - errorCount) * 100.0 / (requestCount + 1))
                .build();
        }
    }
}
