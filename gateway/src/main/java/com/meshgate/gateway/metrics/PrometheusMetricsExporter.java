package com.meshgate.gateway.metrics;

import com.meshgate.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Exposes gateway and Reactor Netty meters in Prometheus text format.
 * <p>
 * Meters are registered on Reactor Netty's global composite registry so the server and client
 * instrumentation lands in the same scrape as the gateway's own meters.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.registry = Metrics.REGISTRY;

        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        }

        registry.config().commonTags(MetricsTags.NODE_ID, nodeId);
        log.info("Prometheus exporter attached to the global registry (node_id={})", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
