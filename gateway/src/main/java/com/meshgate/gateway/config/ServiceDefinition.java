package com.meshgate.gateway.config;

import com.meshgate.core.model.LoadBalancingStrategy;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of a service in the services file. Absent fields keep the {@link ServiceConfig} defaults.
 */
@Data
@NoArgsConstructor
public class ServiceDefinition {
    private String name;
    private String version;
    private String strategy;
    private Long timeoutMs;
    private Integer maxRetries;
    private Long cacheTtlSec;
    private List<String> routes = new ArrayList<>();
    private List<String> tags = new ArrayList<>();
    private List<EndpointDefinition> endpoints = new ArrayList<>();
    private BreakerDefinition circuitBreaker;

    @Data
    @NoArgsConstructor
    public static class EndpointDefinition {
        private String id;
        private String path;
        private String target;
        private Integer weight;
    }

    @Data
    @NoArgsConstructor
    public static class BreakerDefinition {
        private Long timeoutMs;
        private Integer errorThresholdPercentage;
        private Long resetTimeoutMs;
        private Integer volumeThreshold;
        private Integer timeoutThreshold;

        CircuitBreakerConfig toConfig() {
            CircuitBreakerConfig.CircuitBreakerConfigBuilder builder = CircuitBreakerConfig.builder();
            if (timeoutMs != null) {
                builder.timeout(Duration.ofMillis(timeoutMs));
            }
            if (errorThresholdPercentage != null) {
                builder.errorThresholdPercentage(errorThresholdPercentage);
            }
            if (resetTimeoutMs != null) {
                builder.resetTimeout(Duration.ofMillis(resetTimeoutMs));
            }
            if (volumeThreshold != null) {
                builder.volumeThreshold(volumeThreshold);
            }
            if (timeoutThreshold != null) {
                builder.timeoutThreshold(timeoutThreshold);
            }
            return builder.build();
        }
    }

    public ServiceConfig toServiceConfig() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Service definition without a name");
        }

        ServiceConfig.ServiceConfigBuilder builder = ServiceConfig.builder()
            .name(name)
            .routes(routes)
            .tags(tags);

        if (version != null) {
            builder.version(version);
        }
        if (strategy != null) {
            builder.strategy(LoadBalancingStrategy.fromName(strategy));
        }
        if (timeoutMs != null) {
            builder.timeout(Duration.ofMillis(timeoutMs));
        }
        if (maxRetries != null) {
            builder.maxRetries(maxRetries);
        }
        if (cacheTtlSec != null) {
            builder.cacheTtl(Duration.ofSeconds(cacheTtlSec));
        }
        if (circuitBreaker != null) {
            builder.circuitBreaker(circuitBreaker.toConfig());
        }

        for (EndpointDefinition endpoint : endpoints) {
            EndpointConfig.EndpointConfigBuilder endpointBuilder = EndpointConfig.builder()
                .id(endpoint.getId())
                .path(endpoint.getPath())
                .target(endpoint.getTarget());
            if (endpoint.getWeight() != null) {
                endpointBuilder.weight(endpoint.getWeight());
            }
            builder.endpoint(endpointBuilder.build());
        }

        return builder.build();
    }
}
