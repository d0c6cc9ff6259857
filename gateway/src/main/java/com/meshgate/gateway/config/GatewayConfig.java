package com.meshgate.gateway.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Process-wide gateway configuration, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class GatewayConfig {

    @Builder.Default
    String nodeId = "gateway-1";
    @Builder.Default
    int httpPort = 8080;

    // Optional collaborators; null disables them
    String redisUrl;          // null: in-process response cache
    String kafkaBootstrap;    // null: no event broadcast
    String servicesFile;      // JSON service definitions registered at start

    // Health monitoring
    @Builder.Default
    Duration healthCheckInterval = Duration.ofSeconds(30);
    @Builder.Default
    Duration recentCheckWindow = Duration.ofSeconds(10);   // skip endpoints checked this recently
    @Builder.Default
    Duration autoRecoveryInterval = Duration.ofSeconds(60);
    @Builder.Default
    boolean autoRecoveryEnabled = true;
    @Builder.Default
    int failureThreshold = 3;
    @Builder.Default
    Duration probeTimeout = Duration.ofSeconds(5);

    // Routing
    @Builder.Default
    Duration routeCacheTtl = Duration.ofSeconds(60);
    @Builder.Default
    boolean degradedModeEnabled = true;

    public static GatewayConfig fromEnv() {
        return GatewayConfig.builder()
            .nodeId(getEnv("NODE_ID", "gateway-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
            .redisUrl(getEnv("REDIS_URL", null))
            .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", null))
            .servicesFile(getEnv("GATEWAY_SERVICES_FILE", null))
            .healthCheckInterval(Duration.ofSeconds(Integer.parseInt(getEnv("HEALTH_CHECK_INTERVAL_SEC", "30"))))
            .recentCheckWindow(Duration.ofSeconds(Integer.parseInt(getEnv("RECENT_CHECK_WINDOW_SEC", "10"))))
            .autoRecoveryInterval(Duration.ofSeconds(Integer.parseInt(getEnv("AUTO_RECOVERY_INTERVAL_SEC", "60"))))
            .autoRecoveryEnabled(Boolean.parseBoolean(getEnv("AUTO_RECOVERY_ENABLED", "true")))
            .failureThreshold(Integer.parseInt(getEnv("FAILURE_THRESHOLD", "3")))
            .probeTimeout(Duration.ofMillis(Long.parseLong(getEnv("PROBE_TIMEOUT_MS", "5000"))))
            .routeCacheTtl(Duration.ofSeconds(Integer.parseInt(getEnv("ROUTE_CACHE_TTL_SEC", "60"))))
            .degradedModeEnabled(Boolean.parseBoolean(getEnv("DEGRADED_MODE_ENABLED", "true")))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null && !value.isBlank() ? value : defaultValue;
    }
}
