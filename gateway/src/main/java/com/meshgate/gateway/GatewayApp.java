package com.meshgate.gateway;

import com.meshgate.gateway.cache.IResponseCache;
import com.meshgate.gateway.cache.InMemoryResponseCache;
import com.meshgate.gateway.cache.RedisResponseCache;
import com.meshgate.gateway.config.GatewayConfig;
import com.meshgate.gateway.config.ServiceConfig;
import com.meshgate.gateway.config.ServiceDefinitionLoader;
import com.meshgate.gateway.health.HttpHealthProbe;
import com.meshgate.gateway.http.HttpServer;
import com.meshgate.gateway.kafka.KafkaEventPublisher;
import com.meshgate.gateway.metrics.PrometheusMetricsExporter;
import com.meshgate.gateway.router.HttpEndpointDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.DisposableServer;

import java.nio.file.Path;

public class GatewayApp {
    private static final Logger log = LoggerFactory.getLogger(GatewayApp.class);

    public static void main(String[] args) {
        GatewayConfig config = GatewayConfig.fromEnv();

        log.info("Starting Gateway {}", config.getNodeId());
        log.info("  Redis: {}", config.getRedisUrl() != null ? config.getRedisUrl() : "disabled (in-memory cache)");
        log.info("  Kafka: {}", config.getKafkaBootstrap() != null ? config.getKafkaBootstrap() : "disabled");

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());

        IResponseCache cache = config.getRedisUrl() != null
            ? new RedisResponseCache(config.getRedisUrl())
            : new InMemoryResponseCache();

        Gateway gateway = new Gateway(
            config,
            cache,
            new HttpEndpointDispatcher(),
            new HttpHealthProbe(config.getProbeTimeout()),
            metricsExporter.getRegistry()
        );

        KafkaEventPublisher eventPublisher = null;
        if (config.getKafkaBootstrap() != null) {
            eventPublisher = new KafkaEventPublisher(config);
            gateway.addEventListener(eventPublisher);
        }

        if (config.getServicesFile() != null) {
            for (ServiceConfig service : ServiceDefinitionLoader.load(Path.of(config.getServicesFile()))) {
                gateway.registerService(service);
            }
        }

        gateway.start();

        HttpServer httpServer = new HttpServer(config, gateway, metricsExporter);
        DisposableServer disposableServer = httpServer.start();

        log.info("Gateway is ready");

        handleShutDown(gateway, httpServer, cache, eventPublisher);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(
        Gateway gateway,
        HttpServer httpServer,
        IResponseCache cache,
        KafkaEventPublisher eventPublisher
    ) {
        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            httpServer.stop();

            gateway.stop();

            if (eventPublisher != null) {
                eventPublisher.close();
            }

            cache.close();

            log.info("Shutdown complete");
        }));
    }
}
