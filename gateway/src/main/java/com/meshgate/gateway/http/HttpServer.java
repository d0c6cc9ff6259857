package com.meshgate.gateway.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meshgate.core.error.GatewayException;
import com.meshgate.core.model.GatewayRequest;
import com.meshgate.core.model.GatewayResponse;
import com.meshgate.core.util.JsonUtils;
import com.meshgate.gateway.IGateway;
import com.meshgate.gateway.config.GatewayConfig;
import com.meshgate.gateway.metrics.PrometheusMetricsExporter;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP front end: admin API, Prometheus scrape and the catch-all proxy into the router.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String API_PREFIX = "/api/v1/gateway";

    private final GatewayConfig config;
    private final IGateway gateway;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(GatewayConfig config, IGateway gateway, PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.gateway = gateway;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Starts the HTTP server.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            // Liveness
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            // Prometheus scrape
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter != null ? metricsExporter.scrape() : ""))
            )
            .get(API_PREFIX + "/health", (req, res) ->
                sendJson(res, HttpResponseStatus.OK, Mono.fromCallable(gateway::getHealth))
            )
            .get(API_PREFIX + "/metrics", (req, res) ->
                sendJson(res, HttpResponseStatus.OK, Mono.fromCallable(gateway::getMetrics))
            )
            .get(API_PREFIX + "/services", (req, res) -> {
                QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
                String tag = firstParam(decoder, "tag");
                String active = firstParam(decoder, "active");
                return sendJson(res, HttpResponseStatus.OK, Mono.fromCallable(() ->
                    gateway.discoverServices(tag, active == null ? null : Boolean.parseBoolean(active))));
            })
            .post(API_PREFIX + "/services/{name}/circuit/reset", (req, res) -> {
                String name = req.param("name");
                return sendJson(res, HttpResponseStatus.OK, Mono.fromCallable(() -> {
                    gateway.resetCircuitBreaker(name);
                    return Map.of("service", name, "circuitState", "CLOSED");
                }));
            })
            .put(API_PREFIX + "/services/{name}/weights", (req, res) -> {
                String name = req.param("name");
                return sendJson(res, HttpResponseStatus.OK, req.receive().aggregate().asString()
                    .switchIfEmpty(Mono.error(() -> new IllegalArgumentException("Missing weights body")))
                    .map(json -> JsonUtils.readValue(json, new TypeReference<Map<String, Integer>>() {
                    }))
                    .map(weights -> {
                        gateway.updateEndpointWeights(name, weights);
                        return Map.of("service", name, "weights", weights);
                    }));
            })
            .delete(API_PREFIX + "/services/{name}", (req, res) -> {
                String name = req.param("name");
                return sendJson(res, HttpResponseStatus.OK, Mono.fromCallable(() ->
                    Map.of("service", name, "removed", gateway.unregisterService(name))));
            })
            // Everything else goes through the router
            .route(req -> true, this::proxy);
    }

    private Publisher<Void> proxy(HttpServerRequest req, HttpServerResponse res) {
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        int queryStart = req.uri().indexOf('?');

        Map<String, String> headers = new LinkedHashMap<>();
        req.requestHeaders().forEach(entry -> headers.put(entry.getKey().toLowerCase(), entry.getValue()));

        return req.receive().aggregate().asString()
            .defaultIfEmpty("")
            .map(body -> GatewayRequest.builder()
                .method(req.method().name())
                .path(decoder.path())
                .query(queryStart >= 0 ? req.uri().substring(queryStart + 1) : null)
                .headers(headers)
                .body(body.isEmpty() ? null : body)
                .build())
            .flatMap(gateway::route)
            .flatMap(response -> sendResponse(res, response))
            .onErrorResume(err -> sendError(res, err));
    }

    private Mono<Void> sendResponse(HttpServerResponse res, GatewayResponse response) {
        response.getHeaders().forEach(res::header);
        return res.status(response.getStatus())
            .sendString(Mono.justOrEmpty(response.getBody()))
            .then();
    }

    private Mono<Void> sendJson(HttpServerResponse res, HttpResponseStatus status, Mono<?> payload) {
        return payload
            .map(JsonUtils::writeValueAsString)
            .flatMap(json -> res.status(status)
                .header("Content-Type", "application/json")
                .sendString(Mono.just(json))
                .then())
            .onErrorResume(err -> sendError(res, err));
    }

    private Mono<Void> sendError(HttpServerResponse res, Throwable err) {
        int status;
        String label;
        if (err instanceof GatewayException gatewayError) {
            status = gatewayError.getStatusCode();
            label = gatewayError.getErrorLabel();
        } else if (err instanceof IllegalArgumentException || err instanceof UncheckedIOException) {
            status = 400;
            label = "Bad Request";
        } else {
            log.error("Unhandled error while serving request", err);
            status = 500;
            label = "Internal Server Error";
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", label);
        body.put("message", err.getMessage());

        return res.status(status)
            .header("Content-Type", "application/json")
            .sendString(Mono.just(JsonUtils.writeValueAsString(body)))
            .then();
    }

    private static String firstParam(QueryStringDecoder decoder, String name) {
        return decoder.parameters().containsKey(name) ? decoder.parameters().get(name).get(0) : null;
    }
}
