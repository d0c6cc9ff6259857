package com.meshgate.gateway.router;

import com.meshgate.core.cache.CacheKeys;
import com.meshgate.core.error.GatewayException;
import com.meshgate.core.error.MiddlewareRejectedException;
import com.meshgate.core.error.NoHealthyEndpointException;
import com.meshgate.core.error.ServiceNotFoundException;
import com.meshgate.core.error.UpstreamException;
import com.meshgate.core.error.UpstreamTimeoutException;
import com.meshgate.core.model.GatewayRequest;
import com.meshgate.core.model.GatewayResponse;
import com.meshgate.core.util.JitterBackoff;
import com.meshgate.core.util.JsonUtils;
import com.meshgate.gateway.balancer.ILoadBalancer;
import com.meshgate.gateway.breaker.CircuitBreaker;
import com.meshgate.gateway.breaker.CircuitBreakerRegistry;
import com.meshgate.gateway.cache.IResponseCache;
import com.meshgate.gateway.config.GatewayConfig;
import com.meshgate.gateway.health.HealthMonitor;
import com.meshgate.gateway.metrics.IMetricsSink;
import com.meshgate.gateway.metrics.MetricsCollector;
import com.meshgate.gateway.registry.Endpoint;
import com.meshgate.gateway.registry.IServiceRegistry;
import com.meshgate.gateway.registry.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes one request end to end.
 * <p>
 * <b>Pipeline:</b>
 * <ol>
 *   <li>Resolve the service: explicit name on the request, otherwise the longest matching route</li>
 *   <li>GET only: answer from the response cache on a hit</li>
 *   <li>Under the service's circuit breaker: run the middleware chain, then up to
 *       {@code max(1, maxRetries)} dispatch attempts with jittered exponential backoff between them</li>
 *   <li>Write successful GET responses through to the cache</li>
 *   <li>Record latency and outcome</li>
 * </ol>
 * </p>
 * <p>
 * When a service has no routable endpoint, one attempt per routed call may go to an arbitrary endpoint
 * (degraded mode). If that attempt fails, or degraded mode is off or already used, the call fails with
 * {@link NoHealthyEndpointException}.
 * </p>
 */
public class RequestRouter {
    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    public static final String REQUEST_ID_HEADER = "x-gateway-request-id";
    public static final String TIMESTAMP_HEADER = "x-gateway-timestamp";

    private final GatewayConfig config;
    private final IServiceRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final ILoadBalancer loadBalancer;
    private final HealthMonitor healthMonitor;
    private final MetricsCollector metricsCollector;
    private final IMetricsSink metricsSink;
    private final IResponseCache cache;
    private final IEndpointDispatcher dispatcher;
    private final Clock clock;

    public RequestRouter(
        GatewayConfig config,
        IServiceRegistry registry,
        CircuitBreakerRegistry breakers,
        ILoadBalancer loadBalancer,
        HealthMonitor healthMonitor,
        MetricsCollector metricsCollector,
        IMetricsSink metricsSink,
        IResponseCache cache,
        IEndpointDispatcher dispatcher,
        Clock clock
    ) {
        this.config = config;
        this.registry = registry;
        this.breakers = breakers;
        this.loadBalancer = loadBalancer;
        this.healthMonitor = healthMonitor;
        this.metricsCollector = metricsCollector;
        this.metricsSink = metricsSink;
        this.cache = cache;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    public Mono<GatewayResponse> route(GatewayRequest request) {
        return Mono.defer(() -> {
            Service service = resolve(request);
            CircuitBreaker breaker = breakers.forService(service);
            GatewayRequest tracked = track(request);

            if (!tracked.isGet()) {
                return execute(service, breaker, tracked, null);
            }

            String cacheKey = CacheKeys.response(service.getName(), tracked.getMethod(), tracked.getUri());
            return lookupCache(cacheKey)
                .doOnNext(hit -> {
                    metricsCollector.recordCacheHit(service);
                    metricsSink.trackCacheHit(service.getName());
                    log.debug("Cache hit for {} {}", service.getName(), tracked.getUri());
                })
                .switchIfEmpty(Mono.defer(() -> execute(service, breaker, tracked, cacheKey)));
        });
    }

    private Service resolve(GatewayRequest request) {
        if (request.getServiceName() != null) {
            return registry.lookup(request.getServiceName());
        }
        String serviceName = registry.resolveByPath(request.getPath());
        if (serviceName == null) {
            throw ServiceNotFoundException.forPath(request.getPath());
        }
        return registry.lookup(serviceName);
    }

    private GatewayRequest track(GatewayRequest request) {
        return request
            .withAddedHeader(REQUEST_ID_HEADER, UUID.randomUUID().toString().replace("-", "").substring(0, 16))
            .withAddedHeader(TIMESTAMP_HEADER, String.valueOf(clock.millis()));
    }

    private Mono<GatewayResponse> execute(
        Service service,
        CircuitBreaker breaker,
        GatewayRequest request,
        String cacheKey
    ) {
        long startNanos = System.nanoTime();
        String name = service.getName();

        return breaker
            .execute(() -> applyMiddleware(service, request)
                .flatMap(prepared -> dispatchWithRetry(service, prepared)))
            .flatMap(response -> cacheKey != null && response.isSuccessful()
                ? storeInCache(service, cacheKey, response).thenReturn(response)
                : Mono.just(response))
            .doOnSuccess(response -> {
                double latencyMs = elapsedMs(startNanos);
                metricsCollector.recordRequest(service, latencyMs, true);
                metricsSink.trackRequest(name, latencyMs, response.getStatus(), request.getPath());
            })
            .doOnError(error -> {
                double latencyMs = elapsedMs(startNanos);
                metricsCollector.recordRequest(service, latencyMs, false);
                metricsSink.trackError(name, error, request.getPath());
                log.warn("Routing {} {} to {} failed: {}", request.getMethod(), request.getUri(), name, error.getMessage());
            });
    }

    private Mono<GatewayRequest> applyMiddleware(Service service, GatewayRequest request) {
        Mono<GatewayRequest> chain = Mono.just(request);
        for (RequestMiddleware middleware : service.getMiddleware()) {
            chain = chain.flatMap(current -> Mono.defer(() -> middleware.apply(current)).defaultIfEmpty(current));
        }
        return chain.onErrorMap(
            error -> !(error instanceof GatewayException),
            error -> new MiddlewareRejectedException(service.getName(), error));
    }

    private Mono<GatewayResponse> dispatchWithRetry(Service service, GatewayRequest request) {
        return attempt(service, request, 1, new AtomicBoolean());
    }

    private Mono<GatewayResponse> attempt(Service service, GatewayRequest request, int attempt, AtomicBoolean degradedUsed) {
        return Mono.defer(() -> dispatchOnce(service, request, degradedUsed))
            .onErrorResume(error -> {
                if (!isRetryable(error) || attempt >= service.getAttempts()) {
                    return Mono.error(error);
                }
                Duration delay = JitterBackoff.next(
                    attempt, service.getBackoffBase(), service.getBackoffCap(), service.getBackoffJitter());
                log.debug("Attempt {}/{} for {} failed ({}), retrying in {}ms",
                    attempt, service.getAttempts(), service.getName(), error.getMessage(), delay.toMillis());
                metricsSink.trackRetry(service.getName());

                return Mono.delay(delay).then(attempt(service, request, attempt + 1, degradedUsed));
            });
    }

    private Mono<GatewayResponse> dispatchOnce(Service service, GatewayRequest request, AtomicBoolean degradedUsed) {
        String name = service.getName();
        Endpoint endpoint = loadBalancer.select(service);
        boolean degraded = false;

        if (endpoint == null) {
            if (!config.isDegradedModeEnabled() || !degradedUsed.compareAndSet(false, true)) {
                return Mono.error(new NoHealthyEndpointException(name));
            }
            endpoint = loadBalancer.selectAny(service);
            if (endpoint == null) {
                return Mono.error(new NoHealthyEndpointException(name));
            }
            degraded = true;
            log.warn("No healthy endpoints for {}, trying {} in degraded mode", name, endpoint.getId());
            metricsSink.trackDegradedDispatch(name);
        }

        Endpoint target = endpoint;
        boolean degradedAttempt = degraded;
        Duration timeout = service.getTimeout();

        Mono<GatewayResponse> result = Mono.defer(() -> {
                target.acquireConnection();
                // Released before the terminal signal travels downstream
                AtomicBoolean released = new AtomicBoolean();
                Runnable release = () -> {
                    if (released.compareAndSet(false, true)) {
                        target.releaseConnection();
                    }
                };
                return Mono.defer(() -> invoke(target, request))
                    .switchIfEmpty(Mono.error(() -> new UpstreamException(
                        name, target.getId(), new IllegalStateException("empty response"))))
                    .timeout(timeout, Mono.error(() -> new UpstreamTimeoutException(name, target.getId(), timeout)))
                    .flatMap(response -> response.isServerError()
                        ? Mono.error(new UpstreamException(name, target.getId(), response.getStatus()))
                        : Mono.just(response))
                    .onErrorMap(error -> !(error instanceof GatewayException),
                        error -> new UpstreamException(name, target.getId(), error))
                    .doOnSuccess(response -> healthMonitor.markSuccess(service, target))
                    .doOnError(error -> healthMonitor.markFailure(service, target))
                    .doOnTerminate(release)
                    .doOnCancel(release);
            });

        if (degradedAttempt) {
            return result.onErrorMap(error -> new NoHealthyEndpointException(name, error));
        }
        return result;
    }

    private Mono<GatewayResponse> invoke(Endpoint endpoint, GatewayRequest request) {
        if (endpoint.getHandler() != null) {
            return endpoint.getHandler().handle(request);
        }
        return dispatcher.dispatch(endpoint, request);
    }

    private Mono<GatewayResponse> lookupCache(String key) {
        return cache.get(key)
            .map(json -> JsonUtils.readValue(json, GatewayResponse.class))
            .onErrorResume(error -> {
                log.warn("Cache read failed for {}, treating as miss: {}", key, error.toString());
                return Mono.empty();
            });
    }

    private Mono<Void> storeInCache(Service service, String key, GatewayResponse response) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(response))
            .flatMap(json -> cache.set(key, json, service.getCacheTtl()))
            .onErrorResume(error -> {
                log.warn("Cache write failed for {}: {}", key, error.toString());
                return Mono.empty();
            });
    }

    private static boolean isRetryable(Throwable error) {
        return error instanceof GatewayException gatewayError && gatewayError.isRetryable();
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
