package com.meshgate.gateway.breaker;

import com.meshgate.core.error.CircuitOpenException;
import com.meshgate.core.error.UpstreamTimeoutException;
import com.meshgate.core.model.BreakerStats;
import com.meshgate.core.model.CircuitState;
import com.meshgate.core.msg.GatewayEvent;
import com.meshgate.core.msg.GatewayEvents;
import com.meshgate.gateway.config.CircuitBreakerConfig;
import com.meshgate.gateway.event.GatewayEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Per-service circuit breaker.
 * <p>
 * <b>State machine:</b>
 * <ul>
 *   <li>CLOSED → OPEN: at least {@code volumeThreshold} outcomes in the rolling window and an error
 *       percentage ≥ {@code errorThresholdPercentage}, or {@code timeoutThreshold} consecutive timeouts</li>
 *   <li>OPEN → HALF_OPEN: {@code resetTimeout} elapsed, checked when a call asks for admission</li>
 *   <li>HALF_OPEN → CLOSED: the single probe call succeeded (window cleared)</li>
 *   <li>HALF_OPEN → OPEN: the probe failed</li>
 * </ul>
 * </p>
 * <p>
 * Rejected calls never subscribe to the supplied publisher. All state lives behind this instance's
 * monitor; transition events are published after the monitor is released.
 * </p>
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String serviceName;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final GatewayEventBus eventBus;
    private final RollingWindow window;

    private CircuitState state = CircuitState.CLOSED;
    private long openedAt;
    private int consecutiveTimeouts;
    private boolean probeInFlight;

    public CircuitBreaker(String serviceName, CircuitBreakerConfig config, Clock clock, GatewayEventBus eventBus) {
        this.serviceName = serviceName;
        this.config = config;
        this.clock = clock;
        this.eventBus = eventBus;
        this.window = new RollingWindow(config.getRollingWindow(), config.getRollingBuckets());
    }

    /**
     * Runs the call under the breaker with the overall call timeout.
     *
     * @param call supplier of the guarded publisher, invoked only when the call is admitted
     * @return the call's result, or {@link CircuitOpenException} when rejected
     */
    public <T> Mono<T> execute(Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            Admission admission = admit();
            if (admission == Admission.REJECTED) {
                return Mono.error(new CircuitOpenException(serviceName));
            }
            boolean probe = admission == Admission.PROBE;
            AtomicBoolean settled = new AtomicBoolean();

            return Mono.defer(call)
                .timeout(config.getTimeout(), Mono.error(() ->
                    new UpstreamTimeoutException(serviceName, null, config.getTimeout())))
                .doOnSuccess(value -> {
                    if (settled.compareAndSet(false, true)) {
                        onSuccess(probe);
                    }
                })
                .doOnError(error -> {
                    if (settled.compareAndSet(false, true)) {
                        onFailure(probe, error);
                    }
                })
                .doFinally(signal -> {
                    if (signal == SignalType.CANCEL && settled.compareAndSet(false, true) && probe) {
                        releaseProbe();
                    }
                });
        });
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public String getServiceName() {
        return serviceName;
    }

    public synchronized BreakerStats getStats() {
        RollingWindow.Totals totals = window.totals(clock.millis());
        return BreakerStats.builder()
            .state(state)
            .successful(totals.successes())
            .failed(totals.failures())
            .rejected(totals.rejections())
            .timeout(totals.timeouts())
            .build();
    }

    /**
     * Forces the breaker CLOSED and clears its window.
     */
    public void reset() {
        GatewayEvent event;
        synchronized (this) {
            CircuitState previous = state;
            close();
            event = new GatewayEvents.CircuitClosed(serviceName, true, clock.millis());
            log.info("Circuit breaker for {} manually reset (was {})", serviceName, previous);
        }
        eventBus.publish(event);
    }

    private enum Admission { ADMITTED, PROBE, REJECTED }

    private Admission admit() {
        GatewayEvent event = null;
        Admission admission;
        synchronized (this) {
            long now = clock.millis();
            if (state == CircuitState.OPEN && now - openedAt >= config.getResetTimeout().toMillis()) {
                state = CircuitState.HALF_OPEN;
                probeInFlight = false;
                event = new GatewayEvents.CircuitHalfOpened(serviceName, now);
                log.info("Circuit breaker for {} half-open, admitting a probe call", serviceName);
            }

            if (state == CircuitState.CLOSED) {
                admission = Admission.ADMITTED;
            } else if (state == CircuitState.HALF_OPEN && !probeInFlight) {
                probeInFlight = true;
                admission = Admission.PROBE;
            } else {
                window.recordRejection(now);
                admission = Admission.REJECTED;
            }
        }
        if (event != null) {
            eventBus.publish(event);
        }
        if (admission == Admission.REJECTED) {
            log.debug("Circuit breaker for {} rejected a call", serviceName);
        }
        return admission;
    }

    private void onSuccess(boolean probe) {
        GatewayEvent event = null;
        synchronized (this) {
            long now = clock.millis();
            consecutiveTimeouts = 0;
            if (probe) {
                close();
                event = new GatewayEvents.CircuitClosed(serviceName, false, now);
                log.info("Circuit breaker for {} closed after a successful probe", serviceName);
            } else {
                window.recordSuccess(now);
                event = tripIfNeeded(now);
            }
        }
        if (event != null) {
            eventBus.publish(event);
        }
    }

    private void onFailure(boolean probe, Throwable error) {
        GatewayEvent event;
        synchronized (this) {
            long now = clock.millis();
            if (error instanceof UpstreamTimeoutException) {
                window.recordTimeout(now);
                consecutiveTimeouts++;
            } else {
                window.recordFailure(now);
                consecutiveTimeouts = 0;
            }

            if (probe) {
                probeInFlight = false;
                event = open(now, window.totals(now).errorPercentage());
                log.warn("Circuit breaker for {} re-opened, probe failed: {}", serviceName, error.toString());
            } else {
                event = tripIfNeeded(now);
            }
        }
        if (event != null) {
            eventBus.publish(event);
        }
    }

    private synchronized void releaseProbe() {
        probeInFlight = false;
        log.debug("Circuit breaker probe for {} cancelled", serviceName);
    }

    /**
     * Must hold the monitor.
     */
    private GatewayEvent tripIfNeeded(long now) {
        if (state != CircuitState.CLOSED) {
            return null;
        }
        RollingWindow.Totals totals = window.totals(now);
        double errorPercentage = totals.errorPercentage();

        if (consecutiveTimeouts >= config.getTimeoutThreshold()) {
            log.warn("Circuit breaker for {} opened after {} consecutive timeouts", serviceName, consecutiveTimeouts);
            return open(now, errorPercentage);
        }
        if (totals.volume() >= config.getVolumeThreshold()
            && errorPercentage >= config.getErrorThresholdPercentage()) {
            log.warn("Circuit breaker for {} opened: {}% errors over {} calls",
                serviceName, String.format("%.1f", errorPercentage), totals.volume());
            return open(now, errorPercentage);
        }
        return null;
    }

    private GatewayEvent open(long now, double errorPercentage) {
        state = CircuitState.OPEN;
        openedAt = now;
        return new GatewayEvents.CircuitOpened(serviceName, errorPercentage, now);
    }

    private void close() {
        state = CircuitState.CLOSED;
        probeInFlight = false;
        consecutiveTimeouts = 0;
        window.clear();
    }
}
