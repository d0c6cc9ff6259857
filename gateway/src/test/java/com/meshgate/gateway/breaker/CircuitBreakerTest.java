package com.meshgate.gateway.breaker;

import com.meshgate.core.error.CircuitOpenException;
import com.meshgate.core.error.UpstreamException;
import com.meshgate.core.error.UpstreamTimeoutException;
import com.meshgate.core.model.BreakerStats;
import com.meshgate.core.model.CircuitState;
import com.meshgate.core.msg.GatewayEvents;
import com.meshgate.gateway.config.CircuitBreakerConfig;
import com.meshgate.gateway.event.GatewayEventBus;
import com.meshgate.gateway.support.MutableClock;
import com.meshgate.gateway.support.RecordingListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private MutableClock clock;
    private RecordingListener events;
    private CircuitBreaker breaker;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        events = new RecordingListener();
        GatewayEventBus bus = new GatewayEventBus();
        bus.subscribe(events);

        CircuitBreakerConfig config = CircuitBreakerConfig.builder()
            .volumeThreshold(4)
            .errorThresholdPercentage(50)
            .resetTimeout(Duration.ofSeconds(30))
            .timeoutThreshold(3)
            .build();
        breaker = new CircuitBreaker("payments", config, clock, bus);
        invocations = new AtomicInteger();
    }

    @Test
    @DisplayName("Stays closed below the volume threshold even at 100% errors")
    void testVolumeThreshold() {
        recordFailures(3);

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertTrue(events.eventsOf(GatewayEvents.CircuitOpened.class).isEmpty());
    }

    @Test
    @DisplayName("Trips at the error percentage and rejects without invoking the call")
    void testTripAndRejectWithoutDispatch() {
        recordSuccesses(2);
        recordFailures(2);

        assertEquals(CircuitState.OPEN, breaker.getState());
        GatewayEvents.CircuitOpened opened = events.eventsOf(GatewayEvents.CircuitOpened.class).get(0);
        assertEquals("payments", opened.getServiceName());
        assertEquals(50.0, opened.getErrorPercentage(), 0.001);

        int before = invocations.get();
        StepVerifier.create(breaker.execute(this::successfulCall))
            .expectError(CircuitOpenException.class)
            .verify();

        assertEquals(before, invocations.get(), "Open breaker must not call the supplier");
        assertEquals(1, breaker.getStats().getRejected());
    }

    @Test
    @DisplayName("Consecutive timeouts trip the breaker regardless of volume")
    void testConsecutiveTimeouts() {
        for (int i = 0; i < 3; i++) {
            StepVerifier.create(breaker.execute(() -> Mono.error(
                    new UpstreamTimeoutException("payments", "p1", Duration.ofMillis(10)))))
                .expectError(UpstreamTimeoutException.class)
                .verify();
        }

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(3, breaker.getStats().getTimeout());
    }

    @Test
    @DisplayName("A success in between resets the consecutive timeout count")
    void testTimeoutStreakBrokenBySuccess() {
        CircuitBreakerConfig config = CircuitBreakerConfig.builder().volumeThreshold(100).timeoutThreshold(2).build();
        CircuitBreaker lenient = new CircuitBreaker("payments", config, clock, new GatewayEventBus());

        StepVerifier.create(lenient.execute(this::timedOutCall)).expectError().verify();
        StepVerifier.create(lenient.execute(this::successfulCall)).expectNext("ok").verifyComplete();
        StepVerifier.create(lenient.execute(this::timedOutCall)).expectError().verify();

        assertEquals(CircuitState.CLOSED, lenient.getState());
    }

    @Test
    @DisplayName("Half-opens after the reset timeout and closes on a successful probe")
    void testHalfOpenRecovery() {
        recordFailures(4);
        assertEquals(CircuitState.OPEN, breaker.getState());

        clock.advance(Duration.ofSeconds(29));
        StepVerifier.create(breaker.execute(this::successfulCall))
            .expectError(CircuitOpenException.class)
            .verify();

        clock.advance(Duration.ofSeconds(1));
        StepVerifier.create(breaker.execute(this::successfulCall))
            .expectNext("ok")
            .verifyComplete();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(1, events.eventsOf(GatewayEvents.CircuitHalfOpened.class).size());
        GatewayEvents.CircuitClosed closed = events.eventsOf(GatewayEvents.CircuitClosed.class).get(0);
        assertFalse(closed.isManual());

        BreakerStats stats = breaker.getStats();
        assertEquals(0, stats.getFailed(), "Closing clears the rolling window");
    }

    @Test
    @DisplayName("A failed probe re-opens the breaker for another reset period")
    void testFailedProbeReopens() {
        recordFailures(4);
        clock.advance(Duration.ofSeconds(30));

        StepVerifier.create(breaker.execute(this::failingCall))
            .expectError(UpstreamException.class)
            .verify();

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(2, events.eventsOf(GatewayEvents.CircuitOpened.class).size());

        clock.advance(Duration.ofSeconds(10));
        StepVerifier.create(breaker.execute(this::successfulCall))
            .expectError(CircuitOpenException.class)
            .verify();
    }

    @Test
    @DisplayName("Half-open admits exactly one in-flight probe")
    void testSingleProbe() {
        recordFailures(4);
        clock.advance(Duration.ofSeconds(30));

        Sinks.One<String> pending = Sinks.one();
        Disposable probe = breaker.execute(pending::asMono).subscribe();

        StepVerifier.create(breaker.execute(this::successfulCall))
            .expectError(CircuitOpenException.class)
            .verify();
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());

        pending.tryEmitValue("done");
        assertEquals(CircuitState.CLOSED, breaker.getState());
        probe.dispose();
    }

    @Test
    @DisplayName("A cancelled probe frees the half-open slot")
    void testCancelledProbeReleasesSlot() {
        recordFailures(4);
        clock.advance(Duration.ofSeconds(30));

        Disposable probe = breaker.execute(Mono::<String>never).subscribe();
        probe.dispose();

        StepVerifier.create(breaker.execute(this::successfulCall))
            .expectNext("ok")
            .verifyComplete();
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    @Test
    @DisplayName("Manual reset closes the breaker and publishes a manual close")
    void testManualReset() {
        recordFailures(4);

        breaker.reset();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertTrue(events.eventsOf(GatewayEvents.CircuitClosed.class).get(0).isManual());
        StepVerifier.create(breaker.execute(this::successfulCall))
            .expectNext("ok")
            .verifyComplete();
    }

    @Test
    @DisplayName("Outcomes older than the rolling window are forgotten")
    void testRollingWindowExpiry() {
        recordFailures(3);
        clock.advance(Duration.ofSeconds(11));
        recordSuccesses(1);
        recordFailures(1);

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(1, breaker.getStats().getFailed());
        assertEquals(1, breaker.getStats().getSuccessful());
    }

    @Test
    @DisplayName("The overall call timeout fails the call as a timeout")
    void testOverallCallTimeout() {
        CircuitBreakerConfig config = CircuitBreakerConfig.builder().timeout(Duration.ofMillis(50)).build();
        CircuitBreaker fast = new CircuitBreaker("slow", config, clock, new GatewayEventBus());

        StepVerifier.create(fast.execute(Mono::<String>never))
            .expectError(UpstreamTimeoutException.class)
            .verify(Duration.ofSeconds(5));

        assertEquals(1, fast.getStats().getTimeout());
    }

    private void recordSuccesses(int times) {
        for (int i = 0; i < times; i++) {
            StepVerifier.create(breaker.execute(this::successfulCall)).expectNext("ok").verifyComplete();
        }
    }

    private void recordFailures(int times) {
        for (int i = 0; i < times; i++) {
            StepVerifier.create(breaker.execute(this::failingCall)).expectError().verify();
        }
    }

    private Mono<String> successfulCall() {
        invocations.incrementAndGet();
        return Mono.just("ok");
    }

    private Mono<String> failingCall() {
        invocations.incrementAndGet();
        return Mono.error(new UpstreamException("payments", "p1", 500));
    }

    private Mono<String> timedOutCall() {
        return Mono.error(new UpstreamTimeoutException("payments", "p1", Duration.ofMillis(10)));
    }
}
