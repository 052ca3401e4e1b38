package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.CircuitBreakerStatus;
import me.golemcore.relay.domain.model.CircuitState;
import me.golemcore.relay.testsupport.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(10_000);
        breaker = new CircuitBreaker("ai-generation", 5, 60_000, 3, clock);
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            breaker.onError();
        }
    }

    @Test
    void shouldStayClosedBelowThreshold() {
        fail(4);

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertTrue(breaker.tryAcquirePermission());
    }

    @Test
    void shouldOpenAtThresholdAndRejectCalls() {
        fail(5);

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertFalse(breaker.tryAcquirePermission());
    }

    @Test
    void successInClosedShouldForgiveOneFailure() {
        fail(4);
        breaker.onSuccess();
        breaker.onError();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(4, breaker.getStatus().getFailures());
    }

    @Test
    void shouldGoHalfOpenAfterTimeoutAndCloseAfterSuccesses() {
        fail(5);
        clock.advance(60_000);

        assertTrue(breaker.tryAcquirePermission());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());

        breaker.onSuccess();
        breaker.onSuccess();
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        breaker.onSuccess();

        CircuitBreakerStatus status = breaker.getStatus();
        assertEquals(CircuitState.CLOSED, status.getState());
        assertEquals(0, status.getFailures());
    }

    @Test
    void failureInHalfOpenShouldReopen() {
        fail(5);
        clock.advance(60_000);
        breaker.tryAcquirePermission();

        breaker.onError();

        assertEquals(CircuitState.OPEN, breaker.getState());
        clock.advance(59_999);
        assertFalse(breaker.tryAcquirePermission());
    }

    @Test
    void statusShouldCarryNameAndLastFailureTime() {
        breaker.onError();

        CircuitBreakerStatus status = breaker.getStatus();
        assertEquals("ai-generation", status.getName());
        assertEquals(10_000, status.getLastFailureTimeMs());
    }
}
