package landscape.pipeline.resilience;

import landscape.pipeline.model.CircuitBreakerState;
import landscape.pipeline.model.CircuitState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerStateTest {

    private static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private CircuitBreakerState closed() {
        return CircuitBreakerState.initial("serp-api", 3, 2, TIMEOUT, 1);
    }

    private CircuitBreakerState opened() {
        CircuitBreakerState state = closed();
        for (int i = 0; i < 3; i++) {
            state = state.onFailure(T0);
        }
        return state;
    }

    @Test
    @DisplayName("Breaker opens after the failure threshold")
    void opensAtFailureThreshold() {
        CircuitBreakerState state = closed().onFailure(T0).onFailure(T0);
        assertEquals(CircuitState.CLOSED, state.state());

        state = state.onFailure(T0);
        assertEquals(CircuitState.OPEN, state.state());
        assertEquals(T0, state.openedAt());
        assertFalse(state.acquire(T0.plusSeconds(5)).allowed());
    }

    @Test
    void successResetsConsecutiveFailures() {
        CircuitBreakerState state = closed().onFailure(T0).onFailure(T0).onSuccess(T0).onFailure(T0);

        assertEquals(CircuitState.CLOSED, state.state());
        assertEquals(1, state.failureCount());
    }

    @Test
    void openBecomesHalfOpenAfterTimeout() {
        CircuitBreakerState.Permit permit = opened().acquire(T0.plus(TIMEOUT));

        assertTrue(permit.allowed());
        assertEquals(CircuitState.HALF_OPEN, permit.next().state());
        assertEquals(1, permit.next().halfOpenInFlight());
    }

    @Test
    @DisplayName("Half-open closes only after the success threshold of sequential trials")
    void halfOpenNeedsSequentialTrials() {
        CircuitBreakerState state = CircuitBreakerState.initial("serp-api", 3, 5, TIMEOUT, 1);
        for (int i = 0; i < 3; i++) {
            state = state.onFailure(T0);
        }
        Instant now = T0.plus(TIMEOUT);

        for (int trial = 1; trial <= 5; trial++) {
            CircuitBreakerState.Permit permit = state.acquire(now);
            assertTrue(permit.allowed(), "trial " + trial);
            assertFalse(permit.next().acquire(now).allowed(), "one trial at a time");
            state = permit.next().onSuccess(now);
            assertEquals(trial < 5 ? CircuitState.HALF_OPEN : CircuitState.CLOSED, state.state(), "trial " + trial);
        }
    }

    @Test
    void singleTrialClosesWithThresholdOfOne() {
        CircuitBreakerState state = CircuitBreakerState.initial("serp-api", 3, 1, TIMEOUT, 1);
        for (int i = 0; i < 3; i++) {
            state = state.onFailure(T0);
        }

        CircuitBreakerState.Permit permit = state.acquire(T0.plus(TIMEOUT));
        assertTrue(permit.allowed());
        assertEquals(CircuitState.CLOSED, permit.next().onSuccess(T0.plus(TIMEOUT)).state());
    }

    @Test
    void halfOpenLimitsTrialCalls() {
        CircuitBreakerState halfOpen = opened().acquire(T0.plus(TIMEOUT)).next();

        assertFalse(halfOpen.acquire(T0.plus(TIMEOUT)).allowed());
    }

    @Test
    void halfOpenClosesAfterSuccessThreshold() {
        CircuitBreakerState state = opened().acquire(T0.plus(TIMEOUT)).next().onSuccess(T0.plus(TIMEOUT));
        assertEquals(CircuitState.HALF_OPEN, state.state());

        state = state.acquire(T0.plus(TIMEOUT)).next().onSuccess(T0.plus(TIMEOUT));
        assertEquals(CircuitState.CLOSED, state.state());
        assertEquals(0, state.failureCount());
        assertNull(state.openedAt());
    }

    @Test
    void halfOpenFailureReopens() {
        Instant trial = T0.plus(TIMEOUT);
        CircuitBreakerState state = opened().acquire(trial).next().onFailure(trial);

        assertEquals(CircuitState.OPEN, state.state());
        assertEquals(trial, state.openedAt());
        assertEquals(0, state.halfOpenInFlight());
    }

    @Test
    @DisplayName("A trial permit held for a second timeout is reissued")
    void abandonedTrialPermitIsReissued() {
        CircuitBreakerState halfOpen = opened().acquire(T0.plus(TIMEOUT)).next();

        assertFalse(halfOpen.acquire(T0.plus(TIMEOUT.multipliedBy(2)).minusSeconds(1)).allowed());
        assertTrue(halfOpen.acquire(T0.plus(TIMEOUT.multipliedBy(2))).allowed());
    }

    @Test
    void releaseReturnsPermit() {
        CircuitBreakerState halfOpen = opened().acquire(T0.plus(TIMEOUT)).next().onRelease();

        assertEquals(0, halfOpen.halfOpenInFlight());
        assertTrue(halfOpen.acquire(T0.plus(TIMEOUT)).allowed());
    }

    @Test
    void totalsAndSuccessRate() {
        CircuitBreakerState state = closed();
        assertEquals(1.0, state.successRate());

        state = state.acquire(T0).next().onSuccess(T0);
        state = state.acquire(T0).next().onFailure(T0);

        assertEquals(2, state.totalRequests());
        assertEquals(1, state.totalSuccesses());
        assertEquals(1, state.totalFailures());
        assertEquals(0.5, state.successRate(), 1e-9);
    }

    @Test
    void resetCloses() {
        CircuitBreakerState state = opened().reset();

        assertEquals(CircuitState.CLOSED, state.state());
        assertTrue(state.acquire(T0).allowed());
    }
}
