package landscape.pipeline.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Durable state of one circuit breaker.
 *
 * Transitions are pure: every method returns a new state and never touches storage.
 * The repository applies them inside a row-locked transaction.
 *
 * Half-open admits at most {@code halfOpenMaxCalls} trial calls at a time and closes only after
 * {@code successThreshold} consecutive trial successes; any trial failure reopens it. With the
 * defaults (5 successes, 1 call) recovery therefore takes five sequential trials. Configure a
 * success threshold of 1 for a breaker that closes on its first successful trial.
 */
public final class CircuitBreakerState {
    private final String name;
    private final CircuitState state;
    private final int failureCount;
    private final int successCount;
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration timeout;
    private final int halfOpenMaxCalls;
    private final int halfOpenInFlight;
    private final Instant lastFailureAt;
    private final Instant lastSuccessAt;
    private final Instant openedAt;
    private final long totalRequests;
    private final long totalFailures;
    private final long totalSuccesses;

    private CircuitBreakerState(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.failureCount = builder.failureCount;
        this.successCount = builder.successCount;
        this.failureThreshold = builder.failureThreshold;
        this.successThreshold = builder.successThreshold;
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout is required");
        this.halfOpenMaxCalls = builder.halfOpenMaxCalls;
        this.halfOpenInFlight = builder.halfOpenInFlight;
        this.lastFailureAt = builder.lastFailureAt;
        this.lastSuccessAt = builder.lastSuccessAt;
        this.openedAt = builder.openedAt;
        this.totalRequests = builder.totalRequests;
        this.totalFailures = builder.totalFailures;
        this.totalSuccesses = builder.totalSuccesses;
    }

    /**
     * Fresh closed breaker.
     */
    public static CircuitBreakerState initial(String name, int failureThreshold, int successThreshold,
            Duration timeout, int halfOpenMaxCalls) {
        return builder()
                .name(name)
                .state(CircuitState.CLOSED)
                .failureThreshold(failureThreshold)
                .successThreshold(successThreshold)
                .timeout(timeout)
                .halfOpenMaxCalls(halfOpenMaxCalls)
                .build();
    }

    /**
     * Outcome of asking for permission to call.
     */
    public record Permit(boolean allowed, CircuitBreakerState next) {
    }

    /**
     * Ask for permission to make one call at {@code now}.
     */
    public Permit acquire(Instant now) {
        switch (state) {
            case CLOSED:
                return new Permit(true, toBuilder().totalRequests(totalRequests + 1).build());
            case OPEN:
                if (timeoutElapsed(now)) {
                    CircuitBreakerState halfOpen = toBuilder()
                            .state(CircuitState.HALF_OPEN)
                            .successCount(0)
                            .halfOpenInFlight(1)
                            .totalRequests(totalRequests + 1)
                            .build();
                    return new Permit(true, halfOpen);
                }
                return new Permit(false, this);
            case HALF_OPEN:
                if (halfOpenInFlight < halfOpenMaxCalls) {
                    return new Permit(true, toBuilder()
                            .halfOpenInFlight(halfOpenInFlight + 1)
                            .totalRequests(totalRequests + 1)
                            .build());
                }
                // a trial permit held for a whole extra timeout belongs to a caller that died
                if (trialAbandoned(now)) {
                    return new Permit(true, toBuilder()
                            .openedAt(now.minus(timeout))
                            .totalRequests(totalRequests + 1)
                            .build());
                }
                return new Permit(false, this);
            default:
                throw new IllegalStateException("Unknown circuit state: " + state);
        }
    }

    public CircuitBreakerState onSuccess(Instant now) {
        Builder next = toBuilder()
                .lastSuccessAt(now)
                .totalSuccesses(totalSuccesses + 1);

        switch (state) {
            case CLOSED:
                return next.failureCount(0).build();
            case HALF_OPEN:
                int successes = successCount + 1;
                if (successes >= successThreshold) {
                    return next.state(CircuitState.CLOSED)
                            .failureCount(0)
                            .successCount(0)
                            .halfOpenInFlight(0)
                            .openedAt(null)
                            .build();
                }
                return next.successCount(successes)
                        .halfOpenInFlight(Math.max(0, halfOpenInFlight - 1))
                        .build();
            default:
                // a call admitted before the breaker opened
                return next.build();
        }
    }

    public CircuitBreakerState onFailure(Instant now) {
        Builder next = toBuilder()
                .lastFailureAt(now)
                .totalFailures(totalFailures + 1);

        switch (state) {
            case CLOSED:
                int failures = failureCount + 1;
                if (failures >= failureThreshold) {
                    return next.state(CircuitState.OPEN)
                            .failureCount(failures)
                            .successCount(0)
                            .openedAt(now)
                            .build();
                }
                return next.failureCount(failures).build();
            case HALF_OPEN:
                return next.state(CircuitState.OPEN)
                        .failureCount(failureCount + 1)
                        .successCount(0)
                        .halfOpenInFlight(0)
                        .openedAt(now)
                        .build();
            default:
                return next.failureCount(failureCount + 1).build();
        }
    }

    /**
     * Give back a half-open permit without counting the call either way.
     */
    public CircuitBreakerState onRelease() {
        if (state != CircuitState.HALF_OPEN || halfOpenInFlight == 0) {
            return this;
        }
        return toBuilder().halfOpenInFlight(halfOpenInFlight - 1).build();
    }

    public CircuitBreakerState reset() {
        return toBuilder()
                .state(CircuitState.CLOSED)
                .failureCount(0)
                .successCount(0)
                .halfOpenInFlight(0)
                .openedAt(null)
                .build();
    }

    private boolean trialAbandoned(Instant now) {
        return openedAt != null && !openedAt.plus(timeout.multipliedBy(2)).isAfter(now);
    }

    private boolean timeoutElapsed(Instant now) {
        return openedAt == null || !openedAt.plus(timeout).isAfter(now);
    }

    /** Lifetime success rate, or 1.0 before any completed call */
    public double successRate() {
        long finished = totalSuccesses + totalFailures;
        return finished == 0 ? 1.0 : (double) totalSuccesses / finished;
    }

    public String name() {
        return name;
    }

    public CircuitState state() {
        return state;
    }

    public int failureCount() {
        return failureCount;
    }

    public int successCount() {
        return successCount;
    }

    public int failureThreshold() {
        return failureThreshold;
    }

    public int successThreshold() {
        return successThreshold;
    }

    public Duration timeout() {
        return timeout;
    }

    public int halfOpenMaxCalls() {
        return halfOpenMaxCalls;
    }

    public int halfOpenInFlight() {
        return halfOpenInFlight;
    }

    public Instant lastFailureAt() {
        return lastFailureAt;
    }

    public Instant lastSuccessAt() {
        return lastSuccessAt;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public long totalRequests() {
        return totalRequests;
    }

    public long totalFailures() {
        return totalFailures;
    }

    public long totalSuccesses() {
        return totalSuccesses;
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .state(state)
                .failureCount(failureCount)
                .successCount(successCount)
                .failureThreshold(failureThreshold)
                .successThreshold(successThreshold)
                .timeout(timeout)
                .halfOpenMaxCalls(halfOpenMaxCalls)
                .halfOpenInFlight(halfOpenInFlight)
                .lastFailureAt(lastFailureAt)
                .lastSuccessAt(lastSuccessAt)
                .openedAt(openedAt)
                .totalRequests(totalRequests)
                .totalFailures(totalFailures)
                .totalSuccesses(totalSuccesses);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private CircuitState state = CircuitState.CLOSED;
        private int failureCount;
        private int successCount;
        private int failureThreshold = 10;
        private int successThreshold = 5;
        private Duration timeout = Duration.ofSeconds(300);
        private int halfOpenMaxCalls = 1;
        private int halfOpenInFlight;
        private Instant lastFailureAt;
        private Instant lastSuccessAt;
        private Instant openedAt;
        private long totalRequests;
        private long totalFailures;
        private long totalSuccesses;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder state(CircuitState state) {
            this.state = state;
            return this;
        }

        public Builder failureCount(int failureCount) {
            this.failureCount = failureCount;
            return this;
        }

        public Builder successCount(int successCount) {
            this.successCount = successCount;
            return this;
        }

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder successThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder halfOpenMaxCalls(int halfOpenMaxCalls) {
            this.halfOpenMaxCalls = halfOpenMaxCalls;
            return this;
        }

        public Builder halfOpenInFlight(int halfOpenInFlight) {
            this.halfOpenInFlight = halfOpenInFlight;
            return this;
        }

        public Builder lastFailureAt(Instant lastFailureAt) {
            this.lastFailureAt = lastFailureAt;
            return this;
        }

        public Builder lastSuccessAt(Instant lastSuccessAt) {
            this.lastSuccessAt = lastSuccessAt;
            return this;
        }

        public Builder openedAt(Instant openedAt) {
            this.openedAt = openedAt;
            return this;
        }

        public Builder totalRequests(long totalRequests) {
            this.totalRequests = totalRequests;
            return this;
        }

        public Builder totalFailures(long totalFailures) {
            this.totalFailures = totalFailures;
            return this;
        }

        public Builder totalSuccesses(long totalSuccesses) {
            this.totalSuccesses = totalSuccesses;
            return this;
        }

        public CircuitBreakerState build() {
            return new CircuitBreakerState(this);
        }
    }

    @Override
    public String toString() {
        return "CircuitBreakerState{" + name + " " + state + ", failures=" + failureCount + ", successes="
                + successCount + "}";
    }
}
