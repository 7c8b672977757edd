package landscape.pipeline.resilience;

import landscape.pipeline.model.CircuitBreakerState;
import landscape.pipeline.repository.CircuitBreakerRepository;
import landscape.pipeline.repository.CircuitBreakerRepository.Mutation;

import java.time.Clock;

/**
 * Handle on one durable circuit breaker.
 *
 * Holds no state of its own: every call is a locked read-modify-write through the
 * repository, so all workers and processes share the same view of the dependency.
 */
public final class CircuitBreaker {

    private final CircuitBreakerState initial;
    private final CircuitBreakerRepository repository;
    private final Clock clock;

    CircuitBreaker(CircuitBreakerState initial, CircuitBreakerRepository repository, Clock clock) {
        this.initial = initial;
        this.repository = repository;
        this.clock = clock;
    }

    public String name() {
        return initial.name();
    }

    /**
     * Ask permission for one call. A granted half-open permit must be followed by
     * {@link #recordSuccess()}, {@link #recordFailure()} or {@link #release()}.
     */
    public boolean allow() {
        return repository.update(initial, current -> {
            CircuitBreakerState.Permit permit = current.acquire(clock.instant());
            return new Mutation<>(permit.next(), permit.allowed());
        });
    }

    public void recordSuccess() {
        repository.update(initial, current -> new Mutation<>(current.onSuccess(clock.instant()), null));
    }

    public void recordFailure() {
        repository.update(initial, current -> new Mutation<>(current.onFailure(clock.instant()), null));
    }

    /** Hand back a permit without counting the call */
    public void release() {
        repository.update(initial, current -> new Mutation<>(current.onRelease(), null));
    }

    /**
     * Count a classified failure: recoverable errors count against the dependency,
     * degraded responses count as success, anything else says nothing about its health.
     */
    public void recordError(ClassifiedError error) {
        switch (error.category()) {
            case RECOVERABLE:
                recordFailure();
                break;
            case DEGRADED:
                recordSuccess();
                break;
            default:
                release();
                break;
        }
    }

    public void reset() {
        repository.update(initial, current -> new Mutation<>(current.reset(), null));
    }

    /** Current durable state, or the initial state if the breaker was never used */
    public CircuitBreakerState state() {
        return repository.find(initial.name()).orElse(initial);
    }
}
