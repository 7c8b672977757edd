package landscape.pipeline.repository;

import landscape.pipeline.model.CircuitBreakerState;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Repository interface for durable circuit breaker state.
 */
public interface CircuitBreakerRepository {

    /**
     * Result of a read-modify-write: the state to store and a value for the caller.
     */
    record Mutation<T>(CircuitBreakerState next, T result) {
    }

    /**
     * Read the breaker under a row lock (creating it from {@code initial} if absent),
     * apply {@code mutation}, store the new state and commit.
     */
    <T> T update(CircuitBreakerState initial, Function<CircuitBreakerState, Mutation<T>> mutation);

    Optional<CircuitBreakerState> find(String name);

    List<CircuitBreakerState> findAll();
}
