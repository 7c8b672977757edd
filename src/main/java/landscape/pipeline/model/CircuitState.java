package landscape.pipeline.model;

/**
 * Circuit breaker state.
 */
public enum CircuitState {
    /** Calls flow normally */
    CLOSED,
    /** Calls are rejected until the timeout elapses */
    OPEN,
    /** A limited number of trial calls are allowed */
    HALF_OPEN
}
