package landscape.pipeline.resilience;

/**
 * Thrown when a call is refused because the dependency's circuit is open.
 */
public class CircuitOpenException extends RuntimeException {

    private final String breakerName;

    public CircuitOpenException(String breakerName) {
        super("Circuit breaker open for " + breakerName);
        this.breakerName = breakerName;
    }

    public String breakerName() {
        return breakerName;
    }
}
