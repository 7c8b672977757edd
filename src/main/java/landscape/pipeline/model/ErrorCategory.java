package landscape.pipeline.model;

/**
 * Classification of a failed call.
 */
public enum ErrorCategory {
    /** Timeouts, rate limits, 5xx: retry with backoff */
    RECOVERABLE,
    /** Auth failures, malformed requests, other 4xx: fail at once */
    NON_RECOVERABLE,
    /** Partial content: accept as best-effort success */
    DEGRADED,
    /** Circuit breaker open: dependency considered down */
    SERVICE_UNAVAILABLE
}
