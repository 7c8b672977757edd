package landscape.pipeline.resilience;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(maxDelay, baseDelay * multiplier^(attempt-1))}.
 */
public record BackoffPolicy(Duration baseDelay, double multiplier, Duration maxDelay) {

    public BackoffPolicy {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public Duration delayFor(int attempt) {
        double millis = baseDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }
}
