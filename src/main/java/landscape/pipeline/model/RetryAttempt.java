package landscape.pipeline.model;

import java.time.Instant;

/**
 * One row of retry history: a single attempt of a wrapped operation.
 */
public record RetryAttempt(
        String entityType,
        String entityId,
        String service,
        int attemptNumber,
        boolean success,
        String errorCode,
        String errorMessage,
        long delayMs,
        Instant nextRetryAt,
        Instant createdAt) {
}
