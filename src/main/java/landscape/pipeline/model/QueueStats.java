package landscape.pipeline.model;

import java.time.Instant;

/**
 * Per-queue counts by status.
 */
public record QueueStats(
        String queueName,
        int pending,
        int processing,
        int completed,
        int failed,
        int deadLetter,
        Instant oldestPendingAt) {
}
