package landscape.pipeline.model;

import java.time.Instant;

/**
 * Error or warning attached to an execution, optionally to one phase.
 */
public record ExecutionMessage(
        String executionId,
        PhaseName phase,
        Level level,
        String message,
        Instant createdAt) {

    public enum Level {
        ERROR,
        WARNING
    }
}
