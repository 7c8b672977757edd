package landscape.pipeline.orchestrator;

import landscape.pipeline.model.ErrorCategory;

import java.util.Map;

/**
 * What a phase handler reports for one work item.
 */
public record ItemOutcome(Status status, Map<String, Object> output, String error, ErrorCategory category) {

    public enum Status {
        COMPLETED,
        /** Best-effort success, flagged for visibility */
        DEGRADED,
        FAILED,
        /** Item is not applicable, e.g. content too short to analyze */
        SKIPPED
    }

    public ItemOutcome {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        output = output == null ? Map.of() : output;
    }

    public static ItemOutcome completed(Map<String, Object> output) {
        return new ItemOutcome(Status.COMPLETED, output, null, null);
    }

    public static ItemOutcome degraded(Map<String, Object> output, String warning) {
        return new ItemOutcome(Status.DEGRADED, output, warning, ErrorCategory.DEGRADED);
    }

    /** A handled failure that should not be retried */
    public static ItemOutcome failed(String error) {
        return new ItemOutcome(Status.FAILED, null, error, ErrorCategory.NON_RECOVERABLE);
    }

    public static ItemOutcome failed(String error, ErrorCategory category) {
        return new ItemOutcome(Status.FAILED, null, error, category);
    }

    public static ItemOutcome skipped(String reason) {
        return new ItemOutcome(Status.SKIPPED, null, reason, null);
    }
}
