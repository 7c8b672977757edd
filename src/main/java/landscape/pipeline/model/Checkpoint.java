package landscape.pipeline.model;

import java.time.Instant;

/**
 * Named, phase-scoped progress snapshot.
 */
public record Checkpoint(
        String executionId,
        PhaseName phase,
        String name,
        int itemsProcessed,
        int itemsTotal,
        String stateData,
        Instant updatedAt) {

    public static final String PROGRESS = "progress";
    public static final String FINAL = "final";

    public double percent() {
        return itemsTotal == 0 ? 100.0 : (itemsProcessed * 100.0) / itemsTotal;
    }
}
