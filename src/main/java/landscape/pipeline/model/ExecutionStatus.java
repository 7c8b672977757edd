package landscape.pipeline.model;

/**
 * Overall status of a pipeline execution.
 */
public enum ExecutionStatus {
    /** Created, not yet picked up by an orchestrator */
    PENDING,
    /** Being driven by an orchestrator */
    RUNNING,
    /** Every enabled phase completed */
    COMPLETED,
    /** A critical phase failed or a hard dependency chain was broken */
    FAILED,
    /** Finished with blocked or failed non-critical phases */
    PARTIALLY_COMPLETED,
    /** Stopped on user request */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == PARTIALLY_COMPLETED || this == CANCELLED;
    }
}
