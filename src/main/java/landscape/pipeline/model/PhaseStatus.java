package landscape.pipeline.model;

/**
 * Status of one phase within one execution.
 */
public enum PhaseStatus {
    /** Waiting for its entry gate */
    PENDING,
    /** Items are being processed */
    RUNNING,
    /** Finished, fully or under the flexible completion policy */
    COMPLETED,
    /** Finished without meeting any completion condition */
    FAILED,
    /** Disabled for this execution or dropped by cancellation */
    SKIPPED,
    /** Entry gate cannot be met in this run */
    BLOCKED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    /** Terminal, or blocked with nothing left to wait for */
    public boolean isSettled() {
        return isTerminal() || this == BLOCKED;
    }
}
