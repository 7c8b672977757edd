package landscape.pipeline.model;

/**
 * Status of one work item in the state tracker.
 */
public enum ItemStatus {
    /** Enumerated, not yet submitted */
    PENDING,
    /** Submitted to the job queue */
    QUEUED,
    /** Leased by a worker */
    PROCESSING,
    /** Done, possibly with degraded output */
    COMPLETED,
    /** Last attempt failed; may be retried until the attempt ceiling */
    FAILED,
    /** Excluded from processing */
    SKIPPED;

    public boolean isInFlight() {
        return this == PENDING || this == QUEUED || this == PROCESSING;
    }
}
