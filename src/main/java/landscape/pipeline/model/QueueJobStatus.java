package landscape.pipeline.model;

/**
 * Job queue entry status.
 */
public enum QueueJobStatus {
    /** Waiting for a lease (possibly scheduled in the future) */
    PENDING,
    /** Leased by a worker until the lease expires */
    PROCESSING,
    /** Finished successfully */
    COMPLETED,
    /** Finished with a non-retriable error or cancelled */
    FAILED,
    /** Attempts exhausted; excluded from normal dequeue */
    DEAD_LETTER;

    public boolean isActive() {
        return this == PENDING || this == PROCESSING;
    }
}
