package landscape.pipeline.model;

/**
 * Result of completing or failing a leased queue entry.
 */
public enum JobResult {
    /** Entry completed */
    OK,

    /** Entry failed and was rescheduled */
    REQUEUED,

    /** Entry failed with attempts exhausted */
    DEAD_LETTERED,

    /** Entry failed permanently (non-retriable) */
    FAILED,

    /** Caller does not hold the lease */
    NOT_OWNER,

    /** Entry does not exist */
    NOT_FOUND
}
