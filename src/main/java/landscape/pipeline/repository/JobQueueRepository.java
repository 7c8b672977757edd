package landscape.pipeline.repository;

import landscape.pipeline.model.JobResult;
import landscape.pipeline.model.QueueJob;
import landscape.pipeline.model.QueueStats;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the durable job queue.
 */
public interface JobQueueRepository {

    /**
     * Insert a job. If it carries a dedupe key that already has an active
     * (pending or processing) entry, nothing is inserted.
     *
     * @return the id of the new or the existing active job
     */
    String insert(QueueJob job);

    /**
     * Insert many jobs in one transaction, applying the same dedupe rule.
     *
     * @return number of jobs actually inserted
     */
    int insertAll(List<QueueJob> jobs);

    Optional<QueueJob> findById(String jobId);

    List<QueueJob> findByGroup(String groupKey);

    /**
     * Atomically claim the highest-priority, oldest eligible entry of a queue.
     * Eligible: PENDING and due, or PROCESSING with an expired lease.
     *
     * @param groupKey optional filter, null for any group
     * @return the claimed job, or empty if nothing is eligible
     */
    Optional<QueueJob> lease(String queueName, String groupKey, String workerId, Duration leaseDuration,
            Instant now);

    JobResult complete(String jobId, String workerId);

    /**
     * Fail a leased job.
     *
     * A retried entry becomes eligible again after {@code requeueBase * 2^(attempts-1)}.
     *
     * @param retriable   whether the failure may be retried
     * @param requeueBase base delay of the exponential requeue schedule
     */
    JobResult fail(String jobId, String workerId, String error, boolean retriable, Duration requeueBase);

    int countActive(String groupKey);

    /**
     * Mark active entries of a group FAILED.
     */
    int cancelGroup(String groupKey, String reason);

    /**
     * Return PROCESSING entries of a group to PENDING. Attempts already charged stay charged.
     */
    int releaseGroup(String groupKey);

    /**
     * Return expired leases to PENDING, or dead-letter them when attempts are exhausted.
     */
    int reapExpired(Instant now);

    QueueStats stats(String queueName);

    /**
     * Requeue every dead letter of a queue with attempts reset.
     */
    int retryDeadLetters(String queueName);
}
