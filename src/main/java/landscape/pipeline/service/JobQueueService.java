package landscape.pipeline.service;

import landscape.pipeline.config.PipelineConfig;
import landscape.pipeline.model.JobResult;
import landscape.pipeline.model.QueueJob;
import landscape.pipeline.model.QueueStats;
import landscape.pipeline.repository.JobQueueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable priority queue with lease-based dequeue, one logical queue per lane.
 */
public class JobQueueService {

    private static final Logger log = LoggerFactory.getLogger(JobQueueService.class);

    private final JobQueueRepository repository;
    private final PipelineConfig config;
    private final Clock clock;

    public JobQueueService(JobQueueRepository repository, PipelineConfig config, Clock clock) {
        this.repository = repository;
        this.config = config;
        this.clock = clock;
    }

    public static String newJobId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Enqueue a job with default attempts and no dedupe key.
     *
     * @return id of the new job
     */
    public String enqueue(String queueName, String jobType, String payload, int priority) {
        return enqueue(QueueJob.builder()
                .id(newJobId())
                .queueName(queueName)
                .jobType(jobType)
                .payload(payload)
                .priority(priority)
                .build());
    }

    /**
     * @return id of the new job, or of the active job already holding the same dedupe key
     */
    public String enqueue(QueueJob job) {
        validate(job);
        String id = repository.insert(job);
        if (!id.equals(job.id())) {
            log.debug("Job {} deduplicated onto active job {}", job.dedupeKey(), id);
        }
        return id;
    }

    /**
     * @return number of jobs inserted; duplicates of active jobs are not counted
     */
    public int bulkEnqueue(List<QueueJob> jobs) {
        jobs.forEach(this::validate);
        return repository.insertAll(jobs);
    }

    public Optional<QueueJob> lease(String queueName, String workerId) {
        return lease(queueName, null, workerId, config.leaseDuration());
    }

    public Optional<QueueJob> lease(String queueName, String groupKey, String workerId) {
        return lease(queueName, groupKey, workerId, config.leaseDuration());
    }

    public Optional<QueueJob> lease(String queueName, String groupKey, String workerId, Duration leaseDuration) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (leaseDuration.isNegative() || leaseDuration.isZero()) {
            throw new IllegalArgumentException("leaseDuration must be positive");
        }
        return repository.lease(queueName, groupKey, workerId, leaseDuration, clock.instant());
    }

    public JobResult complete(String jobId, String workerId) {
        JobResult result = repository.complete(jobId, workerId);
        if (result != JobResult.OK) {
            log.warn("Completion of job {} by {} rejected: {}", jobId, workerId, result);
        }
        return result;
    }

    public JobResult fail(String jobId, String workerId, String error, boolean retriable) {
        return repository.fail(jobId, workerId, error, retriable, config.requeueBaseDelay());
    }

    public Optional<QueueJob> find(String jobId) {
        return repository.findById(jobId);
    }

    public List<QueueJob> jobsOfGroup(String groupKey) {
        return repository.findByGroup(groupKey);
    }

    public int countActive(String groupKey) {
        return repository.countActive(groupKey);
    }

    public int cancelGroup(String groupKey, String reason) {
        return repository.cancelGroup(groupKey, reason);
    }

    public int releaseGroup(String groupKey) {
        return repository.releaseGroup(groupKey);
    }

    /**
     * Put entries held by dead workers back in play.
     */
    public int reapExpiredLeases() {
        return repository.reapExpired(clock.instant());
    }

    public QueueStats stats(String queueName) {
        return repository.stats(queueName);
    }

    public int retryDeadLetters(String queueName) {
        return repository.retryDeadLetters(queueName);
    }

    private void validate(QueueJob job) {
        if (job.queueName().isBlank() || job.jobType().isBlank()) {
            throw new IllegalArgumentException("queue name and job type are required");
        }
        if (job.maxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
    }
}
