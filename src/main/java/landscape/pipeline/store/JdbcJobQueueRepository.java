package landscape.pipeline.store;

import landscape.pipeline.model.JobResult;
import landscape.pipeline.model.QueueJob;
import landscape.pipeline.model.QueueJobStatus;
import landscape.pipeline.model.QueueStats;
import landscape.pipeline.repository.JobQueueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static landscape.pipeline.store.JdbcSupport.setTimestamp;
import static landscape.pipeline.store.JdbcSupport.toInstant;
import static landscape.pipeline.store.JdbcSupport.truncate;

/**
 * JDBC implementation of JobQueueRepository.
 *
 * Leasing is a compare-and-swap: candidates are read without locks, then each is claimed
 * with an UPDATE whose WHERE clause re-checks eligibility. Only one concurrent claimer can
 * see an update count of 1 for a given row.
 */
public class JdbcJobQueueRepository implements JobQueueRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobQueueRepository.class);

    private static final int LEASE_CANDIDATES = 10;
    private static final Duration MAX_REQUEUE_DELAY = Duration.ofHours(1);

    private static final String ELIGIBLE = """
            ((status = 'PENDING' AND (scheduled_for IS NULL OR scheduled_for <= ?))
              OR (status = 'PROCESSING' AND lease_expires_at <= ?))
            """;

    private final Database db;

    public JdbcJobQueueRepository(Database db) {
        this.db = db;
    }

    @Override
    public String insert(QueueJob job) {
        try (Connection conn = db.getConnection()) {
            try {
                String id = insertDeduped(conn, job);
                conn.commit();
                return id;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to enqueue job: " + job.id(), e);
        }
    }

    @Override
    public int insertAll(List<QueueJob> jobs) {
        if (jobs.isEmpty())
            return 0;

        try (Connection conn = db.getConnection()) {
            try {
                int inserted = 0;
                for (QueueJob job : jobs) {
                    if (job.id().equals(insertDeduped(conn, job))) {
                        inserted++;
                    }
                }
                conn.commit();
                log.debug("Enqueued {} of {} jobs", inserted, jobs.size());
                return inserted;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to enqueue jobs batch", e);
        }
    }

    private String insertDeduped(Connection conn, QueueJob job) throws SQLException {
        if (job.dedupeKey() != null) {
            String activeSql = """
                        SELECT id FROM job_queue
                        WHERE dedupe_key = ? AND status IN ('PENDING', 'PROCESSING')
                        LIMIT 1
                    """;
            try (PreparedStatement ps = conn.prepareStatement(activeSql)) {
                ps.setString(1, job.dedupeKey());
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return rs.getString(1);
                    }
                }
            }
        }

        String sql = """
                    INSERT INTO job_queue (id, queue_name, job_type, payload, priority, status, attempts, max_attempts,
                                           dedupe_key, group_key, scheduled_for, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            Instant now = Instant.now();
            ps.setString(1, job.id());
            ps.setString(2, job.queueName());
            ps.setString(3, job.jobType());
            ps.setString(4, job.payload());
            ps.setInt(5, job.priority());
            ps.setString(6, job.status().name());
            ps.setInt(7, job.attempts());
            ps.setInt(8, job.maxAttempts());
            ps.setString(9, job.dedupeKey());
            ps.setString(10, job.groupKey());
            setTimestamp(ps, 11, job.scheduledFor() != null ? job.scheduledFor() : now);
            setTimestamp(ps, 12, job.createdAt() != null ? job.createdAt() : now);
            ps.executeUpdate();
        }
        return job.id();
    }

    @Override
    public Optional<QueueJob> findById(String jobId) {
        String sql = "SELECT * FROM job_queue WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            return findOne(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<QueueJob> findByGroup(String groupKey) {
        String sql = "SELECT * FROM job_queue WHERE group_key = ? ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, groupKey);
            List<QueueJob> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs of group: " + groupKey, e);
        }
    }

    @Override
    public Optional<QueueJob> lease(String queueName, String groupKey, String workerId, Duration leaseDuration,
            Instant now) {
        String selectSql = "SELECT id, status, attempts, max_attempts FROM job_queue WHERE queue_name = ?"
                + (groupKey != null ? " AND group_key = ?" : "")
                + " AND " + ELIGIBLE
                + " ORDER BY priority DESC, created_at, id LIMIT " + LEASE_CANDIDATES;

        String claimSql = """
                    UPDATE job_queue
                    SET status = 'PROCESSING', lease_owner = ?, lease_expires_at = ?, attempts = attempts + 1,
                        started_at = ?
                    WHERE id = ? AND
                """ + ELIGIBLE;

        String deadLetterSql = """
                    UPDATE job_queue
                    SET status = 'DEAD_LETTER', lease_expires_at = NULL, completed_at = ?,
                        last_error = COALESCE(last_error, 'lease expired on final attempt')
                    WHERE id = ? AND status = 'PROCESSING' AND lease_expires_at <= ? AND attempts >= max_attempts
                """;

        Timestamp ts = Timestamp.from(now);

        try (Connection conn = db.getConnection()) {
            List<String[]> candidates = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                int i = 1;
                ps.setString(i++, queueName);
                if (groupKey != null) {
                    ps.setString(i++, groupKey);
                }
                ps.setTimestamp(i++, ts);
                ps.setTimestamp(i, ts);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        boolean exhausted = QueueJobStatus.PROCESSING.name().equals(rs.getString("status"))
                                && rs.getInt("attempts") >= rs.getInt("max_attempts");
                        candidates.add(new String[] { rs.getString("id"), exhausted ? "dead" : "claim" });
                    }
                }
            }
            conn.commit();

            for (String[] candidate : candidates) {
                String id = candidate[0];

                if ("dead".equals(candidate[1])) {
                    try (PreparedStatement ps = conn.prepareStatement(deadLetterSql)) {
                        ps.setTimestamp(1, ts);
                        ps.setString(2, id);
                        ps.setTimestamp(3, ts);
                        if (ps.executeUpdate() > 0) {
                            log.warn("Job {} dead-lettered: lease expired on its final attempt", id);
                        }
                    }
                    conn.commit();
                    continue;
                }

                int claimed;
                try (PreparedStatement ps = conn.prepareStatement(claimSql)) {
                    ps.setString(1, workerId);
                    ps.setTimestamp(2, Timestamp.from(now.plus(leaseDuration)));
                    ps.setTimestamp(3, ts);
                    ps.setString(4, id);
                    ps.setTimestamp(5, ts);
                    ps.setTimestamp(6, ts);
                    claimed = ps.executeUpdate();
                }
                conn.commit();

                if (claimed == 1) {
                    try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM job_queue WHERE id = ?")) {
                        ps.setString(1, id);
                        Optional<QueueJob> job = findOne(ps);
                        conn.commit();
                        log.debug("Job {} leased by {} on queue {}", id, workerId, queueName);
                        return job;
                    }
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to lease from queue: " + queueName, e);
        }
    }

    @Override
    public JobResult complete(String jobId, String workerId) {
        String sql = """
                    UPDATE job_queue
                    SET status = 'COMPLETED', completed_at = ?, lease_expires_at = NULL
                    WHERE id = ? AND lease_owner = ? AND status = 'PROCESSING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, jobId);
            ps.setString(3, workerId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                return JobResult.OK;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete job: " + jobId, e);
        }

        return findById(jobId).isPresent() ? JobResult.NOT_OWNER : JobResult.NOT_FOUND;
    }

    @Override
    public JobResult fail(String jobId, String workerId, String error, boolean retriable, Duration requeueBase) {
        Optional<QueueJob> jobOpt = findById(jobId);
        if (jobOpt.isEmpty()) {
            return JobResult.NOT_FOUND;
        }

        QueueJob job = jobOpt.get();
        if (job.status() != QueueJobStatus.PROCESSING || !workerId.equals(job.leaseOwner())) {
            log.warn("Worker {} tried to fail job {} but it is {} owned by {}",
                    workerId, jobId, job.status(), job.leaseOwner());
            return JobResult.NOT_OWNER;
        }

        JobResult result;
        QueueJobStatus next;
        Instant scheduledFor = null;
        if (!retriable) {
            result = JobResult.FAILED;
            next = QueueJobStatus.FAILED;
        } else if (!job.canRetry()) {
            result = JobResult.DEAD_LETTERED;
            next = QueueJobStatus.DEAD_LETTER;
        } else {
            result = JobResult.REQUEUED;
            next = QueueJobStatus.PENDING;
            scheduledFor = Instant.now().plus(requeueDelay(requeueBase, job.attempts()));
        }

        String sql = """
                    UPDATE job_queue
                    SET status = ?, last_error = ?, scheduled_for = COALESCE(?, scheduled_for),
                        lease_owner = CASE WHEN ? = 'PENDING' THEN NULL ELSE lease_owner END,
                        lease_expires_at = NULL, completed_at = ?
                    WHERE id = ? AND lease_owner = ? AND status = 'PROCESSING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, next.name());
            ps.setString(2, truncate(error));
            setTimestamp(ps, 3, scheduledFor);
            ps.setString(4, next.name());
            setTimestamp(ps, 5, next == QueueJobStatus.PENDING ? null : Instant.now());
            ps.setString(6, jobId);
            ps.setString(7, workerId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                return JobResult.NOT_OWNER;
            }
            if (result == JobResult.DEAD_LETTERED) {
                log.warn("Job {} moved to dead letter after {} attempts: {}", jobId, job.attempts(), error);
            }
            return result;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to fail job: " + jobId, e);
        }
    }

    static Duration requeueDelay(Duration base, int attempts) {
        int exponent = Math.max(0, Math.min(attempts - 1, 20));
        Duration delay = base.multipliedBy(1L << exponent);
        return delay.compareTo(MAX_REQUEUE_DELAY) > 0 ? MAX_REQUEUE_DELAY : delay;
    }

    @Override
    public int countActive(String groupKey) {
        String sql = "SELECT COUNT(*) FROM job_queue WHERE group_key = ? AND status IN ('PENDING', 'PROCESSING')";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, groupKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count active jobs of group: " + groupKey, e);
        }
    }

    @Override
    public int cancelGroup(String groupKey, String reason) {
        String sql = """
                    UPDATE job_queue
                    SET status = 'FAILED', last_error = ?, completed_at = ?, lease_expires_at = NULL
                    WHERE group_key = ? AND status IN ('PENDING', 'PROCESSING')
                """;
        return executeGroupUpdate(sql, groupKey, reason, "cancel");
    }

    @Override
    public int releaseGroup(String groupKey) {
        String sql = """
                    UPDATE job_queue
                    SET status = 'PENDING', lease_owner = NULL, lease_expires_at = NULL, scheduled_for = ?
                    WHERE group_key = ? AND status = 'PROCESSING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, groupKey);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.info("Released {} leased jobs of group {}", updated, groupKey);
            }
            return updated;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release jobs of group: " + groupKey, e);
        }
    }

    private int executeGroupUpdate(String sql, String groupKey, String reason, String action) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, truncate(reason));
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, groupKey);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.info("{} {} jobs of group {}: {}", action, updated, groupKey, reason);
            }
            return updated;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + action + " jobs of group: " + groupKey, e);
        }
    }

    @Override
    public int reapExpired(Instant now) {
        String deadSql = """
                    UPDATE job_queue
                    SET status = 'DEAD_LETTER', lease_expires_at = NULL, completed_at = ?,
                        last_error = COALESCE(last_error, 'lease expired on final attempt')
                    WHERE status = 'PROCESSING' AND lease_expires_at <= ? AND attempts >= max_attempts
                """;
        String resetSql = """
                    UPDATE job_queue
                    SET status = 'PENDING', lease_owner = NULL, lease_expires_at = NULL
                    WHERE status = 'PROCESSING' AND lease_expires_at <= ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                Timestamp ts = Timestamp.from(now);
                int dead;
                int reset;
                try (PreparedStatement ps = conn.prepareStatement(deadSql)) {
                    ps.setTimestamp(1, ts);
                    ps.setTimestamp(2, ts);
                    dead = ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(resetSql)) {
                    ps.setTimestamp(1, ts);
                    reset = ps.executeUpdate();
                }
                conn.commit();

                if (dead + reset > 0) {
                    log.info("Queue reaper: {} expired leases requeued, {} dead-lettered", reset, dead);
                }
                return dead + reset;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reap expired leases", e);
        }
    }

    @Override
    public QueueStats stats(String queueName) {
        String sql = """
                    SELECT status, COUNT(*) AS cnt, MIN(created_at) AS oldest
                    FROM job_queue WHERE queue_name = ? GROUP BY status
                """;

        int pending = 0;
        int processing = 0;
        int completed = 0;
        int failed = 0;
        int deadLetter = 0;
        Instant oldestPending = null;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queueName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int count = rs.getInt("cnt");
                    switch (QueueJobStatus.valueOf(rs.getString("status"))) {
                        case PENDING:
                            pending = count;
                            oldestPending = toInstant(rs.getTimestamp("oldest"));
                            break;
                        case PROCESSING:
                            processing = count;
                            break;
                        case COMPLETED:
                            completed = count;
                            break;
                        case FAILED:
                            failed = count;
                            break;
                        case DEAD_LETTER:
                            deadLetter = count;
                            break;
                        default:
                            break;
                    }
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to compute stats of queue: " + queueName, e);
        }

        return new QueueStats(queueName, pending, processing, completed, failed, deadLetter, oldestPending);
    }

    @Override
    public int retryDeadLetters(String queueName) {
        String sql = """
                    UPDATE job_queue
                    SET status = 'PENDING', attempts = 0, lease_owner = NULL, lease_expires_at = NULL,
                        scheduled_for = ?, completed_at = NULL
                    WHERE queue_name = ? AND status = 'DEAD_LETTER'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, queueName);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.info("Requeued {} dead letters of queue {}", updated, queueName);
            }
            return updated;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to retry dead letters of queue: " + queueName, e);
        }
    }

    // Helper methods

    private Optional<QueueJob> findOne(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                return Optional.of(mapRow(rs));
            }
        }
        return Optional.empty();
    }

    private QueueJob mapRow(ResultSet rs) throws SQLException {
        return QueueJob.builder()
                .id(rs.getString("id"))
                .queueName(rs.getString("queue_name"))
                .jobType(rs.getString("job_type"))
                .payload(rs.getString("payload"))
                .priority(rs.getInt("priority"))
                .status(QueueJobStatus.valueOf(rs.getString("status")))
                .attempts(rs.getInt("attempts"))
                .maxAttempts(rs.getInt("max_attempts"))
                .dedupeKey(rs.getString("dedupe_key"))
                .groupKey(rs.getString("group_key"))
                .leaseOwner(rs.getString("lease_owner"))
                .leaseExpiresAt(toInstant(rs.getTimestamp("lease_expires_at")))
                .scheduledFor(toInstant(rs.getTimestamp("scheduled_for")))
                .lastError(rs.getString("last_error"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build();
    }
}
