package landscape.pipeline.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable job queue envelope.
 */
public final class QueueJob {

    /** Priority levels */
    public static final int PRIORITY_CRITICAL = 1000;
    public static final int PRIORITY_HIGH = 100;
    public static final int PRIORITY_NORMAL = 0;
    public static final int PRIORITY_LOW = -100;

    private final String id;
    private final String queueName;
    private final String jobType;
    private final String payload; // JSON
    private final int priority;
    private final QueueJobStatus status;
    private final int attempts;
    private final int maxAttempts;
    private final String dedupeKey;
    private final String groupKey;
    private final String leaseOwner;
    private final Instant leaseExpiresAt;
    private final Instant scheduledFor;
    private final String lastError;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private QueueJob(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.queueName = Objects.requireNonNull(builder.queueName, "queueName is required");
        this.jobType = Objects.requireNonNull(builder.jobType, "jobType is required");
        this.payload = builder.payload != null ? builder.payload : "{}";
        this.priority = builder.priority;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.attempts = builder.attempts;
        this.maxAttempts = builder.maxAttempts;
        this.dedupeKey = builder.dedupeKey;
        this.groupKey = builder.groupKey;
        this.leaseOwner = builder.leaseOwner;
        this.leaseExpiresAt = builder.leaseExpiresAt;
        this.scheduledFor = builder.scheduledFor;
        this.lastError = builder.lastError;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    public String id() {
        return id;
    }

    public String queueName() {
        return queueName;
    }

    public String jobType() {
        return jobType;
    }

    public String payload() {
        return payload;
    }

    public int priority() {
        return priority;
    }

    public QueueJobStatus status() {
        return status;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public String dedupeKey() {
        return dedupeKey;
    }

    public String groupKey() {
        return groupKey;
    }

    public String leaseOwner() {
        return leaseOwner;
    }

    public Instant leaseExpiresAt() {
        return leaseExpiresAt;
    }

    public Instant scheduledFor() {
        return scheduledFor;
    }

    public String lastError() {
        return lastError;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public boolean canRetry() {
        return attempts < maxAttempts;
    }

    public boolean isLeaseExpired(Instant now) {
        return status == QueueJobStatus.PROCESSING && leaseExpiresAt != null && !leaseExpiresAt.isAfter(now);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .queueName(queueName)
                .jobType(jobType)
                .payload(payload)
                .priority(priority)
                .status(status)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .dedupeKey(dedupeKey)
                .groupKey(groupKey)
                .leaseOwner(leaseOwner)
                .leaseExpiresAt(leaseExpiresAt)
                .scheduledFor(scheduledFor)
                .lastError(lastError)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String queueName;
        private String jobType;
        private String payload;
        private int priority = PRIORITY_NORMAL;
        private QueueJobStatus status = QueueJobStatus.PENDING;
        private int attempts;
        private int maxAttempts = 3;
        private String dedupeKey;
        private String groupKey;
        private String leaseOwner;
        private Instant leaseExpiresAt;
        private Instant scheduledFor;
        private String lastError;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder queueName(String queueName) {
            this.queueName = queueName;
            return this;
        }

        public Builder jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(QueueJobStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder dedupeKey(String dedupeKey) {
            this.dedupeKey = dedupeKey;
            return this;
        }

        public Builder groupKey(String groupKey) {
            this.groupKey = groupKey;
            return this;
        }

        public Builder leaseOwner(String leaseOwner) {
            this.leaseOwner = leaseOwner;
            return this;
        }

        public Builder leaseExpiresAt(Instant leaseExpiresAt) {
            this.leaseExpiresAt = leaseExpiresAt;
            return this;
        }

        public Builder scheduledFor(Instant scheduledFor) {
            this.scheduledFor = scheduledFor;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public QueueJob build() {
            return new QueueJob(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return id.equals(((QueueJob) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "QueueJob{id='" + id + "', queue=" + queueName + ", type=" + jobType + ", status=" + status
                + ", attempts=" + attempts + "/" + maxAttempts + "}";
    }
}
