package landscape.pipeline.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Item-level progress row: one per (execution, phase, item identifier).
 */
public final class ItemState {
    private final String executionId;
    private final PhaseName phase;
    private final String itemId;
    private final ItemStatus status;
    private final int attemptCount;
    private final int maxAttempts;
    private final boolean degraded;
    private final String lastError;
    private final ErrorCategory errorCategory;
    private final String progressData; // JSON
    private final Instant lastAttemptAt;
    private final Instant completedAt;
    private final Instant updatedAt;

    private ItemState(Builder builder) {
        this.executionId = Objects.requireNonNull(builder.executionId, "executionId is required");
        this.phase = Objects.requireNonNull(builder.phase, "phase is required");
        this.itemId = Objects.requireNonNull(builder.itemId, "itemId is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.attemptCount = builder.attemptCount;
        this.maxAttempts = builder.maxAttempts;
        this.degraded = builder.degraded;
        this.lastError = builder.lastError;
        this.errorCategory = builder.errorCategory;
        this.progressData = builder.progressData;
        this.lastAttemptAt = builder.lastAttemptAt;
        this.completedAt = builder.completedAt;
        this.updatedAt = builder.updatedAt;
    }

    public String executionId() {
        return executionId;
    }

    public PhaseName phase() {
        return phase;
    }

    public String itemId() {
        return itemId;
    }

    public ItemStatus status() {
        return status;
    }

    public int attemptCount() {
        return attemptCount;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean degraded() {
        return degraded;
    }

    public String lastError() {
        return lastError;
    }

    public ErrorCategory errorCategory() {
        return errorCategory;
    }

    public String progressData() {
        return progressData;
    }

    public Instant lastAttemptAt() {
        return lastAttemptAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Failed with a retryable error and still under the attempt ceiling */
    public boolean isRetryable() {
        return status == ItemStatus.FAILED && attemptCount < maxAttempts
                && errorCategory != ErrorCategory.NON_RECOVERABLE;
    }

    /** Completed, skipped, or failed with attempts exhausted */
    public boolean isTerminal() {
        return status == ItemStatus.COMPLETED
                || status == ItemStatus.SKIPPED
                || (status == ItemStatus.FAILED && !isRetryable());
    }

    public Builder toBuilder() {
        return new Builder()
                .executionId(executionId)
                .phase(phase)
                .itemId(itemId)
                .status(status)
                .attemptCount(attemptCount)
                .maxAttempts(maxAttempts)
                .degraded(degraded)
                .lastError(lastError)
                .errorCategory(errorCategory)
                .progressData(progressData)
                .lastAttemptAt(lastAttemptAt)
                .completedAt(completedAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String executionId;
        private PhaseName phase;
        private String itemId;
        private ItemStatus status = ItemStatus.PENDING;
        private int attemptCount;
        private int maxAttempts = 3;
        private boolean degraded;
        private String lastError;
        private ErrorCategory errorCategory;
        private String progressData;
        private Instant lastAttemptAt;
        private Instant completedAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder phase(PhaseName phase) {
            this.phase = phase;
            return this;
        }

        public Builder itemId(String itemId) {
            this.itemId = itemId;
            return this;
        }

        public Builder status(ItemStatus status) {
            this.status = status;
            return this;
        }

        public Builder attemptCount(int attemptCount) {
            this.attemptCount = attemptCount;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder degraded(boolean degraded) {
            this.degraded = degraded;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder errorCategory(ErrorCategory errorCategory) {
            this.errorCategory = errorCategory;
            return this;
        }

        public Builder progressData(String progressData) {
            this.progressData = progressData;
            return this;
        }

        public Builder lastAttemptAt(Instant lastAttemptAt) {
            this.lastAttemptAt = lastAttemptAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ItemState build() {
            return new ItemState(this);
        }
    }

    @Override
    public String toString() {
        return "ItemState{" + phase + ":" + itemId + " " + status + ", attempts=" + attemptCount + "/" + maxAttempts
                + "}";
    }
}
