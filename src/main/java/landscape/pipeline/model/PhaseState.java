package landscape.pipeline.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Status record of one phase within one execution.
 */
public final class PhaseState {
    private final String executionId;
    private final PhaseName phase;
    private final PhaseStatus status;
    private final int attempts;
    private final boolean enumerated;
    private final int itemsTotal;
    private final int itemsSucceeded;
    private final int itemsFailed;
    private final String lastError;
    private final String blockedReason;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant updatedAt;

    private PhaseState(Builder builder) {
        this.executionId = Objects.requireNonNull(builder.executionId, "executionId is required");
        this.phase = Objects.requireNonNull(builder.phase, "phase is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.attempts = builder.attempts;
        this.enumerated = builder.enumerated;
        this.itemsTotal = builder.itemsTotal;
        this.itemsSucceeded = builder.itemsSucceeded;
        this.itemsFailed = builder.itemsFailed;
        this.lastError = builder.lastError;
        this.blockedReason = builder.blockedReason;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.updatedAt = builder.updatedAt;
    }

    public String executionId() {
        return executionId;
    }

    public PhaseName phase() {
        return phase;
    }

    public PhaseStatus status() {
        return status;
    }

    public int attempts() {
        return attempts;
    }

    public boolean enumerated() {
        return enumerated;
    }

    public int itemsTotal() {
        return itemsTotal;
    }

    public int itemsSucceeded() {
        return itemsSucceeded;
    }

    public int itemsFailed() {
        return itemsFailed;
    }

    public String lastError() {
        return lastError;
    }

    public String blockedReason() {
        return blockedReason;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .executionId(executionId)
                .phase(phase)
                .status(status)
                .attempts(attempts)
                .enumerated(enumerated)
                .itemsTotal(itemsTotal)
                .itemsSucceeded(itemsSucceeded)
                .itemsFailed(itemsFailed)
                .lastError(lastError)
                .blockedReason(blockedReason)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String executionId;
        private PhaseName phase;
        private PhaseStatus status = PhaseStatus.PENDING;
        private int attempts;
        private boolean enumerated;
        private int itemsTotal;
        private int itemsSucceeded;
        private int itemsFailed;
        private String lastError;
        private String blockedReason;
        private Instant startedAt;
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

        public Builder status(PhaseStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder enumerated(boolean enumerated) {
            this.enumerated = enumerated;
            return this;
        }

        public Builder itemsTotal(int itemsTotal) {
            this.itemsTotal = itemsTotal;
            return this;
        }

        public Builder itemsSucceeded(int itemsSucceeded) {
            this.itemsSucceeded = itemsSucceeded;
            return this;
        }

        public Builder itemsFailed(int itemsFailed) {
            this.itemsFailed = itemsFailed;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder blockedReason(String blockedReason) {
            this.blockedReason = blockedReason;
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

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public PhaseState build() {
            return new PhaseState(this);
        }
    }

    @Override
    public String toString() {
        return "PhaseState{" + executionId + "/" + phase + " " + status + ", attempts=" + attempts + "}";
    }
}
