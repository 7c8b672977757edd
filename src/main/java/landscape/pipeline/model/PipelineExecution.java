package landscape.pipeline.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable aggregate root for one triggered pipeline run.
 * Mutated only through the orchestrator; frozen once terminal.
 */
public final class PipelineExecution {
    private final String id;
    private final TriggerMode triggerMode;
    private final ExecutionStatus status;
    private final String configJson; // serialized ExecutionConfig
    private final boolean cancelRequested;
    private final String driverId; // orchestrator instance currently driving the run
    private final Instant heartbeatAt;
    private final String errorMessage;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    private PipelineExecution(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.triggerMode = Objects.requireNonNull(builder.triggerMode, "triggerMode is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.configJson = Objects.requireNonNull(builder.configJson, "configJson is required");
        this.cancelRequested = builder.cancelRequested;
        this.driverId = builder.driverId;
        this.heartbeatAt = builder.heartbeatAt;
        this.errorMessage = builder.errorMessage;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public TriggerMode triggerMode() {
        return triggerMode;
    }

    public ExecutionStatus status() {
        return status;
    }

    public String configJson() {
        return configJson;
    }

    public boolean cancelRequested() {
        return cancelRequested;
    }

    public String driverId() {
        return driverId;
    }

    public Instant heartbeatAt() {
        return heartbeatAt;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** True if some orchestrator refreshed its heartbeat after the given cutoff */
    public boolean hasLiveDriver(Instant staleBefore) {
        return driverId != null && heartbeatAt != null && heartbeatAt.isAfter(staleBefore);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .triggerMode(triggerMode)
                .status(status)
                .configJson(configJson)
                .cancelRequested(cancelRequested)
                .driverId(driverId)
                .heartbeatAt(heartbeatAt)
                .errorMessage(errorMessage)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private TriggerMode triggerMode = TriggerMode.MANUAL;
        private ExecutionStatus status = ExecutionStatus.PENDING;
        private String configJson;
        private boolean cancelRequested;
        private String driverId;
        private Instant heartbeatAt;
        private String errorMessage;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder triggerMode(TriggerMode triggerMode) {
            this.triggerMode = triggerMode;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder configJson(String configJson) {
            this.configJson = configJson;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder driverId(String driverId) {
            this.driverId = driverId;
            return this;
        }

        public Builder heartbeatAt(Instant heartbeatAt) {
            this.heartbeatAt = heartbeatAt;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
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

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public PipelineExecution build() {
            return new PipelineExecution(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        PipelineExecution that = (PipelineExecution) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "PipelineExecution{id='" + id + "', status=" + status + ", trigger=" + triggerMode + "}";
    }
}
