package landscape.pipeline.events;

import landscape.pipeline.model.ExecutionStatus;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseProgress;
import landscape.pipeline.model.PhaseStatus;

import java.time.Instant;

/**
 * Status change emitted by the orchestrator for real-time consumers.
 * Fields that do not apply to the event type are null.
 */
public record PipelineEvent(
        Type type,
        String executionId,
        PhaseName phase,
        PhaseStatus phaseStatus,
        ExecutionStatus executionStatus,
        PhaseProgress progress,
        String message,
        Instant timestamp) {

    public enum Type {
        EXECUTION_STARTED,
        PHASE_STATUS_CHANGED,
        PHASE_PROGRESS,
        EXECUTION_FINISHED
    }

    public static PipelineEvent executionStarted(String executionId) {
        return new PipelineEvent(Type.EXECUTION_STARTED, executionId, null, null, ExecutionStatus.RUNNING, null,
                null, Instant.now());
    }

    public static PipelineEvent phaseChanged(String executionId, PhaseName phase, PhaseStatus status,
            String message) {
        return new PipelineEvent(Type.PHASE_STATUS_CHANGED, executionId, phase, status, null, null, message,
                Instant.now());
    }

    public static PipelineEvent phaseProgress(String executionId, PhaseProgress progress) {
        return new PipelineEvent(Type.PHASE_PROGRESS, executionId, progress.phase(), PhaseStatus.RUNNING, null,
                progress, null, Instant.now());
    }

    public static PipelineEvent executionFinished(String executionId, ExecutionStatus status, String message) {
        return new PipelineEvent(Type.EXECUTION_FINISHED, executionId, null, null, status, null, message,
                Instant.now());
    }
}
