package landscape.pipeline.scheduler;

import landscape.pipeline.model.PhaseName;

/**
 * Recovery actions the monitor can take. Implemented by the pipeline service.
 */
public interface PipelineRecovery {

    /**
     * Stop a phase's in-flight work and run it again, continuing from its remaining items.
     */
    void restartPhase(String executionId, PhaseName phase);

    void failPhase(String executionId, PhaseName phase, String reason);

    /**
     * Re-enter the orchestrator for an execution nobody is driving.
     */
    void resumeExecution(String executionId);

    void failExecution(String executionId, String reason);
}
