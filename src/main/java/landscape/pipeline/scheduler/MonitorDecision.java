package landscape.pipeline.scheduler;

import landscape.pipeline.model.PhaseName;

/**
 * Recovery action chosen by the pipeline monitor.
 *
 * @param phase null for execution level actions
 */
public record MonitorDecision(Action action, String executionId, PhaseName phase, String reason) {

    public enum Action {
        RESTART_PHASE,
        FAIL_PHASE,
        RESUME_EXECUTION,
        FAIL_EXECUTION
    }

    public static MonitorDecision restartPhase(String executionId, PhaseName phase, String reason) {
        return new MonitorDecision(Action.RESTART_PHASE, executionId, phase, reason);
    }

    public static MonitorDecision failPhase(String executionId, PhaseName phase, String reason) {
        return new MonitorDecision(Action.FAIL_PHASE, executionId, phase, reason);
    }

    public static MonitorDecision resume(String executionId, String reason) {
        return new MonitorDecision(Action.RESUME_EXECUTION, executionId, null, reason);
    }

    public static MonitorDecision failExecution(String executionId, String reason) {
        return new MonitorDecision(Action.FAIL_EXECUTION, executionId, null, reason);
    }
}
