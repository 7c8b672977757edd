package landscape.pipeline.scheduler;

import landscape.pipeline.config.ExecutionConfig;
import landscape.pipeline.config.Json;
import landscape.pipeline.config.PhaseSettings;
import landscape.pipeline.config.PipelineConfig;
import landscape.pipeline.model.ExecutionStatus;
import landscape.pipeline.model.PhaseState;
import landscape.pipeline.model.PhaseStatus;
import landscape.pipeline.model.PipelineExecution;
import landscape.pipeline.repository.ExecutionRepository;
import landscape.pipeline.repository.PhaseStateRepository;
import landscape.pipeline.service.StateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Background watchdog for unfinished executions.
 *
 * Reads durable state only, so it sees executions driven by any process:
 * 1. Executions past the maximum pipeline runtime are failed
 * 2. Executions with no live driver heartbeat are resumed
 * 3. RUNNING phases past their timeout plus grace, or with no item writes within the
 *    stuck window, are restarted while attempts remain and failed after that
 */
public class PipelineMonitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PipelineMonitor.class);

    private final ExecutionRepository executions;
    private final PhaseStateRepository phases;
    private final StateTracker tracker;
    private final PipelineRecovery recovery;
    private final PipelineConfig config;
    private final Clock clock;

    public PipelineMonitor(ExecutionRepository executions, PhaseStateRepository phases, StateTracker tracker,
            PipelineRecovery recovery, PipelineConfig config, Clock clock) {
        this.executions = executions;
        this.phases = phases;
        this.tracker = tracker;
        this.recovery = recovery;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            check();
        } catch (Exception e) {
            log.error("Pipeline monitor error", e);
        }
    }

    /**
     * Scan and apply the resulting decisions.
     *
     * @return the decisions applied
     */
    public List<MonitorDecision> check() {
        List<MonitorDecision> decisions = scan();
        for (MonitorDecision decision : decisions) {
            try {
                apply(decision);
            } catch (Exception e) {
                log.error("Failed to apply {} to {}", decision.action(), decision.executionId(), e);
            }
        }
        if (decisions.isEmpty()) {
            log.debug("All executions healthy");
        } else {
            log.info("Pipeline monitor: {} recovery actions", decisions.size());
        }
        return decisions;
    }

    /**
     * Decide what to do about every unfinished execution, without acting.
     */
    public List<MonitorDecision> scan() {
        List<PipelineExecution> candidates = new ArrayList<>(executions.findByStatus(ExecutionStatus.RUNNING));
        candidates.addAll(executions.findByStatus(ExecutionStatus.PENDING));

        List<MonitorDecision> decisions = new ArrayList<>();
        for (PipelineExecution execution : candidates) {
            decide(execution, decisions);
        }
        return decisions;
    }

    private void decide(PipelineExecution execution, List<MonitorDecision> decisions) {
        Instant now = clock.instant();
        String executionId = execution.id();

        Instant startedAt = execution.startedAt() != null ? execution.startedAt() : execution.createdAt();
        if (startedAt != null && Duration.between(startedAt, now).compareTo(config.maxPipelineRuntime()) > 0) {
            decisions.add(MonitorDecision.failExecution(executionId,
                    "pipeline exceeded maximum runtime of " + config.maxPipelineRuntime().toHours() + "h"));
            return;
        }

        Instant staleBefore = now.minus(config.driverStaleAfter());
        if (!execution.hasLiveDriver(staleBefore)) {
            boolean justCreated = execution.status() == ExecutionStatus.PENDING
                    && execution.createdAt() != null && execution.createdAt().isAfter(staleBefore);
            if (!justCreated) {
                decisions.add(MonitorDecision.resume(executionId, execution.driverId() == null
                        ? "no driver"
                        : "driver " + execution.driverId() + " stopped sending heartbeats"));
            }
            return;
        }

        ExecutionConfig executionConfig = Json.read(execution.configJson(), ExecutionConfig.class);
        for (PhaseState phase : phases.findByExecution(executionId)) {
            if (phase.status() != PhaseStatus.RUNNING || phase.startedAt() == null) {
                continue;
            }
            String problem = phaseProblem(executionId, phase, executionConfig.settingsFor(phase.phase()), now);
            if (problem == null) {
                continue;
            }
            if (phase.attempts() < config.maxPhaseAttempts()) {
                decisions.add(MonitorDecision.restartPhase(executionId, phase.phase(), problem));
            } else {
                decisions.add(MonitorDecision.failPhase(executionId, phase.phase(),
                        problem + " after " + phase.attempts() + " attempts"));
            }
        }
    }

    private String phaseProblem(String executionId, PhaseState phase, PhaseSettings settings, Instant now) {
        Duration elapsed = Duration.between(phase.startedAt(), now);
        Duration limit = settings.timeout().plus(config.timeoutGrace());
        if (elapsed.compareTo(limit) > 0) {
            return "phase " + phase.phase().key() + " timed out after " + elapsed.toMinutes() + " min";
        }

        Instant lastActivity = tracker.lastActivity(executionId, phase.phase())
                .filter(at -> at.isAfter(phase.startedAt()))
                .orElse(phase.startedAt());
        if (lastActivity.isBefore(now.minus(config.stuckWindow()))) {
            return "phase " + phase.phase().key() + " stuck, no progress since " + lastActivity;
        }
        return null;
    }

    private void apply(MonitorDecision decision) {
        log.warn("{} for execution {}{}: {}", decision.action(), decision.executionId(),
                decision.phase() != null ? " phase " + decision.phase().key() : "", decision.reason());
        switch (decision.action()) {
            case RESTART_PHASE:
                recovery.restartPhase(decision.executionId(), decision.phase());
                break;
            case FAIL_PHASE:
                recovery.failPhase(decision.executionId(), decision.phase(), decision.reason());
                break;
            case RESUME_EXECUTION:
                recovery.resumeExecution(decision.executionId());
                break;
            case FAIL_EXECUTION:
                recovery.failExecution(decision.executionId(), decision.reason());
                break;
            default:
                throw new IllegalStateException("Unknown monitor action " + decision.action());
        }
    }
}
