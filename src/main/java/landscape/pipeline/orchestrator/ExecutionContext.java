package landscape.pipeline.orchestrator;

import landscape.pipeline.config.ExecutionConfig;
import landscape.pipeline.model.PhaseName;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Execution-scoped state shared by the orchestrator, phase runners and handlers of one run.
 * Holds only the requests other threads send to a running execution; everything else lives
 * in the durable store.
 */
public final class ExecutionContext {

    private final String executionId;
    private final ExecutionConfig config;
    private final String driverId;

    private volatile boolean cancelRequested;
    private volatile boolean relinquished;
    private final Map<PhaseName, Boolean> restartRequests = new ConcurrentHashMap<>();
    private final Map<PhaseName, String> failRequests = new ConcurrentHashMap<>();

    public ExecutionContext(String executionId, ExecutionConfig config, String driverId) {
        this.executionId = executionId;
        this.config = config;
        this.driverId = driverId;
    }

    public String executionId() {
        return executionId;
    }

    public ExecutionConfig config() {
        return config;
    }

    /** Orchestrator instance driving this run */
    public String driverId() {
        return driverId;
    }

    /** Free-form execution parameter, e.g. the landscape id */
    public String parameter(String key) {
        return config.parameters().get(key);
    }

    public void requestCancel() {
        cancelRequested = true;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    /**
     * Another driver owns the execution now. Phases stop without writing a final status.
     */
    public void relinquish() {
        relinquished = true;
    }

    public boolean isRelinquished() {
        return relinquished;
    }

    public void requestRestart(PhaseName phase) {
        restartRequests.put(phase, Boolean.TRUE);
    }

    public boolean isRestartRequested(PhaseName phase) {
        return restartRequests.containsKey(phase);
    }

    public void clearRestart(PhaseName phase) {
        restartRequests.remove(phase);
    }

    public void requestFail(PhaseName phase, String reason) {
        failRequests.put(phase, reason);
    }

    public Optional<String> failRequest(PhaseName phase) {
        return Optional.ofNullable(failRequests.get(phase));
    }
}
