package landscape.pipeline.repository;

import landscape.pipeline.model.ExecutionStatus;
import landscape.pipeline.model.PipelineExecution;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for pipeline execution records.
 * Every mutating method refuses to touch an execution that is already terminal.
 */
public interface ExecutionRepository {

    /**
     * Save a new execution.
     *
     * @param execution the execution to save
     */
    void save(PipelineExecution execution);

    /**
     * Find an execution by ID.
     *
     * @param executionId the execution ID
     * @return the execution if found
     */
    Optional<PipelineExecution> findById(String executionId);

    /**
     * Find executions by status, oldest first.
     */
    List<PipelineExecution> findByStatus(ExecutionStatus status);

    /**
     * Most recently created executions first.
     */
    List<PipelineExecution> findRecent(int limit);

    /**
     * Claim the execution for a driver: PENDING or RUNNING becomes RUNNING,
     * driver and heartbeat are set, started_at is kept if already set.
     * The claim only succeeds while no driver holds the execution or the current
     * driver's heartbeat is older than {@code staleBefore}.
     *
     * @return true if the execution was claimed
     */
    boolean markRunning(String executionId, String driverId, Instant staleBefore);

    /**
     * Refresh the driver heartbeat.
     *
     * @return false if the execution is terminal or driven by someone else
     */
    boolean heartbeat(String executionId, String driverId);

    /**
     * Clear the driver if it is still the given one.
     */
    void releaseDriver(String executionId, String driverId);

    /**
     * Set the durable cancel flag.
     *
     * @return true if the execution was non-terminal
     */
    boolean requestCancel(String executionId);

    /**
     * Move to a terminal status.
     *
     * @return true if the execution was non-terminal and is now finished
     */
    boolean finish(String executionId, ExecutionStatus status, String errorMessage);
}
