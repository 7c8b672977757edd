package landscape.pipeline.repository;

import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseState;
import landscape.pipeline.model.PhaseStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for per-phase status records.
 */
public interface PhaseStateRepository {

    /**
     * Insert the given rows, leaving existing (execution, phase) rows untouched.
     *
     * @return number of rows inserted
     */
    int insertMissing(List<PhaseState> states);

    Optional<PhaseState> find(String executionId, PhaseName phase);

    /**
     * All phase rows of an execution, in phase order.
     */
    List<PhaseState> findByExecution(String executionId);

    /**
     * Compare-and-set status transition.
     * Entering RUNNING increments attempts and stamps started_at;
     * entering a terminal status stamps completed_at.
     *
     * @param from          statuses the row must currently have
     * @param to            new status
     * @param lastError     error to record, or null to clear
     * @param blockedReason reason to record, or null to clear
     * @return true if the row was in one of {@code from} and was updated
     */
    boolean transition(String executionId, PhaseName phase, Set<PhaseStatus> from, PhaseStatus to,
            String lastError, String blockedReason);

    /**
     * Remember that the phase's work items have been registered.
     */
    void markEnumerated(String executionId, PhaseName phase, int itemsTotal);

    void updateCounters(String executionId, PhaseName phase, int itemsTotal, int itemsSucceeded, int itemsFailed);
}
