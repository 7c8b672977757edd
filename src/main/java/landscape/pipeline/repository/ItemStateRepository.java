package landscape.pipeline.repository;

import landscape.pipeline.model.ItemState;
import landscape.pipeline.model.ItemStatus;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseProgress;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for item-level pipeline state.
 * Rows are keyed by (execution, phase, item) and never deleted.
 */
public interface ItemStateRepository {

    /**
     * Insert rows for items not yet known. Existing rows keep their status.
     *
     * @return number of new rows
     */
    int insertMissing(List<ItemState> items);

    /**
     * Keyed upsert of an item's status, error and payload.
     * Does not touch attempt counters.
     */
    void upsert(ItemState item);

    /**
     * Start an attempt: status PROCESSING, attempt_count + 1.
     *
     * @return false if the item is missing or already completed/skipped
     */
    boolean markProcessing(String executionId, PhaseName phase, String itemId, Instant now);

    /**
     * Move PENDING or FAILED items to QUEUED.
     */
    int markQueued(String executionId, PhaseName phase, List<String> itemIds);

    Optional<ItemState> find(String executionId, PhaseName phase, String itemId);

    List<ItemState> findByPhase(String executionId, PhaseName phase);

    /**
     * Items not yet terminal: in flight, or failed with a retryable error under the attempt ceiling.
     */
    List<ItemState> findRemaining(String executionId, PhaseName phase);

    /**
     * Failed items with their errors, newest first.
     */
    List<ItemState> findFailed(String executionId, PhaseName phase, int limit);

    PhaseProgress progress(String executionId, PhaseName phase);

    Map<PhaseName, PhaseProgress> progressByExecution(String executionId);

    int countByStatus(String executionId, PhaseName phase, ItemStatus status);

    /**
     * Newest write to any item of the phase, or empty if it has no items.
     */
    Optional<Instant> lastActivity(String executionId, PhaseName phase);
}
