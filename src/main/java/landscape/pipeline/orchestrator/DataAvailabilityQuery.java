package landscape.pipeline.orchestrator;

import landscape.pipeline.model.PhaseName;
import landscape.pipeline.service.StateTracker;

/**
 * Read-only count of produced data, used to evaluate data gates.
 */
@FunctionalInterface
public interface DataAvailabilityQuery {

    long count(String executionId, String dataset);

    /**
     * Counts completed items of the phase whose key is the dataset name.
     */
    static DataAvailabilityQuery completedItems(StateTracker tracker) {
        return (executionId, dataset) -> tracker.progress(executionId, PhaseName.fromKey(dataset)).completed();
    }
}
