package landscape.pipeline.repository;

import landscape.pipeline.model.Checkpoint;
import landscape.pipeline.model.PhaseName;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for phase checkpoints.
 */
public interface CheckpointRepository {

    /**
     * Upsert by (execution, phase, name).
     */
    void save(Checkpoint checkpoint);

    Optional<Checkpoint> find(String executionId, PhaseName phase, String name);

    List<Checkpoint> findByExecution(String executionId);
}
