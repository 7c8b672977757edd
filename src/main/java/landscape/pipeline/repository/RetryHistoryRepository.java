package landscape.pipeline.repository;

import landscape.pipeline.model.RetryAttempt;

import java.util.List;

/**
 * Append-only log of retry attempts.
 */
public interface RetryHistoryRepository {

    void append(RetryAttempt attempt);

    List<RetryAttempt> findByEntity(String entityType, String entityId);
}
