package landscape.pipeline.repository;

import landscape.pipeline.model.ExecutionMessage;

import java.util.List;

/**
 * Bounded store of representative errors and warnings per execution phase.
 */
public interface ExecutionMessageRepository {

    /**
     * Append unless the (execution, phase, level) bucket already holds {@code limit} messages.
     *
     * @return true if the message was stored
     */
    boolean appendBounded(ExecutionMessage message, int limit);

    List<ExecutionMessage> findByExecution(String executionId);
}
