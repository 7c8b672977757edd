package landscape.pipeline.orchestrator;

import landscape.pipeline.model.PhaseName;

import java.util.List;

/**
 * Phase logic provided by the data-collection layer.
 *
 * Handlers are called from many worker threads at once and must be thread-safe.
 * {@link #execute} may throw: the exception is classified and retried by the engine.
 * A handler that returns {@link ItemOutcome#failed(String)} is not retried.
 */
public interface PhaseHandler {

    PhaseName phase();

    /**
     * Name of the external dependency the handler calls; used as its circuit breaker name.
     */
    String serviceName();

    /**
     * List the phase's work. Called once per execution; the result is stored.
     */
    List<WorkItem> enumerate(ExecutionContext context) throws Exception;

    ItemOutcome execute(WorkItem item, ExecutionContext context) throws Exception;
}
