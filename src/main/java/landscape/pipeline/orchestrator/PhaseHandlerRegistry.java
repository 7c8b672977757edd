package landscape.pipeline.orchestrator;

import landscape.pipeline.model.PhaseName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Phase name to handler lookup.
 */
public final class PhaseHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(PhaseHandlerRegistry.class);

    private final Map<PhaseName, PhaseHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Register a handler, replacing any previous handler of the same phase.
     */
    public PhaseHandlerRegistry register(PhaseHandler handler) {
        PhaseHandler previous = handlers.put(handler.phase(), handler);
        if (previous != null) {
            log.info("Handler for {} replaced: {} -> {}", handler.phase(),
                    previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        }
        return this;
    }

    public Optional<PhaseHandler> find(PhaseName phase) {
        return Optional.ofNullable(handlers.get(phase));
    }

    public boolean has(PhaseName phase) {
        return handlers.containsKey(phase);
    }
}
