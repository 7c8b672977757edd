package landscape.pipeline.simulation;

import landscape.pipeline.model.PhaseName;
import landscape.pipeline.orchestrator.PhaseHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers a simulated handler for every phase, so the engine can be exercised
 * end to end without the real data-collection services.
 */
public final class SimulationHandlers {

    private static final Logger log = LoggerFactory.getLogger(SimulationHandlers.class);

    private SimulationHandlers() {
    }

    public static PhaseHandlerRegistry registerAll(PhaseHandlerRegistry registry) {
        registry.register(new SimulatedPhaseHandler(PhaseName.KEYWORD_METRICS, "keyword-api", 20, 20, 80, 0.05))
                .register(new SimulatedPhaseHandler(PhaseName.SERP_COLLECTION, "serp-api", 40, 30, 120, 0.05))
                .register(new SimulatedPhaseHandler(PhaseName.COMPANY_ENRICHMENT, "company-api", 25, 20, 80, 0.1))
                .register(new SimulatedPhaseHandler(PhaseName.VIDEO_ENRICHMENT, "video-api", 10, 20, 60, 0.1))
                .register(new SimulatedPhaseHandler(PhaseName.CONTENT_SCRAPING, "scraper", 30, 50, 150, 0.15))
                .register(new SimulatedPhaseHandler(PhaseName.CONTENT_ANALYSIS, "llm-api", 30, 50, 200, 0.05))
                .register(new SimulatedPhaseHandler(PhaseName.DSI_CALCULATION, "dsi-engine", 5, 10, 40, 0.0))
                .register(new SimulatedPhaseHandler(PhaseName.HISTORICAL_SNAPSHOT, "dsi-engine", 1, 10, 20, 0.0))
                .register(new SimulatedPhaseHandler(PhaseName.LANDSCAPE_DSI, "dsi-engine", 1, 10, 20, 0.0));
        log.info("Simulation handlers registered for all phases");
        return registry;
    }
}
