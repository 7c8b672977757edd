package landscape.pipeline.simulation;

import landscape.pipeline.config.ExecutionConfig;
import landscape.pipeline.config.PhaseSettings;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.TriggerMode;
import landscape.pipeline.orchestrator.ExecutionContext;
import landscape.pipeline.orchestrator.ItemOutcome;
import landscape.pipeline.orchestrator.PhaseHandlerRegistry;
import landscape.pipeline.orchestrator.WorkItem;
import landscape.pipeline.resilience.ExternalServiceException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedPhaseHandlerTest {

    private static final PhaseName SERP = PhaseName.SERP_COLLECTION;

    private static ExecutionContext context(Map<String, String> simParameters) {
        ExecutionConfig config = ExecutionConfig.allPhases(TriggerMode.MANUAL)
                .withPhaseSettings(SERP, PhaseSettings.defaultsFor(SERP).withParameters(simParameters));
        return new ExecutionContext("exec-sim", config, "driver-sim");
    }

    @Test
    void enumeratesConfiguredItemCount() {
        SimulatedPhaseHandler handler = new SimulatedPhaseHandler(SERP, "serp-api", 5, 0, 0, 0.0);

        List<WorkItem> items = handler.enumerate(context(Map.of()));
        assertEquals(5, items.size());
        assertEquals("keyword 1:any:organic", items.get(0).itemId());

        assertEquals(2, handler.enumerate(context(Map.of("sim.items", "2"))).size());
    }

    @Test
    void itemIdsFollowTheUnitOfWork() {
        ExecutionContext inUs = new ExecutionContext("exec-sim",
                ExecutionConfig.allPhases(TriggerMode.MANUAL).withParameters(Map.of("region", "US")), "driver-sim");
        SimulatedPhaseHandler serp = new SimulatedPhaseHandler(SERP, "serp-api", 2, 0, 0, 0.0);
        assertEquals("keyword 2:us:organic", serp.enumerate(inUs).get(1).itemId());

        assertEquals("company-3.example", SimulatedPhaseHandler.itemId(PhaseName.COMPANY_ENRICHMENT, 3, null));
        assertEquals("https://site-4.example/article",
                SimulatedPhaseHandler.itemId(PhaseName.CONTENT_SCRAPING, 4, null));
        assertEquals("https://video.example/watch?v=5", SimulatedPhaseHandler.itemId(PhaseName.VIDEO_ENRICHMENT, 5,
                null));
        assertEquals("dsi_calculation-1", SimulatedPhaseHandler.itemId(PhaseName.DSI_CALCULATION, 1, null));
    }

    @Test
    void completesOrFailsByRate() throws Exception {
        SimulatedPhaseHandler reliable = new SimulatedPhaseHandler(SERP, "serp-api", 1, 0, 0, 0.0);
        ItemOutcome outcome = reliable.execute(WorkItem.of("keyword 1:any:organic"), context(Map.of()));
        assertEquals(ItemOutcome.Status.COMPLETED, outcome.status());
        assertEquals("serp-api", outcome.output().get("source"));

        ExternalServiceException e = assertThrows(ExternalServiceException.class,
                () -> reliable.execute(WorkItem.of("keyword 1:any:organic"), context(Map.of("sim.failRate", "1.0"))));
        assertTrue(e.getMessage().contains("serp-api unavailable"));
        assertEquals(503, e.statusCode());

        ExternalServiceException rateLimited = assertThrows(ExternalServiceException.class,
                () -> reliable.execute(WorkItem.of("keyword 1:any:organic"),
                        context(Map.of("sim.failRate", "1.0", "sim.failStatus", "429"))));
        assertEquals(429, rateLimited.statusCode());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new SimulatedPhaseHandler(SERP, "x", 1, 10, 5, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new SimulatedPhaseHandler(SERP, "x", 1, 0, 0, 1.5));
    }

    @Test
    void registersEveryPhase() {
        PhaseHandlerRegistry registry = new PhaseHandlerRegistry();
        SimulationHandlers.registerAll(registry);

        for (PhaseName phase : PhaseName.values()) {
            assertTrue(registry.has(phase), phase.key());
        }
    }
}
