package landscape.pipeline.orchestrator;

import landscape.pipeline.config.ExecutionConfig;
import landscape.pipeline.model.DependencyKind;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseState;
import landscape.pipeline.model.PhaseStatus;
import landscape.pipeline.model.TriggerMode;
import landscape.pipeline.orchestrator.PhaseGraph.Gate;
import landscape.pipeline.orchestrator.PhaseGraph.GateDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static landscape.pipeline.model.PhaseName.*;
import static org.junit.jupiter.api.Assertions.*;

class PhaseGraphTest {

    private static final String EXEC = "exec-1";

    private final PhaseGraph graph = PhaseGraph.standard();
    private final ExecutionConfig all = ExecutionConfig.allPhases(TriggerMode.MANUAL);
    private final Map<PhaseName, PhaseState> states = new EnumMap<>(PhaseName.class);

    private void set(PhaseName phase, PhaseStatus status) {
        states.put(phase, PhaseState.builder().executionId(EXEC).phase(phase).status(status).build());
    }

    private GateDecision evaluate(PhaseName phase, ExecutionConfig config, long dataCount) {
        return graph.evaluate(phase, states, config, (executionId, dataset) -> dataCount, EXEC);
    }

    @Test
    void rootPhaseIsReady() {
        assertEquals(Gate.READY, evaluate(KEYWORD_METRICS, all, 0).gate());
    }

    @Test
    void waitsWhileDependencyRuns() {
        set(KEYWORD_METRICS, PhaseStatus.RUNNING);

        GateDecision decision = evaluate(SERP_COLLECTION, all, 0);

        assertEquals(Gate.WAIT, decision.gate());
        assertEquals("waiting for keyword_metrics", decision.reason());
    }

    @Test
    @DisplayName("A failed soft dependency does not block")
    void softDependencyFailureIsTolerated() {
        set(KEYWORD_METRICS, PhaseStatus.FAILED);

        assertEquals(Gate.READY, evaluate(SERP_COLLECTION, all, 0).gate());
    }

    @Test
    @DisplayName("A failed hard dependency blocks")
    void hardDependencyFailureBlocks() {
        set(SERP_COLLECTION, PhaseStatus.FAILED);

        GateDecision decision = evaluate(COMPANY_ENRICHMENT, all, 5);

        assertEquals(Gate.BLOCKED, decision.gate());
        assertEquals("hard dependency serp_collection is failed", decision.reason());
    }

    @Test
    void blockedWinsOverWaiting() {
        set(CONTENT_SCRAPING, PhaseStatus.RUNNING);
        set(COMPANY_ENRICHMENT, PhaseStatus.FAILED);

        assertEquals(Gate.BLOCKED, evaluate(CONTENT_ANALYSIS, all, 5).gate());
    }

    @Test
    void dataGateBlocksWithoutResults() {
        set(SERP_COLLECTION, PhaseStatus.COMPLETED);

        GateDecision decision = evaluate(CONTENT_SCRAPING, all, 0);

        assertEquals(Gate.BLOCKED, decision.gate());
        assertTrue(decision.reason().contains("serp_collection"));
        assertEquals(Gate.READY, evaluate(CONTENT_SCRAPING, all, 3).gate());
    }

    @Test
    @DisplayName("Disabled hard dependency and its data gate are waived")
    void disabledDependencyIsWaived() {
        ExecutionConfig withoutSerp = all.withEnabledPhases(EnumSet.of(COMPANY_ENRICHMENT));
        set(SERP_COLLECTION, PhaseStatus.SKIPPED);

        assertEquals(Gate.READY, evaluate(COMPANY_ENRICHMENT, withoutSerp, 0).gate());
    }

    @Test
    void skippedButEnabledHardDependencyBlocks() {
        set(SERP_COLLECTION, PhaseStatus.SKIPPED);

        assertEquals(Gate.BLOCKED, evaluate(COMPANY_ENRICHMENT, all, 5).gate());
    }

    @Test
    void overrideTurnsHardEdgeSoft() {
        PhaseGraph relaxed = graph.withOverrides(List.of(
                new ExecutionConfig.EdgeOverride(CONTENT_ANALYSIS, COMPANY_ENRICHMENT, DependencyKind.SOFT)));
        set(CONTENT_SCRAPING, PhaseStatus.COMPLETED);
        set(COMPANY_ENRICHMENT, PhaseStatus.FAILED);
        set(VIDEO_ENRICHMENT, PhaseStatus.COMPLETED);

        assertEquals(Gate.READY, relaxed.evaluate(CONTENT_ANALYSIS, states, all, (e, d) -> 1, EXEC).gate());
        assertEquals(DependencyKind.HARD, graph.dependenciesOf(CONTENT_ANALYSIS).get(COMPANY_ENRICHMENT),
                "the shared graph is not modified");
    }

    @Test
    void overrideOfMissingEdgeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> graph.withOverrides(List.of(
                new ExecutionConfig.EdgeOverride(KEYWORD_METRICS, LANDSCAPE_DSI, DependencyKind.SOFT))));
    }

    @Test
    void hardDependentsOfSerp() {
        assertEquals(List.of(COMPANY_ENRICHMENT, VIDEO_ENRICHMENT, CONTENT_SCRAPING),
                graph.hardDependents(SERP_COLLECTION));
    }

    @Test
    @DisplayName("Every edge points to an earlier phase in canonical order")
    void graphIsAcyclicInCanonicalOrder() {
        for (PhaseGraph.Edge edge : graph.edges()) {
            assertTrue(edge.dependsOn().ordinal() < edge.phase().ordinal(), edge.toString());
        }
    }
}
