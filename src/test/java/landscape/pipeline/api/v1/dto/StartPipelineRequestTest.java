package landscape.pipeline.api.v1.dto;

import landscape.pipeline.config.ExecutionConfig;
import landscape.pipeline.config.Json;
import landscape.pipeline.config.PhaseSettings;
import landscape.pipeline.model.DependencyKind;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.TriggerMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StartPipelineRequestTest {

    private static ExecutionConfig parse(String json) {
        return Json.read(json, StartPipelineRequest.class).toExecutionConfig();
    }

    @Test
    @DisplayName("An empty request runs every phase with defaults")
    void emptyRequest() {
        ExecutionConfig config = parse("{}");

        assertEquals(TriggerMode.API, config.triggerMode());
        assertEquals(EnumSet.allOf(PhaseName.class), config.enabledPhases());
        assertEquals(ExecutionConfig.DEFAULT_CRITICAL, config.criticalPhases());
        assertEquals(PhaseSettings.defaultsFor(PhaseName.SERP_COLLECTION),
                config.settingsFor(PhaseName.SERP_COLLECTION));
    }

    @Test
    void phaseSubsetAndTriggerMode() {
        ExecutionConfig config = parse("""
                {"triggerMode": "scheduled",
                 "phases": ["serp_collection", "CONTENT_SCRAPING"],
                 "criticalPhases": ["serp_collection"],
                 "parameters": {"landscapeId": "42"}}
                """);

        assertEquals(TriggerMode.SCHEDULED, config.triggerMode());
        assertEquals(Set.of(PhaseName.SERP_COLLECTION, PhaseName.CONTENT_SCRAPING), config.enabledPhases());
        assertTrue(config.isCritical(PhaseName.SERP_COLLECTION));
        assertFalse(config.isCritical(PhaseName.DSI_CALCULATION));
        assertEquals("42", config.parameters().get("landscapeId"));
    }

    @Test
    void phaseSettingsOverrideDefaults() {
        ExecutionConfig config = parse("""
                {"phaseSettings": {"serp_collection": {
                    "timeoutSeconds": 600, "concurrency": 3, "successThreshold": 0.5,
                    "itemMaxAttempts": 5, "parameters": {"sim.items": "4"}}}}
                """);

        PhaseSettings serp = config.settingsFor(PhaseName.SERP_COLLECTION);
        assertEquals(Duration.ofMinutes(10), serp.timeout());
        assertEquals(Duration.ofMinutes(10), serp.timeBudget(), "budget is clamped to the shorter timeout");
        assertEquals(3, serp.concurrency());
        assertEquals(0.5, serp.successThreshold());
        assertEquals(1, serp.minSuccessCount());
        assertEquals(5, serp.itemMaxAttempts());
        assertEquals(3, serp.retryMaxAttempts());
        assertEquals("4", serp.parameters().get("sim.items"));
    }

    @Test
    void dependencyOverride() {
        ExecutionConfig config = parse("""
                {"dependencyOverrides": [
                    {"phase": "content_analysis", "dependsOn": "company_enrichment", "kind": "soft"}]}
                """);

        assertEquals(1, config.dependencyOverrides().size());
        ExecutionConfig.EdgeOverride override = config.dependencyOverrides().get(0);
        assertEquals(PhaseName.CONTENT_ANALYSIS, override.phase());
        assertEquals(PhaseName.COMPANY_ENRICHMENT, override.dependsOn());
        assertEquals(DependencyKind.SOFT, override.kind());
    }

    @Test
    void unknownPhaseIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> parse("{\"phases\": [\"serp\"]}"));
        assertEquals("Unknown phase: serp", e.getMessage());
    }

    @Test
    void unknownTriggerModeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> parse("{\"triggerMode\": \"cron\"}"));
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> parse("{\"phaseSettings\": {\"serp_collection\": {\"concurrency\": 0}}}"));
        assertThrows(IllegalArgumentException.class,
                () -> parse("{\"phaseSettings\": {\"serp_collection\": {\"successThreshold\": 1.5}}}"));
        assertThrows(IllegalArgumentException.class,
                () -> parse("{\"phaseSettings\": {\"serp_collection\": "
                        + "{\"timeoutSeconds\": 60, \"timeBudgetSeconds\": 120}}}"));
    }

    @Test
    void incompleteOverrideIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> parse("{\"dependencyOverrides\": [{\"phase\": \"content_analysis\"}]}"));
    }
}
