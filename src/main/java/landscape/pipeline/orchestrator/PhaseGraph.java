package landscape.pipeline.orchestrator;

import landscape.pipeline.config.ExecutionConfig;
import landscape.pipeline.model.DependencyKind;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.PhaseState;
import landscape.pipeline.model.PhaseStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static phase dependency graph with typed edges and data gates.
 *
 * Gate evaluation is a pure function of the phase rows and live data counts.
 */
public final class PhaseGraph {

    public record Edge(PhaseName phase, PhaseName dependsOn, DependencyKind kind) {
    }

    public enum Gate {
        READY,
        WAIT,
        BLOCKED
    }

    public record GateDecision(Gate gate, String reason) {

        static final GateDecision READY = new GateDecision(Gate.READY, null);

        static GateDecision waitFor(String reason) {
            return new GateDecision(Gate.WAIT, reason);
        }

        static GateDecision blocked(String reason) {
            return new GateDecision(Gate.BLOCKED, reason);
        }
    }

    private final Map<PhaseName, Map<PhaseName, DependencyKind>> edges;
    private final Map<PhaseName, List<DataGate>> dataGates;

    private PhaseGraph(Map<PhaseName, Map<PhaseName, DependencyKind>> edges,
            Map<PhaseName, List<DataGate>> dataGates) {
        this.edges = edges;
        this.dataGates = dataGates;
    }

    /**
     * The production graph.
     */
    public static PhaseGraph standard() {
        Map<PhaseName, Map<PhaseName, DependencyKind>> edges = new EnumMap<>(PhaseName.class);
        for (PhaseName phase : PhaseName.values()) {
            edges.put(phase, new LinkedHashMap<>());
        }
        edges.get(PhaseName.SERP_COLLECTION).put(PhaseName.KEYWORD_METRICS, DependencyKind.SOFT);
        edges.get(PhaseName.COMPANY_ENRICHMENT).put(PhaseName.SERP_COLLECTION, DependencyKind.HARD);
        edges.get(PhaseName.VIDEO_ENRICHMENT).put(PhaseName.SERP_COLLECTION, DependencyKind.HARD);
        edges.get(PhaseName.CONTENT_SCRAPING).put(PhaseName.SERP_COLLECTION, DependencyKind.HARD);
        edges.get(PhaseName.CONTENT_ANALYSIS).put(PhaseName.CONTENT_SCRAPING, DependencyKind.HARD);
        edges.get(PhaseName.CONTENT_ANALYSIS).put(PhaseName.COMPANY_ENRICHMENT, DependencyKind.HARD);
        edges.get(PhaseName.CONTENT_ANALYSIS).put(PhaseName.VIDEO_ENRICHMENT, DependencyKind.SOFT);
        edges.get(PhaseName.DSI_CALCULATION).put(PhaseName.CONTENT_ANALYSIS, DependencyKind.HARD);
        edges.get(PhaseName.DSI_CALCULATION).put(PhaseName.COMPANY_ENRICHMENT, DependencyKind.HARD);
        edges.get(PhaseName.HISTORICAL_SNAPSHOT).put(PhaseName.DSI_CALCULATION, DependencyKind.HARD);
        edges.get(PhaseName.LANDSCAPE_DSI).put(PhaseName.DSI_CALCULATION, DependencyKind.HARD);

        Map<PhaseName, List<DataGate>> gates = new EnumMap<>(PhaseName.class);
        DataGate serpResults = DataGate.resultsOf(PhaseName.SERP_COLLECTION);
        gates.put(PhaseName.COMPANY_ENRICHMENT, List.of(serpResults));
        gates.put(PhaseName.VIDEO_ENRICHMENT, List.of(serpResults));
        gates.put(PhaseName.CONTENT_SCRAPING, List.of(serpResults));
        gates.put(PhaseName.CONTENT_ANALYSIS, List.of(DataGate.resultsOf(PhaseName.CONTENT_SCRAPING)));

        return new PhaseGraph(edges, gates);
    }

    /**
     * Copy of this graph with the execution's edge kind overrides applied.
     *
     * @throws IllegalArgumentException if an override names an edge that does not exist
     */
    public PhaseGraph withOverrides(List<ExecutionConfig.EdgeOverride> overrides) {
        if (overrides.isEmpty()) {
            return this;
        }
        Map<PhaseName, Map<PhaseName, DependencyKind>> copy = new EnumMap<>(PhaseName.class);
        edges.forEach((phase, deps) -> copy.put(phase, new LinkedHashMap<>(deps)));
        for (ExecutionConfig.EdgeOverride override : overrides) {
            Map<PhaseName, DependencyKind> deps = copy.get(override.phase());
            if (!deps.containsKey(override.dependsOn())) {
                throw new IllegalArgumentException("No dependency " + override.phase().key() + " -> "
                        + override.dependsOn().key() + " to override");
            }
            deps.put(override.dependsOn(), override.kind());
        }
        return new PhaseGraph(copy, dataGates);
    }

    public Map<PhaseName, DependencyKind> dependenciesOf(PhaseName phase) {
        return Collections.unmodifiableMap(edges.get(phase));
    }

    public List<DataGate> dataGatesOf(PhaseName phase) {
        return dataGates.getOrDefault(phase, List.of());
    }

    public List<Edge> edges() {
        List<Edge> all = new ArrayList<>();
        edges.forEach((phase, deps) -> deps.forEach((dep, kind) -> all.add(new Edge(phase, dep, kind))));
        return all;
    }

    /**
     * Phases whose hard dependencies include the given phase.
     */
    public List<PhaseName> hardDependents(PhaseName phase) {
        List<PhaseName> dependents = new ArrayList<>();
        edges.forEach((dependent, deps) -> {
            if (deps.get(phase) == DependencyKind.HARD) {
                dependents.add(dependent);
            }
        });
        return dependents;
    }

    /**
     * Evaluate the entry gate of a PENDING phase.
     *
     * A blocking condition on any edge wins over waiting on another, so a phase is blocked
     * as soon as it can never start.
     *
     * @param states current phase rows of the execution
     */
    public GateDecision evaluate(PhaseName phase, Map<PhaseName, PhaseState> states, ExecutionConfig config,
            DataAvailabilityQuery data, String executionId) {
        String waitReason = null;

        for (Map.Entry<PhaseName, DependencyKind> edge : edges.get(phase).entrySet()) {
            PhaseName dependency = edge.getKey();
            PhaseState state = states.get(dependency);
            PhaseStatus status = state != null ? state.status() : PhaseStatus.PENDING;

            if (status == PhaseStatus.PENDING || status == PhaseStatus.RUNNING) {
                if (waitReason == null) {
                    waitReason = "waiting for " + dependency.key();
                }
                continue;
            }

            if (edge.getValue() == DependencyKind.HARD) {
                if (status == PhaseStatus.COMPLETED) {
                    continue;
                }
                if (status == PhaseStatus.SKIPPED && !config.isEnabled(dependency)) {
                    continue;
                }
                return GateDecision.blocked("hard dependency " + dependency.key() + " is "
                        + status.name().toLowerCase(Locale.ROOT));
            }
        }

        if (waitReason != null) {
            return GateDecision.waitFor(waitReason);
        }

        for (DataGate gate : dataGatesOf(phase)) {
            if (!config.isEnabled(gate.source())) {
                continue;
            }
            long available = data.count(executionId, gate.dataset());
            if (available < gate.minCount()) {
                return GateDecision.blocked(gate.describe() + ", found " + available);
            }
        }

        return GateDecision.READY;
    }
}
