package landscape.pipeline.config;

import landscape.pipeline.model.DependencyKind;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.TriggerMode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Configuration of one execution: which phases run and how.
 * Stored as JSON on the execution row so a resumed run sees the same settings.
 *
 * @param enabledPhases       phases to run; the rest are SKIPPED
 * @param phaseSettings       overrides of the per-phase defaults
 * @param criticalPhases      phases whose failure fails the whole execution
 * @param dependencyOverrides changes to the kind of existing dependency edges
 * @param parameters          free-form execution parameters (landscape id, client id, ...)
 */
public record ExecutionConfig(
        TriggerMode triggerMode,
        Set<PhaseName> enabledPhases,
        Map<PhaseName, PhaseSettings> phaseSettings,
        Set<PhaseName> criticalPhases,
        List<EdgeOverride> dependencyOverrides,
        Map<String, String> parameters) {

    /** Default phases whose failure fails the execution */
    public static final Set<PhaseName> DEFAULT_CRITICAL = Set.of(PhaseName.SERP_COLLECTION,
            PhaseName.DSI_CALCULATION);

    /**
     * Override of the kind of the edge {@code phase -> dependsOn}.
     */
    public record EdgeOverride(PhaseName phase, PhaseName dependsOn, DependencyKind kind) {
        public EdgeOverride {
            if (phase == null || dependsOn == null || kind == null) {
                throw new IllegalArgumentException("edge override needs phase, dependsOn and kind");
            }
        }
    }

    public ExecutionConfig {
        if (triggerMode == null) {
            triggerMode = TriggerMode.MANUAL;
        }
        if (enabledPhases == null || enabledPhases.isEmpty()) {
            throw new IllegalArgumentException("at least one phase must be enabled");
        }
        enabledPhases = Set.copyOf(enabledPhases);
        phaseSettings = phaseSettings == null ? Map.of() : Map.copyOf(phaseSettings);
        criticalPhases = criticalPhases == null ? DEFAULT_CRITICAL : Set.copyOf(criticalPhases);
        dependencyOverrides = dependencyOverrides == null ? List.of() : List.copyOf(dependencyOverrides);
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    /**
     * All nine phases with default settings.
     */
    public static ExecutionConfig allPhases(TriggerMode triggerMode) {
        return new ExecutionConfig(triggerMode, EnumSet.allOf(PhaseName.class), null, null, null, null);
    }

    public boolean isEnabled(PhaseName phase) {
        return enabledPhases.contains(phase);
    }

    public boolean isCritical(PhaseName phase) {
        return criticalPhases.contains(phase);
    }

    public PhaseSettings settingsFor(PhaseName phase) {
        PhaseSettings settings = phaseSettings.get(phase);
        return settings != null ? settings : PhaseSettings.defaultsFor(phase);
    }

    public ExecutionConfig withEnabledPhases(Set<PhaseName> phases) {
        return new ExecutionConfig(triggerMode, phases, phaseSettings, criticalPhases, dependencyOverrides,
                parameters);
    }

    public ExecutionConfig withPhaseSettings(PhaseName phase, PhaseSettings settings) {
        Map<PhaseName, PhaseSettings> copy = new EnumMap<>(PhaseName.class);
        copy.putAll(phaseSettings);
        copy.put(phase, settings);
        return new ExecutionConfig(triggerMode, enabledPhases, copy, criticalPhases, dependencyOverrides,
                parameters);
    }

    /** Apply the same transformation to every phase's settings */
    public ExecutionConfig withAllPhaseSettings(UnaryOperator<PhaseSettings> change) {
        Map<PhaseName, PhaseSettings> copy = new EnumMap<>(PhaseName.class);
        for (PhaseName phase : PhaseName.values()) {
            copy.put(phase, change.apply(settingsFor(phase)));
        }
        return new ExecutionConfig(triggerMode, enabledPhases, copy, criticalPhases, dependencyOverrides,
                parameters);
    }

    public ExecutionConfig withCriticalPhases(Set<PhaseName> phases) {
        return new ExecutionConfig(triggerMode, enabledPhases, phaseSettings, phases, dependencyOverrides,
                parameters);
    }

    public ExecutionConfig withDependencyOverride(PhaseName phase, PhaseName dependsOn, DependencyKind kind) {
        List<EdgeOverride> copy = new ArrayList<>(dependencyOverrides);
        copy.add(new EdgeOverride(phase, dependsOn, kind));
        return new ExecutionConfig(triggerMode, enabledPhases, phaseSettings, criticalPhases, copy, parameters);
    }

    public ExecutionConfig withParameters(Map<String, String> parameters) {
        return new ExecutionConfig(triggerMode, enabledPhases, phaseSettings, criticalPhases,
                dependencyOverrides, parameters);
    }
}
