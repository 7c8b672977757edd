package landscape.pipeline.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import landscape.pipeline.config.ExecutionConfig;
import landscape.pipeline.config.PhaseSettings;
import landscape.pipeline.model.DependencyKind;
import landscape.pipeline.model.PhaseName;
import landscape.pipeline.model.TriggerMode;

import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Request DTO for starting a pipeline execution.
 * POST /api/v1/pipelines
 *
 * Every field is optional; an empty body runs all nine phases with default settings.
 */
public record StartPipelineRequest(
        @JsonProperty("triggerMode") String triggerMode,
        @JsonProperty("phases") List<String> phases,
        @JsonProperty("criticalPhases") List<String> criticalPhases,
        @JsonProperty("phaseSettings") Map<String, PhaseSettingsParam> phaseSettings,
        @JsonProperty("dependencyOverrides") List<EdgeParam> dependencyOverrides,
        @JsonProperty("parameters") Map<String, String> parameters) {

    /**
     * Overrides of one phase's defaults. Unset fields keep the default.
     */
    public record PhaseSettingsParam(
            @JsonProperty("timeoutSeconds") Long timeoutSeconds,
            @JsonProperty("timeBudgetSeconds") Long timeBudgetSeconds,
            @JsonProperty("concurrency") Integer concurrency,
            @JsonProperty("successThreshold") Double successThreshold,
            @JsonProperty("minSuccessCount") Integer minSuccessCount,
            @JsonProperty("itemMaxAttempts") Integer itemMaxAttempts,
            @JsonProperty("retryMaxAttempts") Integer retryMaxAttempts,
            @JsonProperty("parameters") Map<String, String> parameters) {

        PhaseSettings applyTo(PhaseSettings defaults) {
            PhaseSettings settings = defaults;
            if (timeoutSeconds != null || timeBudgetSeconds != null) {
                Duration timeout = timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : defaults.timeout();
                Duration budget = timeBudgetSeconds != null ? Duration.ofSeconds(timeBudgetSeconds)
                        : (defaults.timeBudget().compareTo(timeout) > 0 ? timeout : defaults.timeBudget());
                settings = settings.withTimeout(timeout, budget);
            }
            if (concurrency != null) {
                settings = settings.withConcurrency(concurrency);
            }
            if (successThreshold != null || minSuccessCount != null) {
                settings = settings.withCompletion(
                        successThreshold != null ? successThreshold : settings.successThreshold(),
                        minSuccessCount != null ? minSuccessCount : settings.minSuccessCount());
            }
            if (itemMaxAttempts != null || retryMaxAttempts != null) {
                settings = settings.withAttempts(
                        itemMaxAttempts != null ? itemMaxAttempts : settings.itemMaxAttempts(),
                        retryMaxAttempts != null ? retryMaxAttempts : settings.retryMaxAttempts());
            }
            if (parameters != null) {
                settings = settings.withParameters(parameters);
            }
            return settings;
        }
    }

    /**
     * Override of the kind of an existing dependency edge.
     */
    public record EdgeParam(
            @JsonProperty("phase") String phase,
            @JsonProperty("dependsOn") String dependsOn,
            @JsonProperty("kind") String kind) {
    }

    /**
     * Validate and convert to the typed execution config.
     *
     * @throws IllegalArgumentException on unknown phases, modes or invalid settings
     */
    public ExecutionConfig toExecutionConfig() {
        TriggerMode mode = triggerMode == null || triggerMode.isBlank()
                ? TriggerMode.API
                : parseEnum(TriggerMode.class, triggerMode, "triggerMode");

        Set<PhaseName> enabled = phases == null || phases.isEmpty()
                ? EnumSet.allOf(PhaseName.class)
                : phaseSet(phases);

        Set<PhaseName> critical = criticalPhases == null ? null : phaseSet(criticalPhases);

        Map<PhaseName, PhaseSettings> settings = new EnumMap<>(PhaseName.class);
        if (phaseSettings != null) {
            phaseSettings.forEach((key, param) -> {
                PhaseName phase = PhaseName.fromKey(key);
                if (param != null) {
                    settings.put(phase, param.applyTo(PhaseSettings.defaultsFor(phase)));
                }
            });
        }

        ExecutionConfig config = new ExecutionConfig(mode, enabled, settings, critical, null, parameters);
        if (dependencyOverrides != null) {
            for (EdgeParam edge : dependencyOverrides) {
                if (edge == null || edge.phase() == null || edge.dependsOn() == null || edge.kind() == null) {
                    throw new IllegalArgumentException("dependency override needs phase, dependsOn and kind");
                }
                config = config.withDependencyOverride(PhaseName.fromKey(edge.phase()),
                        PhaseName.fromKey(edge.dependsOn()), parseEnum(DependencyKind.class, edge.kind(), "kind"));
            }
        }
        return config;
    }

    private static Set<PhaseName> phaseSet(List<String> keys) {
        Set<PhaseName> set = EnumSet.noneOf(PhaseName.class);
        for (String key : keys) {
            set.add(PhaseName.fromKey(key));
        }
        return set;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + field + ": " + value);
        }
    }
}
