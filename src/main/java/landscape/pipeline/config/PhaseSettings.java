package landscape.pipeline.config;

import landscape.pipeline.model.PhaseName;

import java.time.Duration;
import java.util.Map;

/**
 * Typed per-phase configuration, validated on construction.
 *
 * @param timeout          hard wall-clock limit; in-flight work is cancelled when it elapses
 * @param timeBudget       soft limit after which one success is enough to complete
 * @param concurrency      maximum in-flight items for the phase
 * @param successThreshold success ratio that completes a phase with failures
 * @param minSuccessCount  absolute successes required alongside the ratio
 * @param itemMaxAttempts  attempt ceiling per item (one attempt per queue lease)
 * @param retryMaxAttempts in-call retries per attempt for recoverable errors
 * @param lane             job queue the phase's items flow through
 * @param batchSize        items enqueued per insert batch
 * @param priority         queue priority of the phase's jobs
 * @param parameters       free-form values passed to the phase handler
 */
public record PhaseSettings(
        Duration timeout,
        Duration timeBudget,
        int concurrency,
        double successThreshold,
        int minSuccessCount,
        int itemMaxAttempts,
        int retryMaxAttempts,
        String lane,
        int batchSize,
        int priority,
        Map<String, String> parameters) {

    public PhaseSettings {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (timeBudget == null) {
            timeBudget = timeout;
        }
        if (timeBudget.isNegative() || timeBudget.isZero() || timeBudget.compareTo(timeout) > 0) {
            throw new IllegalArgumentException("timeBudget must be positive and not exceed timeout");
        }
        if (concurrency < 1 || concurrency > 200) {
            throw new IllegalArgumentException("concurrency must be between 1 and 200");
        }
        if (successThreshold <= 0.0 || successThreshold > 1.0) {
            throw new IllegalArgumentException("successThreshold must be in (0, 1]");
        }
        if (minSuccessCount < 0) {
            throw new IllegalArgumentException("minSuccessCount must be >= 0");
        }
        if (itemMaxAttempts < 1 || retryMaxAttempts < 1) {
            throw new IllegalArgumentException("attempt limits must be >= 1");
        }
        if (lane == null || lane.isBlank()) {
            throw new IllegalArgumentException("lane is required");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    /**
     * Production defaults per phase.
     */
    public static PhaseSettings defaultsFor(PhaseName phase) {
        switch (phase) {
            case KEYWORD_METRICS:
                return of(phase, Duration.ofMinutes(30), Duration.ofMinutes(30), 5, 0.8, 1);
            case SERP_COLLECTION:
                return of(phase, Duration.ofMinutes(120), Duration.ofMinutes(90), 10, 0.9, 1);
            case COMPANY_ENRICHMENT:
                return of(phase, Duration.ofMinutes(60), Duration.ofMinutes(45), 15, 0.8, 1);
            case VIDEO_ENRICHMENT:
                return of(phase, Duration.ofMinutes(60), Duration.ofMinutes(60), 10, 0.8, 1);
            case CONTENT_SCRAPING:
                return of(phase, Duration.ofMinutes(180), Duration.ofMinutes(150), 20, 0.8, 1);
            case CONTENT_ANALYSIS:
                return of(phase, Duration.ofMinutes(240), Duration.ofMinutes(120), 10, 0.95, 1);
            case DSI_CALCULATION:
            case HISTORICAL_SNAPSHOT:
                return of(phase, Duration.ofMinutes(30), Duration.ofMinutes(30), 2, 1.0, 1);
            case LANDSCAPE_DSI:
                return of(phase, Duration.ofMinutes(60), Duration.ofMinutes(60), 4, 1.0, 1);
            default:
                throw new IllegalArgumentException("No defaults for phase " + phase);
        }
    }

    private static PhaseSettings of(PhaseName phase, Duration timeout, Duration budget, int concurrency,
            double threshold, int minSuccess) {
        return new PhaseSettings(timeout, budget, concurrency, threshold, minSuccess, 3, 3,
                phase.defaultLane(), 100, 0, Map.of());
    }

    public PhaseSettings withTimeout(Duration timeout, Duration timeBudget) {
        return new PhaseSettings(timeout, timeBudget, concurrency, successThreshold, minSuccessCount,
                itemMaxAttempts, retryMaxAttempts, lane, batchSize, priority, parameters);
    }

    public PhaseSettings withConcurrency(int concurrency) {
        return new PhaseSettings(timeout, timeBudget, concurrency, successThreshold, minSuccessCount,
                itemMaxAttempts, retryMaxAttempts, lane, batchSize, priority, parameters);
    }

    public PhaseSettings withCompletion(double successThreshold, int minSuccessCount) {
        return new PhaseSettings(timeout, timeBudget, concurrency, successThreshold, minSuccessCount,
                itemMaxAttempts, retryMaxAttempts, lane, batchSize, priority, parameters);
    }

    public PhaseSettings withAttempts(int itemMaxAttempts, int retryMaxAttempts) {
        return new PhaseSettings(timeout, timeBudget, concurrency, successThreshold, minSuccessCount,
                itemMaxAttempts, retryMaxAttempts, lane, batchSize, priority, parameters);
    }

    public PhaseSettings withParameters(Map<String, String> parameters) {
        return new PhaseSettings(timeout, timeBudget, concurrency, successThreshold, minSuccessCount,
                itemMaxAttempts, retryMaxAttempts, lane, batchSize, priority, parameters);
    }
}
