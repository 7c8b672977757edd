package landscape.pipeline.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import landscape.pipeline.model.CircuitBreakerState;

import java.time.Instant;

/**
 * Response DTO for circuit breaker state and metrics.
 * GET /api/v1/circuit-breakers
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CircuitBreakerResponse(
        @JsonProperty("name") String name,
        @JsonProperty("state") String state,
        @JsonProperty("failureCount") int failureCount,
        @JsonProperty("successCount") int successCount,
        @JsonProperty("failureThreshold") int failureThreshold,
        @JsonProperty("successThreshold") int successThreshold,
        @JsonProperty("timeoutSeconds") long timeoutSeconds,
        @JsonProperty("totalRequests") long totalRequests,
        @JsonProperty("totalFailures") long totalFailures,
        @JsonProperty("totalSuccesses") long totalSuccesses,
        @JsonProperty("successRate") double successRate,
        @JsonProperty("openedAt") Instant openedAt,
        @JsonProperty("lastFailureAt") Instant lastFailureAt) {

    public static CircuitBreakerResponse from(CircuitBreakerState state) {
        return new CircuitBreakerResponse(
                state.name(),
                state.state().name(),
                state.failureCount(),
                state.successCount(),
                state.failureThreshold(),
                state.successThreshold(),
                state.timeout().toSeconds(),
                state.totalRequests(),
                state.totalFailures(),
                state.totalSuccesses(),
                state.successRate(),
                state.openedAt(),
                state.lastFailureAt());
    }
}
