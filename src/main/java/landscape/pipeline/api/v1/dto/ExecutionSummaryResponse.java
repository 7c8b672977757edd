package landscape.pipeline.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import landscape.pipeline.model.PipelineExecution;

import java.time.Instant;

/**
 * Compact execution entry for list responses.
 * GET /api/v1/pipelines
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionSummaryResponse(
        @JsonProperty("executionId") String executionId,
        @JsonProperty("status") String status,
        @JsonProperty("triggerMode") String triggerMode,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("error") String error) {

    public static ExecutionSummaryResponse from(PipelineExecution execution) {
        return new ExecutionSummaryResponse(
                execution.id(),
                execution.status().name(),
                execution.triggerMode().name(),
                execution.createdAt(),
                execution.startedAt(),
                execution.finishedAt(),
                execution.errorMessage());
    }
}
