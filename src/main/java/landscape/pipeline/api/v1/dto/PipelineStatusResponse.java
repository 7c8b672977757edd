package landscape.pipeline.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import landscape.pipeline.service.ExecutionStatusView;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for execution status.
 * GET /api/v1/pipelines/{executionId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineStatusResponse(
        @JsonProperty("executionId") String executionId,
        @JsonProperty("status") String status,
        @JsonProperty("triggerMode") String triggerMode,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("cancelRequested") boolean cancelRequested,
        @JsonProperty("error") String error,
        @JsonProperty("progressPercent") double progressPercent,
        @JsonProperty("phases") List<PhaseStatusResponse> phases,
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("errors") Map<String, List<String>> errors) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PhaseStatusResponse(
            @JsonProperty("phase") String phase,
            @JsonProperty("status") String status,
            @JsonProperty("attempts") int attempts,
            @JsonProperty("itemsTotal") int itemsTotal,
            @JsonProperty("itemsProcessed") int itemsProcessed,
            @JsonProperty("itemsSucceeded") int itemsSucceeded,
            @JsonProperty("itemsFailed") int itemsFailed,
            @JsonProperty("percent") double percent,
            @JsonProperty("lastError") String lastError,
            @JsonProperty("blockedReason") String blockedReason,
            @JsonProperty("startedAt") Instant startedAt,
            @JsonProperty("completedAt") Instant completedAt) {

        static PhaseStatusResponse from(ExecutionStatusView.PhaseView view) {
            return new PhaseStatusResponse(
                    view.phase().key(),
                    view.status().name(),
                    view.attempts(),
                    view.itemsTotal(),
                    view.itemsProcessed(),
                    view.itemsSucceeded(),
                    view.itemsFailed(),
                    round(view.percent()),
                    view.lastError(),
                    view.blockedReason(),
                    view.startedAt(),
                    view.completedAt());
        }
    }

    /** Create response from the status view */
    public static PipelineStatusResponse from(ExecutionStatusView view) {
        return new PipelineStatusResponse(
                view.executionId(),
                view.status().name(),
                view.triggerMode().name(),
                view.createdAt(),
                view.startedAt(),
                view.finishedAt(),
                view.cancelRequested(),
                view.errorMessage(),
                round(view.progressPercent()),
                view.phases().stream().map(PhaseStatusResponse::from).toList(),
                view.warnings(),
                view.errors());
    }

    private static double round(double percent) {
        return Math.round(percent * 10.0) / 10.0;
    }
}
