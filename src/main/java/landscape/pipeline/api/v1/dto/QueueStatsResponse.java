package landscape.pipeline.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import landscape.pipeline.model.QueueStats;

import java.time.Instant;

/**
 * Response DTO for queue statistics.
 * GET /api/v1/queues/{name}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueueStatsResponse(
        @JsonProperty("queue") String queue,
        @JsonProperty("pending") int pending,
        @JsonProperty("processing") int processing,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("deadLetter") int deadLetter,
        @JsonProperty("oldestPendingAt") Instant oldestPendingAt) {

    public static QueueStatsResponse from(QueueStats stats) {
        return new QueueStatsResponse(
                stats.queueName(),
                stats.pending(),
                stats.processing(),
                stats.completed(),
                stats.failed(),
                stats.deadLetter(),
                stats.oldestPendingAt());
    }
}
