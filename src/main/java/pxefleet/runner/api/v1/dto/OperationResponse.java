package pxefleet.runner.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import pxefleet.runner.model.Operation;
import pxefleet.runner.model.OperationOptions;
import pxefleet.runner.model.OperationStats;
import pxefleet.runner.model.Session;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for operation details.
 * GET /api/v1/operations/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("id") String id,
        @JsonProperty("status") String status,
        @JsonProperty("commands") String commands,
        @JsonProperty("targetHosts") List<String> targetHosts,
        @JsonProperty("options") OperationOptions options,
        @JsonProperty("progress") int progress,
        @JsonProperty("stats") OperationStats stats,
        @JsonProperty("cancelRequested") boolean cancelRequested,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("sessions") List<SessionResponse> sessions) {

    /** Summary without sessions, for lists and submission responses. */
    public static OperationResponse from(Operation op) {
        return new OperationResponse(
                op.id(),
                op.status().wireName(),
                op.commands(),
                op.targetHosts(),
                op.options(),
                op.progress(),
                op.stats(),
                op.cancelRequested(),
                op.createdAt(),
                op.startedAt(),
                op.completedAt(),
                null);
    }

    /** Details with sessions; stats are derived from the sessions. */
    public static OperationResponse from(Operation op, List<Session> sessions) {
        OperationStats stats = op.isTerminal() ? op.stats() : OperationStats.of(op.targetHosts().size(), sessions);
        return new OperationResponse(
                op.id(),
                op.status().wireName(),
                op.commands(),
                op.targetHosts(),
                op.options(),
                op.isTerminal() ? op.progress() : stats.progressPercent(),
                stats,
                op.cancelRequested(),
                op.createdAt(),
                op.startedAt(),
                op.completedAt(),
                sessions.stream().map(SessionResponse::from).toList());
    }
}
