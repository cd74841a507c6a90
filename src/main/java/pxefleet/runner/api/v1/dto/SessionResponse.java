package pxefleet.runner.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import pxefleet.runner.model.Session;

import java.time.Instant;

/**
 * One host's execution inside {@link OperationResponse}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
        @JsonProperty("id") String id,
        @JsonProperty("hostId") String hostId,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("status") String status,
        @JsonProperty("progress") int progress,
        @JsonProperty("errorKind") String errorKind,
        @JsonProperty("error") String error,
        @JsonProperty("failedCommandIndex") Integer failedCommandIndex,
        @JsonProperty("exitCode") Integer exitCode,
        @JsonProperty("log") String log,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt) {

    public static SessionResponse from(Session s) {
        return new SessionResponse(
                s.id(),
                s.hostId(),
                s.hostname(),
                s.status().wireName(),
                s.progress(),
                s.errorKind() != null ? s.errorKind().name() : null,
                s.errorMessage(),
                s.failedCommandIndex(),
                s.exitCode(),
                s.logOutput(),
                s.startedAt(),
                s.completedAt());
    }
}
