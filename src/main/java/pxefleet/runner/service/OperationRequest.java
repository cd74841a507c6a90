package pxefleet.runner.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import pxefleet.runner.model.OperationOptions;

import java.util.List;

/**
 * Submission of a new operation.
 * POST /api/v1/operations
 */
public record OperationRequest(
        @JsonProperty("targetHosts") List<String> targetHosts,
        @JsonProperty("targetGroup") String targetGroup,
        @JsonProperty("targetRoom") String targetRoom,
        @JsonProperty("commands") String commands,
        @JsonProperty("options") Options options) {

    /** Dispatch options as they arrive on the wire; all optional. */
    public record Options(
            @JsonProperty("wakeOnLan") Boolean wakeOnLan,
            @JsonProperty("wakeDelaySeconds") Integer wakeDelaySeconds,
            @JsonProperty("deferred") Boolean deferred) {
    }

    public static OperationRequest forHosts(List<String> hostIds, String commands) {
        return new OperationRequest(hostIds, null, null, commands, null);
    }

    public OperationOptions toOptions() {
        if (options == null) {
            return OperationOptions.immediate();
        }
        boolean wake = Boolean.TRUE.equals(options.wakeOnLan());
        int delay = options.wakeDelaySeconds() != null ? options.wakeDelaySeconds() : (wake ? 60 : 0);
        return new OperationOptions(wake, delay, Boolean.TRUE.equals(options.deferred()));
    }
}
