package pxefleet.runner.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import pxefleet.runner.model.ValidationException;
import pxefleet.runner.onboot.OnbootOptions;
import pxefleet.runner.service.OperationRequest;

import java.util.List;

/**
 * Request DTO for scheduling onboot commands.
 * POST /api/v1/onboot
 */
public record OnbootRequest(
        @JsonProperty("targetHosts") List<String> targetHosts,
        @JsonProperty("targetGroup") String targetGroup,
        @JsonProperty("targetRoom") String targetRoom,
        @JsonProperty("commands") String commands,
        @JsonProperty("noauto") Boolean noauto,
        @JsonProperty("disablegui") Boolean disablegui) {

    public void validate() {
        if (commands == null || commands.isBlank()) {
            throw new ValidationException("commands is required");
        }
    }

    public OnbootOptions options() {
        return new OnbootOptions(Boolean.TRUE.equals(noauto), Boolean.TRUE.equals(disablegui));
    }

    /** Target selectors in the form the resolver takes. */
    public OperationRequest targets() {
        return new OperationRequest(targetHosts, targetGroup, targetRoom, commands, null);
    }
}
