package pxefleet.runner.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import pxefleet.runner.command.Command;
import pxefleet.runner.command.CommandName;
import pxefleet.runner.command.CommandPlan;
import pxefleet.runner.command.InvalidCommandSyntaxException;

import java.util.List;

/**
 * Response DTO for command validation.
 * POST /api/v1/operations/validate-commands
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidateCommandsResponse(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("normalized") String normalized,
        @JsonProperty("commands") List<String> commands,
        @JsonProperty("flags") List<String> flags,
        @JsonProperty("error") String error,
        @JsonProperty("position") Integer position,
        @JsonProperty("token") String token,
        @JsonProperty("knownCommands") List<String> knownCommands,
        @JsonProperty("knownFlags") List<String> knownFlags) {

    public static ValidateCommandsResponse valid(CommandPlan plan) {
        return new ValidateCommandsResponse(true,
                plan.format(),
                plan.commands().stream().map(Command::token).toList(),
                plan.flags().stream().map(CommandName::token).toList(),
                null, null, null,
                CommandName.commandTokens(),
                CommandName.flagTokens());
    }

    public static ValidateCommandsResponse invalid(InvalidCommandSyntaxException e) {
        return new ValidateCommandsResponse(false, null, null, null,
                e.getMessage(), e.position(), e.token(),
                CommandName.commandTokens(),
                CommandName.flagTokens());
    }
}
