package pxefleet.runner.command;

import pxefleet.runner.model.ValidationException;

/**
 * A command string that failed to parse.
 * Carries the offending token, its 1-based position in the token list and the
 * character offset where it starts.
 */
public class InvalidCommandSyntaxException extends ValidationException {

    private final String token;
    private final int position;
    private final int offset;

    public InvalidCommandSyntaxException(String token, int position, int offset, String reason) {
        super("Invalid command at position " + position + " ('" + token + "'): " + reason);
        this.token = token;
        this.position = position;
        this.offset = offset;
    }

    public String token() {
        return token;
    }

    public int position() {
        return position;
    }

    public int offset() {
        return offset;
    }
}
