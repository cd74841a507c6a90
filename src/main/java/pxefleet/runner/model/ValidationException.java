package pxefleet.runner.model;

/**
 * Rejected input: malformed command string, unknown host, group or room.
 * Raised before any operation or session is created.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
