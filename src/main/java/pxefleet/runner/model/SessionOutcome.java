package pxefleet.runner.model;

import java.util.Objects;

/**
 * Terminal result of a session as produced by a worker.
 *
 * @param status             COMPLETED, FAILED or CANCELLED
 * @param errorKind          null when completed
 * @param message            human-readable reason, null when completed
 * @param failedCommandIndex 1-based index of the failing instruction, if any
 * @param exitCode           exit status of the last executed command, if any
 * @param log                captured output, may be null
 */
public record SessionOutcome(
        SessionStatus status,
        ErrorKind errorKind,
        String message,
        Integer failedCommandIndex,
        Integer exitCode,
        String log) {

    public SessionOutcome {
        Objects.requireNonNull(status, "status is required");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Outcome status must be terminal: " + status);
        }
        if (status != SessionStatus.COMPLETED && errorKind == null) {
            throw new IllegalArgumentException("errorKind is required for " + status);
        }
    }

    public static SessionOutcome completed(Integer exitCode, String log) {
        return new SessionOutcome(SessionStatus.COMPLETED, null, null, null, exitCode, log);
    }

    public static SessionOutcome failed(ErrorKind kind, String message) {
        return new SessionOutcome(SessionStatus.FAILED, kind, message, null, null, null);
    }

    public static SessionOutcome commandFailed(ErrorKind kind, String message, int commandIndex, Integer exitCode,
            String log) {
        return new SessionOutcome(SessionStatus.FAILED, kind, message, commandIndex, exitCode, log);
    }

    public static SessionOutcome cancelled(String message) {
        return new SessionOutcome(SessionStatus.CANCELLED, ErrorKind.CANCELLED, message, null, null, null);
    }

    public SessionOutcome withLog(String log) {
        return new SessionOutcome(status, errorKind, message, failedCommandIndex, exitCode, log);
    }
}
