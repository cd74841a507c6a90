package pxefleet.runner.model;

/**
 * Why a session did not complete.
 */
public enum ErrorKind {
    /** Host record missing or unusable */
    VALIDATION,
    /** Host kept holding another operation's session past the busy-poll limit */
    HOST_BUSY,
    /** Unreachable host or authentication failure, no command attempted */
    CONNECTION,
    /** A command returned a non-zero exit status */
    COMMAND_EXECUTION,
    /** Per-command timeout, session duration limit, or stale heartbeat */
    TIMEOUT,
    /** Explicit cancellation */
    CANCELLED
}
