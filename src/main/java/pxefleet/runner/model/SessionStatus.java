package pxefleet.runner.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one host's execution.
 */
public enum SessionStatus {
    /** Created, waiting for a worker slot */
    PENDING,
    /** Waiting for the host to come up after wake */
    WAITING_FOR_HOST,
    /** Worker is opening the remote channel */
    CONNECTING,
    /** Commands are executing */
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static Set<SessionStatus> nonTerminal() {
        return EnumSet.of(PENDING, WAITING_FOR_HOST, CONNECTING, RUNNING);
    }

    public static Set<SessionStatus> terminal() {
        return EnumSet.of(COMPLETED, FAILED, CANCELLED);
    }

    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
