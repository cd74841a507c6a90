package pxefleet.runner.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an operation. Transitions only move forward:
 * PENDING → WAKING → RUNNING → one terminal status.
 */
public enum OperationStatus {
    /** Submitted, nothing dispatched yet */
    PENDING(0),
    /** Wake-on-LAN sent, waiting for hosts to boot */
    WAKING(1),
    /** At least one session has been dispatched */
    RUNNING(2),
    /** Every session succeeded */
    COMPLETED(3),
    /** Some sessions succeeded, some did not */
    COMPLETED_WITH_ERRORS(3),
    /** No session succeeded */
    FAILED(3),
    /** Cancelled before any session ran */
    CANCELLED(3);

    private final int rank;

    OperationStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return rank == 3;
    }

    public boolean canTransitionTo(OperationStatus next) {
        return !isTerminal() && next.rank > rank;
    }

    /** Statuses from which {@code target} may be reached. */
    public static Set<OperationStatus> predecessorsOf(OperationStatus target) {
        Set<OperationStatus> result = EnumSet.noneOf(OperationStatus.class);
        for (OperationStatus s : values()) {
            if (s.canTransitionTo(target)) {
                result.add(s);
            }
        }
        return result;
    }

    public static Set<OperationStatus> active() {
        return EnumSet.of(PENDING, WAKING, RUNNING);
    }

    /** Lower-case wire name, e.g. {@code completed_with_errors}. */
    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
