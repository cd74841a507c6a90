package pxefleet.runner.scheduler;

import java.util.Set;

/**
 * Snapshot of the scheduler for status endpoints.
 */
public record WorkerStatus(
        boolean running,
        boolean paused,
        long pollIntervalMs,
        int maxConcurrentSessions,
        int activeSessions,
        Set<String> activeOperations) {
}
