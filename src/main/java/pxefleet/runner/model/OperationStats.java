package pxefleet.runner.model;

import java.util.Collection;

/**
 * Per-host accounting of an operation. Every target host is counted exactly
 * once: {@code completed + failed + cancelled + pending == total}.
 */
public record OperationStats(int total, int completed, int failed, int cancelled, int pending) {

    public static OperationStats of(int totalHosts, Collection<Session> sessions) {
        int completed = 0;
        int failed = 0;
        int cancelled = 0;
        for (Session s : sessions) {
            switch (s.status()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case CANCELLED -> cancelled++;
                default -> {
                }
            }
        }
        int pending = Math.max(0, totalHosts - completed - failed - cancelled);
        return new OperationStats(totalHosts, completed, failed, cancelled, pending);
    }

    public int finished() {
        return completed + failed + cancelled;
    }

    public int progressPercent() {
        if (total == 0)
            return 0;
        return finished() * 100 / total;
    }

    public boolean allFinished() {
        return pending == 0;
    }
}
