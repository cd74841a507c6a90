package pxefleet.runner.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Best-effort cancellation handle shared between the scheduler and one
 * executing session. Aborting runs the registered callbacks once, typically
 * closing the remote channel.
 */
public final class AbortSignal {

    private static final Logger log = LoggerFactory.getLogger(AbortSignal.class);

    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile boolean aborted;

    public boolean isAborted() {
        return aborted;
    }

    public void abort() {
        synchronized (this) {
            if (aborted) {
                return;
            }
            aborted = true;
        }
        callbacks.forEach(AbortSignal::runQuietly);
    }

    /**
     * Register a callback; runs it immediately if already aborted.
     */
    public void onAbort(Runnable callback) {
        boolean runNow;
        synchronized (this) {
            callbacks.add(callback);
            runNow = aborted;
        }
        if (runNow) {
            runQuietly(callback);
        }
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Abort callback failed: {}", e.getMessage());
        }
    }
}
