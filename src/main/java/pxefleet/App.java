package pxefleet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.config.Dependencies;
import pxefleet.runner.config.RunnerConfig;

import java.util.concurrent.CountDownLatch;

/**
 * Runner entry point: HTTP API and WebSocket progress stream, then the poll
 * loop. Stops cleanly on SIGTERM.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        RunnerConfig config = RunnerConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping runner...");
            deps.close();
            stopped.countDown();
        }, "runner-shutdown"));

        try {
            int port = deps.server().start(config.serverHost(), config.serverPort());
            deps.startScheduler();
            log.info("Runner started on port {}", port);
        } catch (RuntimeException e) {
            log.error("Runner failed to start", e);
            System.exit(1);
        }

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
