package pxefleet.runner.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.api.Controller;
import pxefleet.runner.api.v1.dto.HealthResponse;
import pxefleet.runner.events.ChannelGroupBroadcaster;
import pxefleet.runner.scheduler.SessionScheduler;
import pxefleet.runner.server.RouterHandler;
import pxefleet.runner.store.Database;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final SessionScheduler scheduler;
    private final ChannelGroupBroadcaster subscribers;

    public HealthController(Database database, SessionScheduler scheduler, ChannelGroupBroadcaster subscribers) {
        this.database = database;
        this.scheduler = scheduler;
        this.subscribers = subscribers;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        HealthResponse response;
        try {
            if (!database.isHealthy()) {
                response = HealthResponse.unhealthy("connection failed");
            } else {
                response = HealthResponse.healthy(formatUptime(), VERSION, scheduler.isRunning(),
                        scheduler.status().activeSessions(), subscribers.subscriberCount());
            }
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            response = HealthResponse.unhealthy(e.getMessage());
        }

        HttpResponseStatus status = "healthy".equals(response.status()) ? HttpResponseStatus.OK
                : HttpResponseStatus.SERVICE_UNAVAILABLE;
        return ControllerResponse.json(status, RouterHandler.mapper().writeValueAsString(response));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
