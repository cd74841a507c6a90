package pxefleet.runner.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import pxefleet.runner.api.Controller;
import pxefleet.runner.scheduler.SessionScheduler;
import pxefleet.runner.server.RouterHandler;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Worker control.
 * GET /api/v1/worker, POST /api/v1/worker/{pause|resume}
 */
public class WorkerController implements Controller {

    private static final Pattern WORKER_PATTERN = Pattern.compile("^/api/v1/worker$");
    private static final Pattern WORKER_ACTION_PATTERN = Pattern.compile("^/api/v1/worker/(pause|resume)$");

    private final SessionScheduler scheduler;

    public WorkerController(SessionScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.GET) && WORKER_PATTERN.matcher(path).matches())
                || (method.equals(HttpMethod.POST) && WORKER_ACTION_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Matcher action = WORKER_ACTION_PATTERN.matcher(path);
        if (action.matches()) {
            if ("pause".equals(action.group(1))) {
                scheduler.pause();
            } else {
                scheduler.resume();
            }
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(scheduler.status()));
    }
}
