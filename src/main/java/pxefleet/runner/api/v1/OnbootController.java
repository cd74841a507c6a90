package pxefleet.runner.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import pxefleet.runner.api.Controller;
import pxefleet.runner.api.v1.dto.OnbootRequest;
import pxefleet.runner.model.Host;
import pxefleet.runner.model.ValidationException;
import pxefleet.runner.onboot.DeferredCommandRecord;
import pxefleet.runner.onboot.OnbootResult;
import pxefleet.runner.onboot.OnbootScheduler;
import pxefleet.runner.server.RouterHandler;
import pxefleet.runner.service.TargetResolver;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for deferred (onboot) commands.
 *
 * GET /api/v1/onboot - List pending records
 * POST /api/v1/onboot - Schedule commands for hosts, a group or a room
 * DELETE /api/v1/onboot/{hostname} - Cancel one host's record
 */
public class OnbootController implements Controller {

    private static final Pattern ONBOOT_PATTERN = Pattern.compile("^/api/v1/onboot$");
    private static final Pattern ONBOOT_HOST_PATTERN = Pattern.compile("^/api/v1/onboot/([^/]+)$");

    private final OnbootScheduler onboot;
    private final TargetResolver targetResolver;

    public OnbootController(OnbootScheduler onboot, TargetResolver targetResolver) {
        this.onboot = onboot;
        this.targetResolver = targetResolver;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (ONBOOT_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        return method.equals(HttpMethod.DELETE) && ONBOOT_HOST_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.GET)) {
            List<DeferredCommandRecord> records = onboot.listScheduled();
            Map<String, Object> response = Map.of("count", records.size(), "records", records);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        }

        if (req.method().equals(HttpMethod.POST)) {
            return handleSchedule(req);
        }

        Matcher host = ONBOOT_HOST_PATTERN.matcher(path);
        if (host.matches()) {
            String hostname = QueryStringDecoder.decodeComponent(host.group(1));
            boolean deleted = onboot.cancel(hostname);
            Map<String, Object> response = Map.of("hostname", hostname, "deleted", deleted);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        }

        return ControllerResponse.notFound("unknown onboot endpoint");
    }

    /**
     * POST /api/v1/onboot
     */
    private ControllerResponse handleSchedule(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new ValidationException("request body is required");
        }
        OnbootRequest request = RouterHandler.mapper().readValue(body, OnbootRequest.class);
        request.validate();

        List<Host> hosts = targetResolver.resolve(request.targets());
        OnbootResult result = onboot.scheduleAll(hosts, request.commands(), request.options());

        HttpResponseStatus status = result.created().isEmpty() ? HttpResponseStatus.INTERNAL_SERVER_ERROR
                : HttpResponseStatus.CREATED;
        return ControllerResponse.json(status, RouterHandler.mapper().writeValueAsString(result));
    }
}
