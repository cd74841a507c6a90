package pxefleet.runner.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.api.Controller;
import pxefleet.runner.api.Controller.ControllerResponse;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.CONFLICT;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Failures thrown by controllers map to status codes:
 * validation errors and malformed JSON to 400, unknown ids to 404,
 * state conflicts to 409, anything else to 500.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        ControllerResponse response;
        try {
            response = route(ctx, req, method, path);
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON for {} {}: {}", method, path, e.getOriginalMessage());
            response = ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Validation error for {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.badRequest(e.getMessage());
        } catch (NoSuchElementException e) {
            response = ControllerResponse.error(NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            log.info("Conflict for {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.error(CONFLICT, e.getMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            response = ControllerResponse.error(INTERNAL_SERVER_ERROR, errorChain(e));
        }

        writeSafe(ctx, response.status(), response.contentType(), response.body());
    }

    private ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method, String path)
            throws Exception {
        for (Controller controller : controllers) {
            if (controller.matches(method, path)) {
                return controller.handle(ctx, req, path);
            }
        }

        log.debug("No handler for: {} {}", method, path);
        return ControllerResponse.error(NOT_FOUND, "not found");
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeSafe(ctx, BAD_REQUEST, "application/json",
                    "{\"error\":\"" + ControllerResponse.escapeJson(cause.getMessage()) + "\"}");
        } finally {
            ctx.close();
        }
    }

    private static String errorChain(Throwable t) {
        StringBuilder chain = new StringBuilder(t.toString());
        Throwable cause = t.getCause();
        while (cause != null) {
            chain.append(" <- ").append(cause);
            cause = cause.getCause();
        }
        return chain.toString();
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
