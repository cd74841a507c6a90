package pxefleet.runner.api.v1;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.api.Controller;
import pxefleet.runner.api.v1.dto.OperationResponse;
import pxefleet.runner.api.v1.dto.ValidateCommandsResponse;
import pxefleet.runner.command.InvalidCommandSyntaxException;
import pxefleet.runner.model.Operation;
import pxefleet.runner.model.OperationStatus;
import pxefleet.runner.model.ValidationException;
import pxefleet.runner.server.RouterHandler;
import pxefleet.runner.service.OperationRequest;
import pxefleet.runner.service.OperationService;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for operations (public API).
 *
 * POST /api/v1/operations - Submit an operation
 * GET /api/v1/operations - List operations (?status=&limit=)
 * GET /api/v1/operations/{id} - Operation with sessions and stats
 * POST /api/v1/operations/{id}/cancel - Cancel
 * POST /api/v1/operations/{id}/retry - New operation for the failed hosts
 * POST /api/v1/operations/validate-commands - Parse without scheduling
 */
public class OperationController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(OperationController.class);

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private static final Pattern OPERATIONS_PATTERN = Pattern.compile("^/api/v1/operations$");
    private static final Pattern VALIDATE_PATTERN = Pattern.compile("^/api/v1/operations/validate-commands$");
    private static final Pattern OPERATION_BY_ID_PATTERN = Pattern.compile("^/api/v1/operations/([^/]+)$");
    private static final Pattern OPERATION_ACTION_PATTERN = Pattern
            .compile("^/api/v1/operations/([^/]+)/(cancel|retry)$");

    private final OperationService operationService;

    public OperationController(OperationService operationService) {
        this.operationService = operationService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return OPERATIONS_PATTERN.matcher(path).matches()
                    || VALIDATE_PATTERN.matcher(path).matches()
                    || OPERATION_ACTION_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return OPERATIONS_PATTERN.matcher(path).matches()
                    || OPERATION_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        boolean post = req.method().equals(HttpMethod.POST);

        if (post && OPERATIONS_PATTERN.matcher(path).matches()) {
            return handleSubmit(req);
        }
        if (post && VALIDATE_PATTERN.matcher(path).matches()) {
            return handleValidate(req);
        }

        Matcher action = OPERATION_ACTION_PATTERN.matcher(path);
        if (post && action.matches()) {
            return "cancel".equals(action.group(2))
                    ? handleCancel(action.group(1))
                    : handleRetry(action.group(1));
        }

        if (OPERATIONS_PATTERN.matcher(path).matches()) {
            return handleList(req);
        }

        Matcher byId = OPERATION_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            return handleGet(byId.group(1));
        }

        return ControllerResponse.notFound("unknown operation endpoint");
    }

    /**
     * POST /api/v1/operations
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        OperationRequest request = RouterHandler.mapper().readValue(body(req), OperationRequest.class);
        Operation operation = operationService.submit(request);

        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(OperationResponse.from(operation)));
    }

    /**
     * POST /api/v1/operations/validate-commands
     */
    private ControllerResponse handleValidate(FullHttpRequest req) throws Exception {
        JsonNode root = RouterHandler.mapper().readTree(body(req));
        String commands = root == null ? null : root.path("commands").asText(null);
        if (commands == null) {
            throw new ValidationException("commands is required");
        }

        ValidateCommandsResponse response;
        try {
            response = ValidateCommandsResponse.valid(operationService.validate(commands));
        } catch (InvalidCommandSyntaxException e) {
            response = ValidateCommandsResponse.invalid(e);
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/operations?status=&limit=
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        OperationStatus status = param(query, "status").map(OperationController::parseStatus).orElse(null);
        int limit = param(query, "limit").map(OperationController::parseLimit).orElse(DEFAULT_LIMIT);

        List<OperationResponse> operations = operationService.list(status, limit).stream()
                .map(OperationResponse::from)
                .toList();

        Map<String, Object> response = Map.of(
                "count", operations.size(),
                "operations", operations);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/operations/{id}
     */
    private ControllerResponse handleGet(String operationId) throws Exception {
        Optional<Operation> operation = operationService.findById(operationId);
        if (operation.isEmpty()) {
            return ControllerResponse.notFound("operation not found");
        }

        OperationResponse response = OperationResponse.from(operation.get(),
                operationService.getSessions(operationId));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /api/v1/operations/{id}/cancel
     */
    private ControllerResponse handleCancel(String operationId) throws Exception {
        Operation cancelled = operationService.cancel(operationId);
        log.info("Cancel of operation {} accepted, status {}", operationId, cancelled.status().wireName());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.from(cancelled)));
    }

    /**
     * POST /api/v1/operations/{id}/retry
     */
    private ControllerResponse handleRetry(String operationId) throws Exception {
        Operation retry = operationService.retry(operationId);
        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(OperationResponse.from(retry)));
    }

    private static String body(FullHttpRequest req) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new ValidationException("request body is required");
        }
        return body;
    }

    private static Optional<String> param(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    private static OperationStatus parseStatus(String value) {
        try {
            return OperationStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown status '" + value + "'");
        }
    }

    private static int parseLimit(String value) {
        try {
            int limit = Integer.parseInt(value.trim());
            return Math.max(1, Math.min(limit, MAX_LIMIT));
        } catch (NumberFormatException e) {
            throw new ValidationException("limit must be a number");
        }
    }
}
