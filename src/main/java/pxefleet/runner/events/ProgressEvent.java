package pxefleet.runner.events;

import pxefleet.runner.model.Operation;
import pxefleet.runner.model.OperationStats;
import pxefleet.runner.model.Session;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One published state change, serialized as {@code {type, data, timestamp}}.
 */
public record ProgressEvent(String type, Map<String, Object> data, Instant timestamp) {

    public ProgressEvent {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static ProgressEvent of(EventType type, Map<String, Object> data) {
        return new ProgressEvent(type.wireName(), data, Instant.now());
    }

    /** Operation-level event with id, status, progress and stats. */
    public static ProgressEvent operation(EventType type, Operation operation, OperationStats stats) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("operationId", operation.id());
        data.put("status", operation.status().wireName());
        data.put("progress", stats.progressPercent());
        data.put("stats", stats);
        return of(type, data);
    }

    /** Session-level event; {@code reason} is included for failures. */
    public static ProgressEvent session(EventType type, Session session) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("operationId", session.operationId());
        data.put("sessionId", session.id());
        data.put("hostId", session.hostId());
        data.put("hostname", session.hostname());
        data.put("status", session.status().wireName());
        data.put("progress", session.progress());
        if (session.errorKind() != null) {
            data.put("errorKind", session.errorKind().name());
        }
        if (session.errorMessage() != null) {
            data.put("reason", session.errorMessage());
        }
        return of(type, data);
    }

    public String operationId() {
        Object id = data.get("operationId");
        return id != null ? id.toString() : null;
    }
}
