package pxefleet.runner.events;

/**
 * Progress event types as seen by subscribers.
 */
public enum EventType {
    OPERATION_CREATED("operation.created"),
    OPERATION_WAKING("operation.waking"),
    OPERATION_RUNNING("operation.running"),
    OPERATION_PROGRESS("operation.progress"),
    OPERATION_COMPLETED("operation.completed"),
    OPERATION_CANCELLED("operation.cancelled"),
    SESSION_RUNNING("session.running"),
    SESSION_COMPLETED("session.completed"),
    SESSION_FAILED("session.failed"),
    SESSION_CANCELLED("session.cancelled"),
    ONBOOT_SCHEDULED("onboot.scheduled"),
    ONBOOT_CANCELLED("onboot.cancelled");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
