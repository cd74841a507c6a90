package pxefleet.runner.events;

/**
 * Write-only sink for state changes. Publishing never waits for subscribers.
 */
public interface ProgressBroadcaster {

    ProgressBroadcaster NONE = event -> {
    };

    void publish(ProgressEvent event);
}
