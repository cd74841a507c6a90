package pxefleet.runner.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans events out to every registered sink. A failing sink is logged and
 * skipped; {@link #publish} never throws.
 */
public final class SafeProgressBroadcaster implements ProgressBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(SafeProgressBroadcaster.class);

    private final List<ProgressBroadcaster> sinks = new CopyOnWriteArrayList<>();

    public SafeProgressBroadcaster(ProgressBroadcaster... sinks) {
        this.sinks.addAll(List.of(sinks));
    }

    public SafeProgressBroadcaster add(ProgressBroadcaster sink) {
        sinks.add(sink);
        return this;
    }

    @Override
    public void publish(ProgressEvent event) {
        for (ProgressBroadcaster sink : sinks) {
            try {
                sink.publish(event);
            } catch (RuntimeException e) {
                log.warn("Broadcast of {} failed: {}", event.type(), e.getMessage());
            }
        }
    }
}
