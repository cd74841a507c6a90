package pxefleet.runner.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.events.EventType;
import pxefleet.runner.events.ProgressBroadcaster;
import pxefleet.runner.events.ProgressEvent;
import pxefleet.runner.model.ErrorKind;
import pxefleet.runner.model.Session;
import pxefleet.runner.model.SessionOutcome;
import pxefleet.runner.repository.SessionRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Fails sessions left CONNECTING or RUNNING without a heartbeat.
 *
 * Sessions get stuck when the process dies mid-execution. They are failed
 * with {@link ErrorKind#TIMEOUT} and never re-dispatched, since the host may
 * already have run part of the command list.
 *
 * Sessions executing in this process are skipped; their heartbeat is
 * refreshed by the scheduler every tick.
 */
public class StaleSessionReaper {

    private static final Logger log = LoggerFactory.getLogger(StaleSessionReaper.class);

    private final SessionRepository sessionRepository;
    private final ProgressBroadcaster broadcaster;
    private final Duration staleTimeout;
    private final Supplier<Set<String>> inFlight;

    public StaleSessionReaper(SessionRepository sessionRepository, ProgressBroadcaster broadcaster,
            Duration staleTimeout, Supplier<Set<String>> inFlight) {
        this.sessionRepository = sessionRepository;
        this.broadcaster = broadcaster;
        this.staleTimeout = staleTimeout;
        this.inFlight = inFlight;
    }

    /**
     * Find and fail stale sessions.
     *
     * @return number of sessions failed
     */
    public int reapStaleSessions() {
        Instant cutoff = Instant.now().minus(staleTimeout);
        List<Session> stale = sessionRepository.findStale(cutoff);

        if (stale.isEmpty()) {
            log.debug("No stale sessions found");
            return 0;
        }

        Set<String> running = inFlight.get();
        int reaped = 0;

        for (Session session : stale) {
            if (running.contains(session.id())) {
                continue;
            }
            try {
                String reason = "Heartbeat lost while " + session.status().wireName()
                        + (session.heartbeatAt() != null ? " (last at " + session.heartbeatAt() + ")" : "");
                if (sessionRepository.finish(session.id(), SessionOutcome.failed(ErrorKind.TIMEOUT, reason))) {
                    reaped++;
                    log.warn("Session {} on {} failed: {}", session.id(), session.hostname(), reason);
                    broadcaster.publish(ProgressEvent.session(EventType.SESSION_FAILED,
                            session.toBuilder().outcome(SessionOutcome.failed(ErrorKind.TIMEOUT, reason)).build()));
                }
            } catch (Exception e) {
                log.error("Failed to reap session {}", session.id(), e);
            }
        }

        if (reaped > 0) {
            log.info("Session reaper: {} failed, {} stale total", reaped, stale.size());
        }
        return reaped;
    }
}
