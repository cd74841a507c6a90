package pxefleet.runner.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.command.CommandParser;
import pxefleet.runner.command.CommandPlan;
import pxefleet.runner.events.EventType;
import pxefleet.runner.events.ProgressBroadcaster;
import pxefleet.runner.events.ProgressEvent;
import pxefleet.runner.model.ErrorKind;
import pxefleet.runner.model.Host;
import pxefleet.runner.model.Session;
import pxefleet.runner.model.SessionOutcome;
import pxefleet.runner.model.SessionStatus;
import pxefleet.runner.model.ValidationException;
import pxefleet.runner.onboot.DeferredCommandRecord;
import pxefleet.runner.onboot.OnbootScheduler;
import pxefleet.runner.remote.AbortSignal;
import pxefleet.runner.remote.ExecutionListener;
import pxefleet.runner.remote.RemoteExecutor;
import pxefleet.runner.repository.HostRepository;
import pxefleet.runner.repository.SessionRepository;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Executes one session on a worker thread and writes its terminal state.
 * The session is owned by this worker from CONNECTING until it is terminal.
 */
class SessionWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SessionWorker.class);

    private final Session session;
    private final boolean deferred;
    private final AbortSignal abort;
    private final SessionRepository sessions;
    private final HostRepository hosts;
    private final RemoteExecutor executor;
    private final OnbootScheduler onboot;
    private final ProgressBroadcaster broadcaster;
    private final Consumer<Session> onDone;

    SessionWorker(Session session, boolean deferred, AbortSignal abort, SessionRepository sessions,
            HostRepository hosts, RemoteExecutor executor, OnbootScheduler onboot, ProgressBroadcaster broadcaster,
            Consumer<Session> onDone) {
        this.session = session;
        this.deferred = deferred;
        this.abort = abort;
        this.sessions = sessions;
        this.hosts = hosts;
        this.executor = executor;
        this.onboot = onboot;
        this.broadcaster = broadcaster;
        this.onDone = onDone;
    }

    @Override
    public void run() {
        String sessionId = session.id();
        try {
            if (!sessions.markConnecting(sessionId)) {
                log.debug("Session {} is no longer pending, skipping", sessionId);
                return;
            }

            SessionOutcome outcome = execute();
            finish(outcome);
        } catch (RuntimeException e) {
            log.error("Session {} on {} crashed", sessionId, session.hostname(), e);
            try {
                finish(SessionOutcome.failed(ErrorKind.COMMAND_EXECUTION, "Internal error: " + e.getMessage()));
            } catch (RuntimeException e2) {
                log.error("Failed to record crash of session {}", sessionId, e2);
            }
        } finally {
            onDone.accept(session);
        }
    }

    private SessionOutcome execute() {
        if (abort.isAborted()) {
            return SessionOutcome.cancelled("Cancelled before connect");
        }

        Optional<Host> host = hosts.findById(session.hostId());
        if (host.isEmpty()) {
            return SessionOutcome.failed(ErrorKind.VALIDATION, "Unknown host: " + session.hostId());
        }

        CommandPlan plan = CommandParser.parse(session.commands());
        return deferred ? scheduleOnboot(host.get(), plan) : executeNow(host.get(), plan);
    }

    private SessionOutcome executeNow(Host host, CommandPlan plan) {
        return executor.execute(host, plan, abort, new ExecutionListener() {
            @Override
            public void onConnected() {
                dropStaleOnbootRecord(host);
                markRunning();
            }

            @Override
            public void onCommandCompleted(int index, int total) {
                sessions.updateProgress(session.id(), index * 100 / total);
            }
        });
    }

    private SessionOutcome scheduleOnboot(Host host, CommandPlan plan) {
        markRunning();
        try {
            DeferredCommandRecord record = onboot.schedule(host.hostname(), plan);
            return SessionOutcome.completed(null, "onboot: " + record.rawContent());
        } catch (ValidationException e) {
            return SessionOutcome.failed(ErrorKind.VALIDATION, e.getMessage());
        } catch (RuntimeException e) {
            String reason = e.getCause() != null ? e.getCause().toString() : e.getMessage();
            return SessionOutcome.failed(ErrorKind.COMMAND_EXECUTION, "Onboot record not written: " + reason);
        }
    }

    private void markRunning() {
        if (sessions.markRunning(session.id())) {
            broadcaster.publish(ProgressEvent.session(EventType.SESSION_RUNNING,
                    session.toBuilder().status(SessionStatus.RUNNING).build()));
        }
    }

    /** A pending onboot record would re-run at next boot what runs now. */
    private void dropStaleOnbootRecord(Host host) {
        try {
            if (onboot.cancel(host.hostname())) {
                log.info("Removed pending onboot record of {} before direct execution", host.hostname());
            }
        } catch (RuntimeException e) {
            log.warn("Could not remove onboot record of {}: {}", host.hostname(), e.getMessage());
        }
    }

    private void finish(SessionOutcome outcome) {
        if (!sessions.finish(session.id(), outcome)) {
            return;
        }

        Session finished = sessions.findById(session.id())
                .orElseGet(() -> session.toBuilder().outcome(outcome).build());

        switch (outcome.status()) {
            case COMPLETED -> {
                log.info("Session {} on {} completed", finished.id(), finished.hostname());
                broadcaster.publish(ProgressEvent.session(EventType.SESSION_COMPLETED, finished));
            }
            case CANCELLED -> {
                log.info("Session {} on {} cancelled: {}", finished.id(), finished.hostname(), outcome.message());
                broadcaster.publish(ProgressEvent.session(EventType.SESSION_CANCELLED, finished));
            }
            default -> {
                log.warn("Session {} on {} failed ({}): {}", finished.id(), finished.hostname(),
                        outcome.errorKind(), outcome.message());
                broadcaster.publish(ProgressEvent.session(EventType.SESSION_FAILED, finished));
            }
        }
    }
}
