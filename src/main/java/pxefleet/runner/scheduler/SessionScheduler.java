package pxefleet.runner.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.config.RunnerConfig;
import pxefleet.runner.events.EventType;
import pxefleet.runner.events.ProgressBroadcaster;
import pxefleet.runner.events.ProgressEvent;
import pxefleet.runner.model.ErrorKind;
import pxefleet.runner.model.Host;
import pxefleet.runner.model.Operation;
import pxefleet.runner.model.OperationStats;
import pxefleet.runner.model.OperationStatus;
import pxefleet.runner.model.Session;
import pxefleet.runner.model.SessionStatus;
import pxefleet.runner.onboot.OnbootScheduler;
import pxefleet.runner.remote.AbortSignal;
import pxefleet.runner.remote.RemoteExecutor;
import pxefleet.runner.repository.HostRepository;
import pxefleet.runner.repository.OperationRepository;
import pxefleet.runner.repository.SessionRepository;
import pxefleet.runner.wake.WakeResult;
import pxefleet.runner.wake.WakeStager;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The operation runner: one coordinator thread polling active operations and
 * a fixed pool of workers executing sessions.
 *
 * <p>
 * Each tick, oldest operation first:
 * <ol>
 * <li>refresh heartbeats of sessions running here and fail stale ones</li>
 * <li>wake hosts and wait out the wake window if requested</li>
 * <li>create one session per target host that no other session holds; busy
 * hosts are retried on later ticks, up to a bounded number of interval polls</li>
 * <li>dispatch pending sessions into free worker slots</li>
 * <li>finish operations whose hosts all have a terminal session</li>
 * </ol>
 *
 * A finished session triggers an extra pass so freed slots and hosts are
 * reused at once; those passes do not count against the busy-host bound.
 *
 * <p>
 * All state lives in the repositories, so a restarted runner resumes where
 * the previous one stopped. Only one runner may work against a store.
 */
public class SessionScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionScheduler.class);

    private final OperationRepository operations;
    private final SessionRepository sessions;
    private final HostRepository hosts;
    private final RemoteExecutor executor;
    private final OnbootScheduler onboot;
    private final WakeStager wakeStager;
    private final ProgressBroadcaster broadcaster;
    private final RunnerConfig config;

    private final HostLockRegistry locks = new HostLockRegistry();
    private final StaleSessionReaper reaper;
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();

    private final ScheduledExecutorService coordinator;
    private final ExecutorService workers;
    private final AtomicBoolean passQueued = new AtomicBoolean();

    private volatile boolean running = false;
    private volatile boolean paused = false;

    private record InFlight(String operationId, String hostId, AbortSignal abort) {
    }

    public SessionScheduler(OperationRepository operations, SessionRepository sessions, HostRepository hosts,
            RemoteExecutor executor, OnbootScheduler onboot, WakeStager wakeStager,
            ProgressBroadcaster broadcaster, RunnerConfig config) {
        this.operations = operations;
        this.sessions = sessions;
        this.hosts = hosts;
        this.executor = executor;
        this.onboot = onboot;
        this.wakeStager = wakeStager;
        this.broadcaster = broadcaster;
        this.config = config;
        this.reaper = new StaleSessionReaper(sessions, broadcaster, config.staleSessionTimeout(),
                inFlight::keySet);

        this.coordinator = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "runner-coordinator");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger workerIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.maxConcurrentSessions(), r -> {
            Thread t = new Thread(r, "runner-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ---------- lifecycle ----------

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;
        long intervalMs = config.pollInterval().toMillis();
        coordinator.scheduleWithFixedDelay(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Scheduler started: poll every {}ms, {} concurrent sessions",
                intervalMs, config.maxConcurrentSessions());
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        coordinator.shutdown();
        workers.shutdown();

        try {
            if (!coordinator.awaitTermination(5, TimeUnit.SECONDS)) {
                coordinator.shutdownNow();
            }
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
                log.warn("Scheduler forcefully stopped with {} sessions in flight", inFlight.size());
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            coordinator.shutdownNow();
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
        if (!coordinator.isShutdown()) {
            coordinator.shutdownNow();
            workers.shutdownNow();
        }
    }

    /** Stop taking up work; sessions already running continue. */
    public void pause() {
        paused = true;
        log.info("Scheduler paused");
    }

    public void resume() {
        paused = false;
        log.info("Scheduler resumed");
        requestPass();
    }

    public boolean isRunning() {
        return running;
    }

    public WorkerStatus status() {
        Set<String> activeOperations = inFlight.values().stream()
                .map(InFlight::operationId)
                .collect(Collectors.toCollection(TreeSet::new));
        return new WorkerStatus(running, paused, config.pollInterval().toMillis(),
                config.maxConcurrentSessions(), inFlight.size(), activeOperations);
    }

    /**
     * Wait until no session is executing.
     *
     * @return true if idle before the timeout
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!inFlight.isEmpty()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    public HostLockRegistry locks() {
        return locks;
    }

    // ---------- the poll loop ----------

    /**
     * Run one interval poll. Called by the coordinator thread; public so
     * tests can drive the loop step by step.
     */
    public void tick() {
        pass(true);
    }

    private synchronized void pass(boolean intervalPoll) {
        if (paused) {
            log.debug("Scheduler paused, skipping tick");
            return;
        }

        try {
            sessions.touchHeartbeats(Set.copyOf(inFlight.keySet()));
            reaper.reapStaleSessions();

            for (Operation operation : operations.findActive()) {
                try {
                    process(operation, intervalPoll);
                } catch (RuntimeException e) {
                    log.error("Failed to process operation {}", operation.id(), e);
                }
            }
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }

    private void process(Operation operation, boolean intervalPoll) {
        Operation op = operation;

        if (!op.cancelRequested()) {
            if (op.options().wakeOnLan()) {
                op = stageWake(op);
                if (op.status() == OperationStatus.WAKING && Instant.now().isBefore(op.wakeUntil())) {
                    log.debug("Operation {} waiting for hosts until {}", op.id(), op.wakeUntil());
                    return;
                }
            }

            assignHosts(op, intervalPoll);
            op = dispatch(op);
        }

        settle(op);
    }

    private Operation stageWake(Operation op) {
        if (op.status() != OperationStatus.PENDING) {
            return op;
        }

        List<Host> targets = hosts.findByIds(op.targetHosts());
        WakeResult result = wakeStager.wake(targets);
        Instant until = wakeStager.readyAt(Instant.now(), op.options().wakeDelaySeconds());

        if (!operations.markWaking(op.id(), until)) {
            return op;
        }

        Operation waking = op.toBuilder().status(OperationStatus.WAKING).wakeUntil(until).build();
        log.info("Operation {} waking {} hosts ({} failed), dispatch at {}",
                op.id(), result.sent(), result.failed(), until);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("operationId", op.id());
        data.put("status", OperationStatus.WAKING.wireName());
        data.put("sent", result.sent());
        data.put("failed", result.failedHosts());
        data.put("wakeUntil", until.toString());
        broadcaster.publish(ProgressEvent.of(EventType.OPERATION_WAKING, data));
        return waking;
    }

    /**
     * Create sessions for target hosts without one. A host holding a
     * non-terminal session of any operation is skipped this tick.
     */
    private void assignHosts(Operation op, boolean intervalPoll) {
        Set<String> assigned = sessions.findByOperationId(op.id()).stream()
                .map(Session::hostId)
                .collect(Collectors.toSet());

        List<String> unassigned = op.targetHosts().stream()
                .filter(id -> !assigned.contains(id))
                .toList();
        if (unassigned.isEmpty()) {
            return;
        }

        Map<String, Host> known = hosts.findByIds(unassigned).stream()
                .collect(Collectors.toMap(Host::id, Function.identity()));
        List<Host> busy = new ArrayList<>();

        for (String hostId : unassigned) {
            Host host = known.get(hostId);
            if (host == null) {
                Session failed = newSession(op, hostId, null)
                        .status(SessionStatus.FAILED)
                        .errorKind(ErrorKind.VALIDATION)
                        .errorMessage("Unknown host: " + hostId)
                        .completedAt(Instant.now())
                        .build();
                sessions.save(failed);
                broadcaster.publish(ProgressEvent.session(EventType.SESSION_FAILED, failed));
                continue;
            }

            String sessionId = UUID.randomUUID().toString();
            if (!locks.tryClaim(hostId, sessionId)) {
                busy.add(host);
                continue;
            }
            if (sessions.findActiveByHostId(hostId).isPresent()) {
                locks.release(hostId, sessionId);
                busy.add(host);
                continue;
            }

            sessions.save(newSession(op, hostId, host.hostname()).id(sessionId).build());
            log.debug("Session {} created for {} in operation {}", sessionId, host.hostname(), op.id());
        }

        if (!busy.isEmpty() && intervalPoll) {
            handleBusyHosts(op, busy);
        }
    }

    private void handleBusyHosts(Operation op, List<Host> busy) {
        int polls = operations.incrementBusyPolls(op.id());
        if (polls < config.maxBusyPolls()) {
            log.debug("Operation {}: {} hosts busy, retry next poll ({}/{})",
                    op.id(), busy.size(), polls, config.maxBusyPolls());
            return;
        }

        for (Host host : busy) {
            Session failed = newSession(op, host.id(), host.hostname())
                    .status(SessionStatus.FAILED)
                    .errorKind(ErrorKind.HOST_BUSY)
                    .errorMessage("Host still busy with another operation after " + polls + " polls")
                    .completedAt(Instant.now())
                    .build();
            sessions.save(failed);
            log.warn("Operation {}: giving up on busy host {}", op.id(), host.hostname());
            broadcaster.publish(ProgressEvent.session(EventType.SESSION_FAILED, failed));
        }
    }

    private Operation dispatch(Operation op) {
        int free = config.maxConcurrentSessions() - inFlight.size();
        if (free <= 0) {
            return op;
        }

        List<Session> ready = sessions.findByOperationId(op.id()).stream()
                .filter(s -> s.status() == SessionStatus.PENDING)
                .filter(s -> !inFlight.containsKey(s.id()))
                .toList();
        if (ready.isEmpty()) {
            return op;
        }

        Operation current = op;
        if (op.status() != OperationStatus.RUNNING && operations.markRunning(op.id())) {
            current = op.toBuilder().status(OperationStatus.RUNNING).startedAt(Instant.now()).build();
            log.info("Operation {} running on {} hosts", op.id(), op.targetHosts().size());
            broadcaster.publish(ProgressEvent.operation(EventType.OPERATION_RUNNING, current, current.stats()));
        }

        for (Session session : ready) {
            if (free <= 0) {
                break;
            }
            if (submit(current, session)) {
                free--;
            }
        }
        return current;
    }

    private boolean submit(Operation op, Session session) {
        AbortSignal abort = new AbortSignal();
        inFlight.put(session.id(), new InFlight(op.id(), session.hostId(), abort));
        // re-claim after a restart, when only the store knows the holder
        locks.tryClaim(session.hostId(), session.id());

        SessionWorker worker = new SessionWorker(session, op.options().deferred(), abort, sessions, hosts,
                executor, onboot, broadcaster, this::sessionDone);
        try {
            workers.execute(worker);
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected session {}: {}", session.id(), e.getMessage());
            inFlight.remove(session.id());
            return false;
        }
    }

    private void sessionDone(Session session) {
        locks.release(session.hostId(), session.id());
        inFlight.remove(session.id());
        requestPass();
    }

    /** Publish progress, or finish the operation once every host is accounted for. */
    private void settle(Operation op) {
        List<Session> current = sessions.findByOperationId(op.id());
        OperationStats stats = OperationStats.of(op.targetHosts().size(), current);

        Set<String> finishedHosts = new HashSet<>();
        for (Session s : current) {
            if (s.isTerminal()) {
                finishedHosts.add(s.hostId());
            }
        }
        boolean allTerminal = current.stream().allMatch(Session::isTerminal)
                && finishedHosts.containsAll(op.targetHosts());

        if (allTerminal) {
            finish(op, current, stats);
        } else if (!stats.equals(op.stats())) {
            if (operations.updateProgress(op.id(), stats)) {
                broadcaster.publish(ProgressEvent.operation(EventType.OPERATION_PROGRESS, op, stats));
            }
        }
    }

    private void finish(Operation op, List<Session> current, OperationStats stats) {
        OperationStatus status = finalStatus(op, current, stats);
        if (!operations.markFinished(op.id(), status, stats)) {
            return;
        }

        Operation finished = op.toBuilder()
                .status(status)
                .progress(stats.progressPercent())
                .completedSessions(stats.completed())
                .failedSessions(stats.failed())
                .cancelledSessions(stats.cancelled())
                .completedAt(Instant.now())
                .build();
        broadcaster.publish(ProgressEvent.operation(EventType.OPERATION_COMPLETED, finished, stats));
    }

    static OperationStatus finalStatus(Operation op, List<Session> current, OperationStats stats) {
        boolean anyStarted = current.stream().anyMatch(Session::wasStarted);
        if (op.cancelRequested() && !anyStarted) {
            return OperationStatus.CANCELLED;
        }
        if (stats.completed() == stats.total()) {
            return OperationStatus.COMPLETED;
        }
        if (stats.completed() > 0) {
            return OperationStatus.COMPLETED_WITH_ERRORS;
        }
        if (stats.failed() > 0) {
            return OperationStatus.FAILED;
        }
        return OperationStatus.CANCELLED;
    }

    // ---------- cancellation ----------

    /**
     * Cancel an operation. Not-started sessions are cancelled at once;
     * running ones are asked to abort and keep whatever outcome they reach.
     *
     * @return the operation after cancellation was applied
     * @throws NoSuchElementException if the operation does not exist
     * @throws IllegalStateException  if the operation already finished
     */
    public synchronized Operation cancel(String operationId) {
        Operation op = operations.findById(operationId)
                .orElseThrow(() -> new NoSuchElementException("Operation not found: " + operationId));
        if (op.isTerminal()) {
            throw new IllegalStateException("Operation " + operationId + " is already " + op.status().wireName());
        }

        operations.requestCancel(operationId);

        for (Session cancelled : sessions.cancelNotStarted(operationId)) {
            locks.release(cancelled.hostId(), cancelled.id());
            broadcaster.publish(ProgressEvent.session(EventType.SESSION_CANCELLED, cancelled));
        }

        Set<String> assigned = sessions.findByOperationId(operationId).stream()
                .map(Session::hostId)
                .collect(Collectors.toSet());
        for (String hostId : op.targetHosts()) {
            if (!assigned.contains(hostId)) {
                String hostname = hosts.findById(hostId).map(Host::hostname).orElse(null);
                sessions.save(newSession(op, hostId, hostname)
                        .status(SessionStatus.CANCELLED)
                        .errorKind(ErrorKind.CANCELLED)
                        .errorMessage("Cancelled before start")
                        .completedAt(Instant.now())
                        .build());
            }
        }

        int aborted = 0;
        for (InFlight handle : inFlight.values()) {
            if (handle.operationId().equals(operationId)) {
                handle.abort().abort();
                aborted++;
            }
        }

        Operation requested = operations.findById(operationId).orElseThrow();
        log.info("Operation {} cancel requested ({} in-flight sessions signalled)", operationId, aborted);
        broadcaster.publish(ProgressEvent.operation(EventType.OPERATION_CANCELLED, requested, requested.stats()));

        settle(requested);
        return operations.findById(operationId).orElseThrow();
    }

    private void requestPass() {
        if (!running || !passQueued.compareAndSet(false, true)) {
            return;
        }
        try {
            coordinator.execute(() -> {
                passQueued.set(false);
                pass(false);
            });
        } catch (RejectedExecutionException e) {
            passQueued.set(false);
            log.debug("Pass not scheduled, coordinator is shutting down");
        }
    }

    private static Session.Builder newSession(Operation op, String hostId, String hostname) {
        return Session.builder()
                .id(UUID.randomUUID().toString())
                .operationId(op.id())
                .hostId(hostId)
                .hostname(hostname)
                .commands(op.commands())
                .createdAt(Instant.now());
    }
}
