package pxefleet.runner.scheduler;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pxefleet.runner.config.RunnerConfig;
import pxefleet.runner.events.EventType;
import pxefleet.runner.fakes.FakeRemoteShell;
import pxefleet.runner.fakes.FakeWakeOnLanSender;
import pxefleet.runner.fakes.RecordingBroadcaster;
import pxefleet.runner.model.ErrorKind;
import pxefleet.runner.model.Host;
import pxefleet.runner.model.Operation;
import pxefleet.runner.model.OperationOptions;
import pxefleet.runner.model.OperationStats;
import pxefleet.runner.model.OperationStatus;
import pxefleet.runner.model.Session;
import pxefleet.runner.model.SessionStatus;
import pxefleet.runner.onboot.OnbootScheduler;
import pxefleet.runner.remote.RemoteExecutor;
import pxefleet.runner.store.Database;
import pxefleet.runner.store.JdbcHostRepository;
import pxefleet.runner.store.JdbcOperationRepository;
import pxefleet.runner.store.JdbcSessionRepository;
import pxefleet.runner.wake.WakeStager;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionSchedulerTest {

    private static Database db;
    private static JdbcHostRepository hostRepo;
    private static JdbcOperationRepository operationRepo;
    private static JdbcSessionRepository sessionRepo;

    @TempDir
    Path tempDir;

    private FakeRemoteShell shell;
    private FakeWakeOnLanSender wakeSender;
    private RecordingBroadcaster events;
    private OnbootScheduler onboot;
    private SessionScheduler scheduler;

    @BeforeAll
    static void setup() {
        RunnerConfig config = RunnerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-scheduler;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        hostRepo = new JdbcHostRepository(db);
        operationRepo = new JdbcOperationRepository(db);
        sessionRepo = new JdbcSessionRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void init() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM sessions");
            st.execute("DELETE FROM operations");
            st.execute("DELETE FROM hosts");
            conn.commit();
        }

        for (int i = 1; i <= 3; i++) {
            hostRepo.save(new Host("h" + i, "pc0" + i, "aa:bb:cc:dd:ee:0" + i, "10.0.0." + i, "r101", "lab"));
        }

        RunnerConfig config = RunnerConfig.defaults()
                .withMaxConcurrentSessions(2)
                .withMaxBusyPolls(3)
                .withStaleSessionTimeout(Duration.ofMinutes(1))
                .withOnbootDirectory(tempDir.resolve("linbocmd"));

        shell = new FakeRemoteShell();
        wakeSender = new FakeWakeOnLanSender();
        events = new RecordingBroadcaster();
        onboot = new OnbootScheduler(config.onbootDirectory(), events);
        scheduler = new SessionScheduler(operationRepo, sessionRepo, hostRepo,
                new RemoteExecutor(shell, config), onboot, new WakeStager(wakeSender), events, config);
    }

    @AfterEach
    void shutdown() {
        scheduler.close();
    }

    @Test
    @DisplayName("Three hosts, two slots: every host runs once, never more than two at a time")
    void completesAllHostsWithinConcurrencyLimit() {
        Operation op = submit("op-1", List.of("h1", "h2", "h3"), "sync:1,start:1", OperationOptions.immediate());

        Operation done = runToCompletion(op.id());

        assertEquals(OperationStatus.COMPLETED, done.status());
        assertEquals(new OperationStats(3, 3, 0, 0, 0), done.stats());
        assertEquals(100, done.progress());
        assertTrue(shell.maxConcurrentChannels() <= 2);

        List<Session> sessions = sessionRepo.findByOperationId(op.id());
        assertEquals(3, sessions.size());
        for (Session s : sessions) {
            assertEquals(SessionStatus.COMPLETED, s.status());
            assertEquals(100, s.progress());
            assertEquals(2, shell.executed(hostRepo.findById(s.hostId()).orElseThrow().ipAddress()).size());
        }

        assertEquals(1, events.ofType(EventType.OPERATION_RUNNING).size());
        assertEquals(3, events.ofType(EventType.SESSION_COMPLETED).size());
        List<String> types = events.types();
        assertEquals(EventType.OPERATION_COMPLETED.wireName(), types.get(types.size() - 1));
        assertEquals(0, scheduler.locks().size());
    }

    @Test
    void unreachableHostEndsWithErrors() {
        shell.unreachable("10.0.0.2");
        Operation op = submit("op-1", List.of("h1", "h2"), "sync:1", OperationOptions.immediate());

        Operation done = runToCompletion(op.id());

        assertEquals(OperationStatus.COMPLETED_WITH_ERRORS, done.status());
        assertEquals(new OperationStats(2, 1, 1, 0, 0), done.stats());
        Session failed = sessionFor(op.id(), "h2");
        assertEquals(SessionStatus.FAILED, failed.status());
        assertEquals(ErrorKind.CONNECTION, failed.errorKind());
        assertNotNull(failed.errorMessage());
    }

    @Test
    void everyHostFailingFailsOperation() {
        shell.failWhen("sync:1", 1);
        Operation op = submit("op-1", List.of("h1", "h2"), "sync:1,start:1", OperationOptions.immediate());

        Operation done = runToCompletion(op.id());

        assertEquals(OperationStatus.FAILED, done.status());
        Session failed = sessionFor(op.id(), "h1");
        assertEquals(ErrorKind.COMMAND_EXECUTION, failed.errorKind());
        assertEquals(1, failed.failedCommandIndex());
        assertEquals(1, shell.executed("10.0.0.1").size(), "start:1 never ran");
    }

    @Test
    void unknownHostFailsWithValidationError() {
        Operation op = submit("op-1", List.of("h1", "ghost"), "sync:1", OperationOptions.immediate());

        Operation done = runToCompletion(op.id());

        assertEquals(OperationStatus.COMPLETED_WITH_ERRORS, done.status());
        Session ghost = sessionFor(op.id(), "ghost");
        assertEquals(ErrorKind.VALIDATION, ghost.errorKind());
        assertEquals("Unknown host: ghost", ghost.errorMessage());
    }

    @Test
    @DisplayName("A host is held by one session at a time; the later operation waits")
    void hostIsExclusiveAcrossOperations() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        shell.hold(gate, started);

        Instant now = Instant.now();
        Operation first = submit("op-first", List.of("h1"), "sync:1", OperationOptions.immediate(),
                now.minusSeconds(10));
        Operation second = submit("op-second", List.of("h1"), "start:1", OperationOptions.immediate(), now);

        scheduler.tick();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertEquals(1, sessionRepo.findByOperationId(first.id()).size());
        assertTrue(sessionRepo.findByOperationId(second.id()).isEmpty(), "second waits for the host");
        assertEquals(1, operationRepo.findById(second.id()).orElseThrow().busyPolls());

        gate.countDown();
        assertEquals(OperationStatus.COMPLETED, runToCompletion(first.id()).status());
        assertEquals(OperationStatus.COMPLETED, runToCompletion(second.id()).status());

        assertEquals(List.of("/usr/bin/linbo_wrapper sync:1", "/usr/bin/linbo_wrapper start:1"),
                shell.executed("10.0.0.1"));
        assertEquals(1, shell.maxConcurrentChannels());
    }

    @Test
    void hostBusyTooLongFailsWithHostBusy() {
        sessionRepo.save(Session.builder()
                .id("foreign")
                .operationId("elsewhere")
                .hostId("h1")
                .hostname("pc01")
                .commands("sync:1")
                .status(SessionStatus.RUNNING)
                .heartbeatAt(Instant.now().plusSeconds(3600))
                .createdAt(Instant.now())
                .build());
        Operation op = submit("op-1", List.of("h1"), "sync:1", OperationOptions.immediate());

        scheduler.tick();
        scheduler.tick();
        assertTrue(sessionRepo.findByOperationId(op.id()).isEmpty());
        scheduler.tick();

        Operation done = operationRepo.findById(op.id()).orElseThrow();
        assertEquals(OperationStatus.FAILED, done.status());
        assertEquals(ErrorKind.HOST_BUSY, sessionFor(op.id(), "h1").errorKind());
        assertTrue(shell.connects().isEmpty());
    }

    @Test
    @DisplayName("Passes triggered by finished sessions do not use up the busy-host bound")
    void sessionCompletionsDoNotCountAsBusyPolls() throws Exception {
        for (int i = 4; i <= 8; i++) {
            hostRepo.save(new Host("h" + i, "pc0" + i, "aa:bb:cc:dd:ee:0" + i, "10.0.0." + i, "r101", "lab"));
        }
        sessionRepo.save(Session.builder()
                .id("foreign")
                .operationId("elsewhere")
                .hostId("h1")
                .hostname("pc01")
                .commands("sync:1")
                .status(SessionStatus.RUNNING)
                .heartbeatAt(Instant.now().plusSeconds(3600))
                .createdAt(Instant.now())
                .build());

        Instant now = Instant.now();
        Operation busy = submit("op-busy", List.of("h1"), "sync:1", OperationOptions.immediate(),
                now.minusSeconds(10));
        Operation other = submit("op-other", List.of("h2", "h3", "h4", "h5", "h6", "h7", "h8"), "sync:1",
                OperationOptions.immediate(), now);

        RunnerConfig config = RunnerConfig.defaults()
                .withPollInterval(Duration.ofHours(1))
                .withMaxConcurrentSessions(1)
                .withMaxBusyPolls(3)
                .withStaleSessionTimeout(Duration.ofMinutes(1))
                .withOnbootDirectory(tempDir.resolve("linbocmd"));
        try (SessionScheduler slow = new SessionScheduler(operationRepo, sessionRepo, hostRepo,
                new RemoteExecutor(shell, config), onboot, new WakeStager(wakeSender), events, config)) {
            slow.start();

            long deadline = System.currentTimeMillis() + 10_000;
            while (!operationRepo.findById(other.id()).orElseThrow().isTerminal()
                    && System.currentTimeMillis() < deadline) {
                TimeUnit.MILLISECONDS.sleep(20);
            }
            assertEquals(OperationStatus.COMPLETED, operationRepo.findById(other.id()).orElseThrow().status());
            assertTrue(slow.awaitIdle(Duration.ofSeconds(5)));
        }

        Operation waiting = operationRepo.findById(busy.id()).orElseThrow();
        assertEquals(OperationStatus.PENDING, waiting.status());
        assertEquals(1, waiting.busyPolls());
        assertTrue(sessionRepo.findByOperationId(busy.id()).isEmpty());
    }

    @Test
    @DisplayName("After a crash, orphaned sessions fail and are never re-dispatched")
    void resumesAfterRestartWithoutDuplicates() {
        Instant old = Instant.now().minus(Duration.ofMinutes(10));
        Operation op = submit("op-1", List.of("h1", "h2", "h3"), "sync:1", OperationOptions.immediate(), old);
        operationRepo.markRunning(op.id());
        sessionRepo.save(Session.builder().id("s1").operationId(op.id()).hostId("h1").hostname("pc01")
                .commands("sync:1").status(SessionStatus.RUNNING)
                .startedAt(old).heartbeatAt(old).createdAt(old).build());
        sessionRepo.save(Session.builder().id("s2").operationId(op.id()).hostId("h2").hostname("pc02")
                .commands("sync:1").status(SessionStatus.PENDING).createdAt(old).build());

        Operation done = runToCompletion(op.id());

        assertEquals(OperationStatus.COMPLETED_WITH_ERRORS, done.status());
        assertEquals(new OperationStats(3, 2, 1, 0, 0), done.stats());
        assertEquals(ErrorKind.TIMEOUT, sessionRepo.findById("s1").orElseThrow().errorKind());
        assertEquals(SessionStatus.COMPLETED, sessionRepo.findById("s2").orElseThrow().status());
        assertEquals(3, sessionRepo.findByOperationId(op.id()).size());
        assertTrue(shell.executed("10.0.0.1").isEmpty(), "orphaned host is not run again");
    }

    @Test
    void cancelBeforeStartCancelsEverything() {
        Operation op = submit("op-1", List.of("h1", "h2"), "sync:1", OperationOptions.immediate());

        Operation cancelled = scheduler.cancel(op.id());

        assertEquals(OperationStatus.CANCELLED, cancelled.status());
        assertTrue(cancelled.cancelRequested());
        assertEquals(new OperationStats(2, 0, 0, 2, 0), cancelled.stats());
        assertTrue(shell.connects().isEmpty());
        assertEquals(1, events.ofType(EventType.OPERATION_CANCELLED).size());

        scheduler.tick();
        assertTrue(shell.connects().isEmpty());
        assertThrows(IllegalStateException.class, () -> scheduler.cancel(op.id()));
    }

    @Test
    void cancelUnknownOperation() {
        assertThrows(NoSuchElementException.class, () -> scheduler.cancel("missing"));
    }

    @Test
    void cancelAbortsRunningSessions() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(2);
        shell.hold(gate, started);
        Operation op = submit("op-1", List.of("h1", "h2", "h3"), "sync:1,start:1", OperationOptions.immediate());

        scheduler.tick();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        Operation requested = scheduler.cancel(op.id());
        assertTrue(requested.cancelRequested());

        Operation done = runToCompletion(op.id());
        gate.countDown();

        assertEquals(OperationStatus.CANCELLED, done.status());
        assertEquals(3, done.stats().cancelled());
        for (String address : List.of("10.0.0.1", "10.0.0.2")) {
            assertEquals(1, shell.executed(address).size(), "start:1 never ran on " + address);
        }
        assertTrue(shell.executed("10.0.0.3").isEmpty());
    }

    @Test
    void deferredModeWritesOnbootRecords() throws Exception {
        Operation op = submit("op-1", List.of("h1", "h2"), "sync:1,start:1", new OperationOptions(false, 0, true));

        Operation done = runToCompletion(op.id());

        assertEquals(OperationStatus.COMPLETED, done.status());
        assertTrue(shell.connects().isEmpty());
        assertEquals("sync:1,start:1", Files.readString(tempDir.resolve("linbocmd/pc01.cmd")).trim());
        assertEquals(2, onboot.listScheduled().size());
    }

    @Test
    void directExecutionDropsPendingOnbootRecord() {
        onboot.schedule("pc01", "reboot");
        Operation op = submit("op-1", List.of("h1"), "sync:1", OperationOptions.immediate());

        runToCompletion(op.id());

        assertTrue(onboot.find("pc01").isEmpty());
    }

    @Test
    void wakeOnLanStagesBeforeDispatch() {
        Operation op = submit("op-1", List.of("h1", "h2"), "sync:1", new OperationOptions(true, 60, false));

        scheduler.tick();

        Operation waking = operationRepo.findById(op.id()).orElseThrow();
        assertEquals(OperationStatus.WAKING, waking.status());
        assertNotNull(waking.wakeUntil());
        assertEquals(List.of("aa:bb:cc:dd:ee:01", "aa:bb:cc:dd:ee:02"), wakeSender.sent());
        assertTrue(sessionRepo.findByOperationId(op.id()).isEmpty());
        assertEquals(1, events.ofType(EventType.OPERATION_WAKING).size());

        scheduler.tick();
        assertEquals(2, wakeSender.sent().size(), "packets are sent once");
    }

    @Test
    void zeroWakeDelayDispatchesInSameTick() {
        Operation op = submit("op-1", List.of("h1"), "sync:1", new OperationOptions(true, 0, false));

        Operation done = runToCompletion(op.id());

        assertEquals(OperationStatus.COMPLETED, done.status());
        assertEquals(1, wakeSender.sent().size());
        assertNotNull(done.wakeUntil());
    }

    @Test
    void pausedSchedulerTakesNoWork() {
        Operation op = submit("op-1", List.of("h1"), "sync:1", OperationOptions.immediate());

        scheduler.pause();
        scheduler.tick();
        assertTrue(scheduler.status().paused());
        assertTrue(sessionRepo.findByOperationId(op.id()).isEmpty());

        scheduler.resume();
        assertEquals(OperationStatus.COMPLETED, runToCompletion(op.id()).status());
    }

    @Test
    void finalStatusRules() {
        Operation op = Operation.builder().id("op").targetHosts(List.of("h1", "h2")).commands("sync:1").build();
        Operation cancelled = op.toBuilder().cancelRequested(true).build();

        assertEquals(OperationStatus.COMPLETED,
                SessionScheduler.finalStatus(op, List.of(), new OperationStats(2, 2, 0, 0, 0)));
        assertEquals(OperationStatus.COMPLETED_WITH_ERRORS,
                SessionScheduler.finalStatus(op, List.of(), new OperationStats(2, 1, 0, 1, 0)));
        assertEquals(OperationStatus.FAILED,
                SessionScheduler.finalStatus(op, List.of(), new OperationStats(2, 0, 1, 1, 0)));
        assertEquals(OperationStatus.CANCELLED,
                SessionScheduler.finalStatus(cancelled, List.of(), new OperationStats(2, 0, 0, 2, 0)));
    }

    private Operation submit(String id, List<String> hosts, String commands, OperationOptions options) {
        return submit(id, hosts, commands, options, Instant.now());
    }

    private Operation submit(String id, List<String> hosts, String commands, OperationOptions options,
            Instant createdAt) {
        Operation op = Operation.builder()
                .id(id)
                .targetHosts(hosts)
                .commands(commands)
                .options(options)
                .createdAt(createdAt)
                .build();
        operationRepo.save(op);
        return op;
    }

    private Operation runToCompletion(String operationId) {
        for (int i = 0; i < 50; i++) {
            scheduler.tick();
            assertTrue(scheduler.awaitIdle(Duration.ofSeconds(5)), "sessions did not finish");
            Operation op = operationRepo.findById(operationId).orElseThrow();
            if (op.isTerminal()) {
                return op;
            }
        }
        fail("Operation " + operationId + " did not finish");
        return null;
    }

    private Session sessionFor(String operationId, String hostId) {
        return sessionRepo.findByOperationId(operationId).stream()
                .filter(s -> s.hostId().equals(hostId))
                .findFirst()
                .orElseThrow();
    }
}
