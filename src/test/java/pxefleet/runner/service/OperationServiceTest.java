package pxefleet.runner.service;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pxefleet.runner.command.InvalidCommandSyntaxException;
import pxefleet.runner.config.RunnerConfig;
import pxefleet.runner.events.EventType;
import pxefleet.runner.fakes.FakeRemoteShell;
import pxefleet.runner.fakes.FakeWakeOnLanSender;
import pxefleet.runner.fakes.RecordingBroadcaster;
import pxefleet.runner.model.Host;
import pxefleet.runner.model.Operation;
import pxefleet.runner.model.OperationOptions;
import pxefleet.runner.model.OperationStatus;
import pxefleet.runner.model.ValidationException;
import pxefleet.runner.onboot.OnbootScheduler;
import pxefleet.runner.remote.RemoteExecutor;
import pxefleet.runner.scheduler.SessionScheduler;
import pxefleet.runner.store.Database;
import pxefleet.runner.store.JdbcHostRepository;
import pxefleet.runner.store.JdbcOperationRepository;
import pxefleet.runner.store.JdbcSessionRepository;
import pxefleet.runner.wake.WakeStager;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class OperationServiceTest {

    private static Database db;
    private static JdbcHostRepository hostRepo;
    private static JdbcOperationRepository operationRepo;
    private static JdbcSessionRepository sessionRepo;

    @TempDir
    Path tempDir;

    private FakeRemoteShell shell;
    private RecordingBroadcaster events;
    private SessionScheduler scheduler;
    private OperationService service;

    @BeforeAll
    static void setup() {
        RunnerConfig config = RunnerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-service;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
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

        hostRepo.save(new Host("h1", "pc01", "aa:bb:cc:dd:ee:01", "10.0.0.1", "r101", "lab"));
        hostRepo.save(new Host("h2", "pc02", "aa:bb:cc:dd:ee:02", "10.0.0.2", "r101", "lab"));
        hostRepo.save(new Host("h3", "pc03", "aa:bb:cc:dd:ee:03", "10.0.0.3", "r102", "office"));

        RunnerConfig config = RunnerConfig.defaults().withOnbootDirectory(tempDir);
        shell = new FakeRemoteShell();
        events = new RecordingBroadcaster();
        scheduler = new SessionScheduler(operationRepo, sessionRepo, hostRepo, new RemoteExecutor(shell, config),
                new OnbootScheduler(tempDir, events), new WakeStager(new FakeWakeOnLanSender()), events, config);
        service = new OperationService(operationRepo, sessionRepo, new TargetResolver(hostRepo), scheduler, events);
    }

    @AfterEach
    void shutdown() {
        scheduler.close();
    }

    @Test
    void submitStoresPendingOperation() {
        Operation op = service.submit(OperationRequest.forHosts(List.of("h2", "h1", "h2"), " SYNC:1,start:1"));

        assertEquals(OperationStatus.PENDING, op.status());
        assertEquals(List.of("h2", "h1"), op.targetHosts());
        assertEquals("sync:1,start:1", op.commands());
        assertEquals(OperationOptions.immediate(), op.options());

        Operation stored = service.findById(op.id()).orElseThrow();
        assertEquals(op.targetHosts(), stored.targetHosts());
        assertEquals(1, events.ofType(EventType.OPERATION_CREATED).size());
    }

    @Test
    @DisplayName("An invalid command string stores nothing")
    void invalidCommandsAreRejectedBeforeStoring() {
        InvalidCommandSyntaxException e = assertThrows(InvalidCommandSyntaxException.class,
                () -> service.submit(OperationRequest.forHosts(List.of("h1"), "bogus:1")));

        assertEquals(1, e.position());
        assertTrue(service.list(null, 10).isEmpty());
        assertTrue(events.events().isEmpty());
    }

    @Test
    void unknownHostIsRejected() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> service.submit(OperationRequest.forHosts(List.of("h1", "nope"), "sync:1")));

        assertEquals("Unknown hosts: nope", e.getMessage());
        assertTrue(service.list(null, 10).isEmpty());
    }

    @Test
    void resolvesGroupAndRoom() {
        Operation byGroup = service.submit(new OperationRequest(null, "lab", null, "reboot", null));
        Operation byRoom = service.submit(new OperationRequest(null, null, "r102", "halt", null));

        assertEquals(List.of("h1", "h2"), byGroup.targetHosts());
        assertEquals(List.of("h3"), byRoom.targetHosts());

        assertThrows(ValidationException.class,
                () -> service.submit(new OperationRequest(null, "empty", null, "reboot", null)));
        assertThrows(ValidationException.class,
                () -> service.submit(new OperationRequest(List.of("h1"), "lab", null, "reboot", null)));
        assertThrows(ValidationException.class,
                () -> service.submit(new OperationRequest(null, null, null, "reboot", null)));
    }

    @Test
    void wakeOptionsDefaultDelay() {
        OperationRequest request = new OperationRequest(List.of("h1"), null, null, "sync:1",
                new OperationRequest.Options(true, null, null));

        Operation op = service.submit(request);

        assertEquals(new OperationOptions(true, 60, false), op.options());
        assertThrows(ValidationException.class, () -> service.submit(new OperationRequest(List.of("h1"), null, null,
                "sync:1", new OperationRequest.Options(true, -1, null))));
    }

    @Test
    void listFiltersByStatus() {
        Operation first = service.submit(OperationRequest.forHosts(List.of("h1"), "sync:1"));
        service.submit(OperationRequest.forHosts(List.of("h2"), "sync:1"));
        service.cancel(first.id());

        assertEquals(2, service.list(null, 10).size());
        assertEquals(List.of(first.id()),
                service.list(OperationStatus.CANCELLED, 10).stream().map(Operation::id).toList());
        assertEquals(1, service.list(null, 1).size());
    }

    @Test
    void retryTargetsOnlyFailedHosts() {
        shell.unreachable("10.0.0.2");
        Operation op = service.submit(OperationRequest.forHosts(List.of("h1", "h2"), "noauto,sync:1"));
        assertThrows(IllegalStateException.class, () -> service.retry(op.id()), "still active");

        Operation done = runToCompletion(op.id());
        assertEquals(OperationStatus.COMPLETED_WITH_ERRORS, done.status());

        Operation retry = service.retry(op.id());

        assertNotEquals(op.id(), retry.id());
        assertEquals(List.of("h2"), retry.targetHosts());
        assertEquals("noauto,sync:1", retry.commands());
        assertEquals(OperationStatus.PENDING, retry.status());
        assertEquals(OperationStatus.COMPLETED_WITH_ERRORS,
                service.findById(op.id()).orElseThrow().status(), "original is untouched");
    }

    @Test
    void retryRequiresFailedHosts() {
        Operation op = service.submit(OperationRequest.forHosts(List.of("h1"), "sync:1"));
        runToCompletion(op.id());

        assertThrows(IllegalStateException.class, () -> service.retry(op.id()));
        assertThrows(NoSuchElementException.class, () -> service.retry("missing"));
    }

    @Test
    @DisplayName("Retry skips failed hosts deleted since the run")
    void retrySkipsDeletedHosts() throws Exception {
        shell.unreachable("10.0.0.1").unreachable("10.0.0.2");
        Operation op = service.submit(OperationRequest.forHosts(List.of("h1", "h2"), "sync:1"));
        assertEquals(OperationStatus.FAILED, runToCompletion(op.id()).status());

        deleteHost("h2");
        Operation retry = service.retry(op.id());
        assertEquals(List.of("h1"), retry.targetHosts());

        deleteHost("h1");
        assertThrows(IllegalStateException.class, () -> service.retry(op.id()));
    }

    private static void deleteHost(String hostId) throws Exception {
        try (var conn = db.getConnection();
                var ps = conn.prepareStatement("DELETE FROM hosts WHERE id = ?")) {
            ps.setString(1, hostId);
            ps.executeUpdate();
            conn.commit();
        }
    }

    private Operation runToCompletion(String operationId) {
        for (int i = 0; i < 50; i++) {
            scheduler.tick();
            assertTrue(scheduler.awaitIdle(Duration.ofSeconds(5)));
            Operation op = operationRepo.findById(operationId).orElseThrow();
            if (op.isTerminal()) {
                return op;
            }
        }
        fail("Operation " + operationId + " did not finish");
        return null;
    }
}
