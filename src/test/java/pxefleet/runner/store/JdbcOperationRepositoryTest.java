package pxefleet.runner.store;

import org.junit.jupiter.api.*;
import pxefleet.runner.config.RunnerConfig;
import pxefleet.runner.model.Operation;
import pxefleet.runner.model.OperationOptions;
import pxefleet.runner.model.OperationStats;
import pxefleet.runner.model.OperationStatus;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcOperationRepositoryTest {

    private static Database db;
    private static JdbcOperationRepository repo;

    @BeforeAll
    static void setup() {
        RunnerConfig config = RunnerConfig.defaults()
                .withDatabaseUrl(
                        "jdbc:h2:mem:test-operations;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcOperationRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanOperations() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM operations");
            conn.commit();
        }
    }

    @Test
    void saveAndFindById() {
        repo.save(operation("op-1", Instant.now()).toBuilder()
                .options(new OperationOptions(true, 30, false))
                .build());

        Operation found = repo.findById("op-1").orElseThrow();
        assertEquals(List.of("h1", "h2", "h3"), found.targetHosts());
        assertEquals("sync:1,start:1", found.commands());
        assertEquals(OperationStatus.PENDING, found.status());
        assertTrue(found.options().wakeOnLan());
        assertEquals(30, found.options().wakeDelaySeconds());
        assertFalse(found.options().deferred());
        assertFalse(found.cancelRequested());
        assertEquals(new OperationStats(3, 0, 0, 0, 3), found.stats());

        assertTrue(repo.findById("missing").isEmpty());
    }

    @Test
    void transitionsAreGuardedByCurrentStatus() {
        repo.save(operation("op-1", Instant.now()));
        Instant wakeUntil = Instant.now().plusSeconds(60);

        assertTrue(repo.markWaking("op-1", wakeUntil));
        assertFalse(repo.markWaking("op-1", wakeUntil), "WAKING only from PENDING");
        assertTrue(repo.markRunning("op-1"));
        assertFalse(repo.markRunning("op-1"));

        Operation running = repo.findById("op-1").orElseThrow();
        assertEquals(OperationStatus.RUNNING, running.status());
        assertNotNull(running.startedAt());
        assertNotNull(running.wakeUntil());
        assertFalse(repo.markWaking("op-1", wakeUntil), "never back to WAKING");
    }

    @Test
    void finishedOperationIsFinal() {
        repo.save(operation("op-1", Instant.now()));
        repo.markRunning("op-1");
        OperationStats stats = new OperationStats(3, 2, 1, 0, 0);

        assertTrue(repo.markFinished("op-1", OperationStatus.COMPLETED_WITH_ERRORS, stats));
        assertFalse(repo.markFinished("op-1", OperationStatus.FAILED, stats));
        assertFalse(repo.markRunning("op-1"));
        assertFalse(repo.requestCancel("op-1"));
        assertFalse(repo.updateProgress("op-1", new OperationStats(3, 0, 0, 0, 3)));

        Operation done = repo.findById("op-1").orElseThrow();
        assertEquals(OperationStatus.COMPLETED_WITH_ERRORS, done.status());
        assertEquals(stats, done.stats());
        assertEquals(100, done.progress());
        assertNotNull(done.completedAt());
    }

    @Test
    void markFinishedRejectsActiveStatus() {
        repo.save(operation("op-1", Instant.now()));

        assertThrows(IllegalArgumentException.class,
                () -> repo.markFinished("op-1", OperationStatus.RUNNING, new OperationStats(3, 0, 0, 0, 3)));
    }

    @Test
    void progressAndBusyPolls() {
        repo.save(operation("op-1", Instant.now()));

        assertTrue(repo.updateProgress("op-1", new OperationStats(3, 1, 0, 1, 1)));
        assertEquals(1, repo.incrementBusyPolls("op-1"));
        assertEquals(2, repo.incrementBusyPolls("op-1"));

        Operation op = repo.findById("op-1").orElseThrow();
        assertEquals(66, op.progress());
        assertEquals(1, op.stats().pending());
        assertEquals(2, op.busyPolls());
    }

    @Test
    void findActiveIsOldestFirst() {
        Instant now = Instant.now();
        repo.save(operation("newer", now));
        repo.save(operation("older", now.minusSeconds(60)));
        repo.save(operation("done", now.minusSeconds(120)).toBuilder().status(OperationStatus.COMPLETED).build());

        List<Operation> active = repo.findActive();

        assertEquals(List.of("older", "newer"), active.stream().map(Operation::id).toList());
        assertEquals(List.of("done"),
                repo.findByStatus(OperationStatus.COMPLETED, 10).stream().map(Operation::id).toList());
        assertEquals(List.of("newer", "older"),
                repo.findRecent(2).stream().map(Operation::id).toList());
    }

    @Test
    void requestCancelFlagsActiveOperation() {
        repo.save(operation("op-1", Instant.now()));

        assertTrue(repo.requestCancel("op-1"));
        Operation op = repo.findById("op-1").orElseThrow();
        assertTrue(op.cancelRequested());
        assertEquals(OperationStatus.PENDING, op.status());
    }

    private static Operation operation(String id, Instant createdAt) {
        return Operation.builder()
                .id(id)
                .targetHosts(List.of("h1", "h2", "h3"))
                .commands("sync:1,start:1")
                .options(OperationOptions.immediate())
                .createdAt(createdAt)
                .build();
    }
}
