package pxefleet.runner.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.model.Operation;
import pxefleet.runner.model.OperationOptions;
import pxefleet.runner.model.OperationStats;
import pxefleet.runner.model.OperationStatus;
import pxefleet.runner.repository.OperationRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JDBC implementation of OperationRepository.
 * Every status change is a conditional UPDATE on the allowed predecessor
 * statuses, so a transition that lost a race simply updates zero rows.
 */
public class JdbcOperationRepository implements OperationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcOperationRepository.class);
    private static final TypeReference<List<String>> HOST_LIST = new TypeReference<>() {
    };

    private final Database db;
    private final ObjectMapper mapper;

    public JdbcOperationRepository(Database db) {
        this(db, new ObjectMapper());
    }

    public JdbcOperationRepository(Database db, ObjectMapper mapper) {
        this.db = db;
        this.mapper = mapper;
    }

    @Override
    public void save(Operation operation) {
        String sql = """
                    INSERT INTO operations (id, target_hosts, commands, wake_on_lan, wake_delay_seconds, deferred,
                                            status, progress, completed_sessions, failed_sessions, cancelled_sessions,
                                            cancel_requested, busy_polls, wake_until, created_at, started_at, completed_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            OperationOptions options = operation.options();
            OperationStats stats = operation.stats();

            ps.setString(1, operation.id());
            ps.setString(2, writeHosts(operation.targetHosts()));
            ps.setString(3, operation.commands());
            ps.setBoolean(4, options.wakeOnLan());
            ps.setInt(5, options.wakeDelaySeconds());
            ps.setBoolean(6, options.deferred());
            ps.setString(7, operation.status().name());
            ps.setInt(8, operation.progress());
            ps.setInt(9, stats.completed());
            ps.setInt(10, stats.failed());
            ps.setInt(11, stats.cancelled());
            ps.setBoolean(12, operation.cancelRequested());
            ps.setInt(13, operation.busyPolls());
            setTimestamp(ps, 14, operation.wakeUntil());
            setTimestamp(ps, 15, operation.createdAt() != null ? operation.createdAt() : Instant.now());
            setTimestamp(ps, 16, operation.startedAt());
            setTimestamp(ps, 17, operation.completedAt());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved operation: {}", operation.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save operation: " + operation.id(), e);
        }
    }

    @Override
    public Optional<Operation> findById(String operationId) {
        String sql = "SELECT * FROM operations WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, operationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find operation: " + operationId, e);
        }
    }

    @Override
    public List<Operation> findActive() {
        String sql = "SELECT * FROM operations WHERE status IN (" + inList(OperationStatus.active())
                + ") ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find active operations", e);
        }
    }

    @Override
    public List<Operation> findByStatus(OperationStatus status, int limit) {
        String sql = "SELECT * FROM operations WHERE status = ? ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find operations by status: " + status, e);
        }
    }

    @Override
    public List<Operation> findRecent(int limit) {
        String sql = "SELECT * FROM operations ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent operations", e);
        }
    }

    @Override
    public boolean markWaking(String operationId, Instant wakeUntil) {
        String sql = "UPDATE operations SET status = 'WAKING', wake_until = ? WHERE id = ? AND status IN ("
                + inList(OperationStatus.predecessorsOf(OperationStatus.WAKING)) + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, wakeUntil);
            ps.setString(2, operationId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark operation waking: " + operationId, e);
        }
    }

    @Override
    public boolean markRunning(String operationId) {
        String sql = """
                    UPDATE operations
                    SET status = 'RUNNING', started_at = COALESCE(started_at, ?)
                    WHERE id = ? AND status IN (%s)
                """.formatted(inList(OperationStatus.predecessorsOf(OperationStatus.RUNNING)));

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, operationId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark operation running: " + operationId, e);
        }
    }

    @Override
    public boolean markFinished(String operationId, OperationStatus status, OperationStats stats) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }

        String sql = """
                    UPDATE operations
                    SET status = ?, progress = ?, completed_sessions = ?, failed_sessions = ?,
                        cancelled_sessions = ?, completed_at = ?
                    WHERE id = ? AND status IN (%s)
                """.formatted(inList(OperationStatus.active()));

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setInt(2, stats.progressPercent());
            ps.setInt(3, stats.completed());
            ps.setInt(4, stats.failed());
            ps.setInt(5, stats.cancelled());
            ps.setTimestamp(6, Timestamp.from(Instant.now()));
            ps.setString(7, operationId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.info("Operation {} finished: {} ({}/{} completed, {} failed, {} cancelled)",
                        operationId, status, stats.completed(), stats.total(), stats.failed(), stats.cancelled());
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finish operation: " + operationId, e);
        }
    }

    @Override
    public boolean updateProgress(String operationId, OperationStats stats) {
        String sql = """
                    UPDATE operations
                    SET progress = ?, completed_sessions = ?, failed_sessions = ?, cancelled_sessions = ?
                    WHERE id = ? AND status IN (%s)
                """.formatted(inList(OperationStatus.active()));

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, stats.progressPercent());
            ps.setInt(2, stats.completed());
            ps.setInt(3, stats.failed());
            ps.setInt(4, stats.cancelled());
            ps.setString(5, operationId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update operation progress: " + operationId, e);
        }
    }

    @Override
    public int incrementBusyPolls(String operationId) {
        String updateSql = "UPDATE operations SET busy_polls = busy_polls + 1 WHERE id = ?";
        String selectSql = "SELECT busy_polls FROM operations WHERE id = ?";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement update = conn.prepareStatement(updateSql);
                    PreparedStatement select = conn.prepareStatement(selectSql)) {

                update.setString(1, operationId);
                update.executeUpdate();

                select.setString(1, operationId);
                int polls = 0;
                try (ResultSet rs = select.executeQuery()) {
                    if (rs.next()) {
                        polls = rs.getInt(1);
                    }
                }

                conn.commit();
                return polls;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count busy poll for operation: " + operationId, e);
        }
    }

    @Override
    public boolean requestCancel(String operationId) {
        String sql = "UPDATE operations SET cancel_requested = TRUE WHERE id = ? AND status IN ("
                + inList(OperationStatus.active()) + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, operationId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to request cancel for operation: " + operationId, e);
        }
    }

    // Helper methods

    private List<Operation> executeQuery(PreparedStatement ps) throws SQLException {
        List<Operation> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Operation mapRow(ResultSet rs) throws SQLException {
        return Operation.builder()
                .id(rs.getString("id"))
                .targetHosts(readHosts(rs.getString("target_hosts")))
                .commands(rs.getString("commands"))
                .options(new OperationOptions(
                        rs.getBoolean("wake_on_lan"),
                        rs.getInt("wake_delay_seconds"),
                        rs.getBoolean("deferred")))
                .status(OperationStatus.valueOf(rs.getString("status")))
                .progress(rs.getInt("progress"))
                .completedSessions(rs.getInt("completed_sessions"))
                .failedSessions(rs.getInt("failed_sessions"))
                .cancelledSessions(rs.getInt("cancelled_sessions"))
                .cancelRequested(rs.getBoolean("cancel_requested"))
                .busyPolls(rs.getInt("busy_polls"))
                .wakeUntil(toInstant(rs.getTimestamp("wake_until")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build();
    }

    private String writeHosts(List<String> hostIds) {
        try {
            return mapper.writeValueAsString(hostIds);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize target hosts", e);
        }
    }

    private List<String> readHosts(String json) {
        try {
            return mapper.readValue(json, HOST_LIST);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to parse target hosts: " + json, e);
        }
    }

    private static String inList(Collection<OperationStatus> statuses) {
        return statuses.stream().map(s -> "'" + s.name() + "'").collect(Collectors.joining(","));
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
