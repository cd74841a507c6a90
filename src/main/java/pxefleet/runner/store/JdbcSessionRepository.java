package pxefleet.runner.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pxefleet.runner.model.ErrorKind;
import pxefleet.runner.model.Session;
import pxefleet.runner.model.SessionOutcome;
import pxefleet.runner.model.SessionStatus;
import pxefleet.runner.repository.SessionRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JDBC implementation of SessionRepository.
 * Terminal rows are protected by {@code status IN (non-terminal)} guards on
 * every update.
 */
public class JdbcSessionRepository implements SessionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSessionRepository.class);

    private static final String NON_TERMINAL = SessionStatus.nonTerminal().stream()
            .map(s -> "'" + s.name() + "'")
            .collect(Collectors.joining(","));

    private final Database db;

    public JdbcSessionRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Session session) {
        String sql = """
                    INSERT INTO sessions (id, operation_id, host_id, hostname, commands, status, progress, error_kind,
                                          error_message, failed_command_index, exit_code, log_output, heartbeat_at,
                                          created_at, started_at, completed_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, session.id());
            ps.setString(2, session.operationId());
            ps.setString(3, session.hostId());
            ps.setString(4, session.hostname());
            ps.setString(5, session.commands());
            ps.setString(6, session.status().name());
            ps.setInt(7, session.progress());
            ps.setString(8, session.errorKind() != null ? session.errorKind().name() : null);
            ps.setString(9, session.errorMessage());
            setIntOrNull(ps, 10, session.failedCommandIndex());
            setIntOrNull(ps, 11, session.exitCode());
            ps.setString(12, session.logOutput());
            setTimestamp(ps, 13, session.heartbeatAt());
            setTimestamp(ps, 14, session.createdAt() != null ? session.createdAt() : Instant.now());
            setTimestamp(ps, 15, session.startedAt());
            setTimestamp(ps, 16, session.completedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save session: " + session.id(), e);
        }
    }

    @Override
    public Optional<Session> findById(String sessionId) {
        String sql = "SELECT * FROM sessions WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find session: " + sessionId, e);
        }
    }

    @Override
    public List<Session> findByOperationId(String operationId) {
        String sql = "SELECT * FROM sessions WHERE operation_id = ? ORDER BY created_at, hostname";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, operationId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find sessions for operation: " + operationId, e);
        }
    }

    @Override
    public Optional<Session> findActiveByHostId(String hostId) {
        String sql = "SELECT * FROM sessions WHERE host_id = ? AND status IN (" + NON_TERMINAL
                + ") ORDER BY created_at LIMIT 1";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, hostId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find active session for host: " + hostId, e);
        }
    }

    @Override
    public boolean markConnecting(String sessionId) {
        String sql = """
                    UPDATE sessions
                    SET status = 'CONNECTING', started_at = ?, heartbeat_at = ?
                    WHERE id = ? AND status = 'PENDING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            ps.setTimestamp(1, now);
            ps.setTimestamp(2, now);
            ps.setString(3, sessionId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark session connecting: " + sessionId, e);
        }
    }

    @Override
    public boolean markRunning(String sessionId) {
        String sql = """
                    UPDATE sessions
                    SET status = 'RUNNING', heartbeat_at = ?
                    WHERE id = ? AND status = 'CONNECTING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, sessionId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark session running: " + sessionId, e);
        }
    }

    @Override
    public boolean updateProgress(String sessionId, int progress) {
        String sql = "UPDATE sessions SET progress = ?, heartbeat_at = ? WHERE id = ? AND status = 'RUNNING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, progress);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, sessionId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update session progress: " + sessionId, e);
        }
    }

    @Override
    public int touchHeartbeats(Collection<String> sessionIds) {
        if (sessionIds.isEmpty()) {
            return 0;
        }

        String sql = "UPDATE sessions SET heartbeat_at = ? WHERE id = ? AND status IN (" + NON_TERMINAL + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            for (String id : sessionIds) {
                ps.setTimestamp(1, now);
                ps.setString(2, id);
                ps.addBatch();
            }

            int touched = 0;
            for (int count : ps.executeBatch()) {
                touched += Math.max(count, 0);
            }
            conn.commit();
            return touched;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to refresh session heartbeats", e);
        }
    }

    @Override
    public boolean finish(String sessionId, SessionOutcome outcome) {
        String sql = """
                    UPDATE sessions
                    SET status = ?, error_kind = ?, error_message = ?, failed_command_index = ?, exit_code = ?,
                        log_output = ?, completed_at = ?,
                        progress = GREATEST(progress, ?)
                    WHERE id = ? AND status IN (%s)
                """.formatted(NON_TERMINAL);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, outcome.status().name());
            ps.setString(2, outcome.errorKind() != null ? outcome.errorKind().name() : null);
            ps.setString(3, truncate(outcome.message(), 2048));
            setIntOrNull(ps, 4, outcome.failedCommandIndex());
            setIntOrNull(ps, 5, outcome.exitCode());
            ps.setString(6, outcome.log());
            ps.setTimestamp(7, Timestamp.from(Instant.now()));
            ps.setInt(8, outcome.status() == SessionStatus.COMPLETED ? 100 : 0);
            ps.setString(9, sessionId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                log.debug("Session {} already terminal, outcome {} ignored", sessionId, outcome.status());
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finish session: " + sessionId, e);
        }
    }

    @Override
    public List<Session> findStale(Instant heartbeatBefore) {
        String sql = """
                    SELECT * FROM sessions
                    WHERE status IN ('CONNECTING', 'RUNNING')
                      AND (heartbeat_at IS NULL OR heartbeat_at < ?)
                    ORDER BY heartbeat_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(heartbeatBefore));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stale sessions", e);
        }
    }

    @Override
    public List<Session> cancelNotStarted(String operationId) {
        String selectSql = """
                    SELECT * FROM sessions
                    WHERE operation_id = ? AND status IN ('PENDING', 'WAITING_FOR_HOST')
                    FOR UPDATE
                """;

        String updateSql = """
                    UPDATE sessions
                    SET status = 'CANCELLED', error_kind = 'CANCELLED', error_message = ?, completed_at = ?
                    WHERE id = ? AND status IN ('PENDING', 'WAITING_FOR_HOST')
                """;

        List<Session> cancelled = new ArrayList<>();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement updatePs = conn.prepareStatement(updateSql)) {

                selectPs.setString(1, operationId);
                List<Session> candidates = executeQuery(selectPs);
                Timestamp now = Timestamp.from(Instant.now());

                for (Session session : candidates) {
                    updatePs.setString(1, "Cancelled before start");
                    updatePs.setTimestamp(2, now);
                    updatePs.setString(3, session.id());
                    if (updatePs.executeUpdate() > 0) {
                        cancelled.add(session.toBuilder()
                                .status(SessionStatus.CANCELLED)
                                .errorKind(ErrorKind.CANCELLED)
                                .errorMessage("Cancelled before start")
                                .completedAt(now.toInstant())
                                .build());
                    }
                }

                conn.commit();

                if (!cancelled.isEmpty()) {
                    log.debug("Cancelled {} not-started sessions of operation {}", cancelled.size(), operationId);
                }
                return cancelled;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cancel sessions of operation: " + operationId, e);
        }
    }

    // Helper methods

    private List<Session> executeQuery(PreparedStatement ps) throws SQLException {
        List<Session> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Session mapRow(ResultSet rs) throws SQLException {
        String errorKind = rs.getString("error_kind");
        return Session.builder()
                .id(rs.getString("id"))
                .operationId(rs.getString("operation_id"))
                .hostId(rs.getString("host_id"))
                .hostname(rs.getString("hostname"))
                .commands(rs.getString("commands"))
                .status(SessionStatus.valueOf(rs.getString("status")))
                .progress(rs.getInt("progress"))
                .errorKind(errorKind != null ? ErrorKind.valueOf(errorKind) : null)
                .errorMessage(rs.getString("error_message"))
                .failedCommandIndex(getIntOrNull(rs, "failed_command_index"))
                .exitCode(getIntOrNull(rs, "exit_code"))
                .logOutput(rs.getString("log_output"))
                .heartbeatAt(toInstant(rs.getTimestamp("heartbeat_at")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build();
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
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

    private static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    private static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
