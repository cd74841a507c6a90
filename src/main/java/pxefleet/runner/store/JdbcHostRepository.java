package pxefleet.runner.store;

import pxefleet.runner.model.Host;
import pxefleet.runner.repository.HostRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of HostRepository.
 */
public class JdbcHostRepository implements HostRepository {

    private final Database db;

    public JdbcHostRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Host host) {
        String sql = """
                    MERGE INTO hosts (id, hostname, mac_address, ip_address, room, host_group)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, host.id());
            ps.setString(2, host.hostname());
            ps.setString(3, host.macAddress());
            ps.setString(4, host.ipAddress());
            ps.setString(5, host.room());
            ps.setString(6, host.group());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save host: " + host.id(), e);
        }
    }

    @Override
    public Optional<Host> findById(String hostId) {
        return findOne("SELECT * FROM hosts WHERE id = ?", hostId);
    }

    @Override
    public Optional<Host> findByHostname(String hostname) {
        return findOne("SELECT * FROM hosts WHERE hostname = ?", hostname);
    }

    @Override
    public List<Host> findByIds(Collection<String> hostIds) {
        if (hostIds.isEmpty()) {
            return List.of();
        }

        String placeholders = String.join(",", Collections.nCopies(hostIds.size(), "?"));
        String sql = "SELECT * FROM hosts WHERE id IN (" + placeholders + ") ORDER BY hostname";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            for (String id : hostIds) {
                ps.setString(i++, id);
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find hosts by id", e);
        }
    }

    @Override
    public List<Host> findByRoom(String room) {
        return findMany("SELECT * FROM hosts WHERE room = ? ORDER BY hostname", room);
    }

    @Override
    public List<Host> findByGroup(String group) {
        return findMany("SELECT * FROM hosts WHERE host_group = ? ORDER BY hostname", group);
    }

    // Helper methods

    private Optional<Host> findOne(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find host: " + param, e);
        }
    }

    private List<Host> findMany(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, param);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find hosts: " + param, e);
        }
    }

    private List<Host> executeQuery(PreparedStatement ps) throws SQLException {
        List<Host> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Host mapRow(ResultSet rs) throws SQLException {
        return new Host(
                rs.getString("id"),
                rs.getString("hostname"),
                rs.getString("mac_address"),
                rs.getString("ip_address"),
                rs.getString("room"),
                rs.getString("host_group"));
    }
}
