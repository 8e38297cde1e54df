package prism.coordinator.store;

import prism.coordinator.model.Host;
import prism.coordinator.repository.HostRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static prism.coordinator.store.Database.toInstant;
import static prism.coordinator.store.Database.toTimestamp;

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
                    MERGE INTO hosts (host_name, host_key, last_seen, created_at)
                    KEY (host_name)
                    VALUES (?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, host.name());
            ps.setString(2, host.key());
            ps.setTimestamp(3, toTimestamp(host.lastSeen()));
            ps.setTimestamp(4, toTimestamp(host.createdAt() != null ? host.createdAt() : Instant.now()));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save host: " + host.name(), e);
        }
    }

    @Override
    public Optional<Host> findByName(String hostName) {
        return findOne("SELECT * FROM hosts WHERE host_name = ?", hostName);
    }

    @Override
    public Optional<Host> findByKey(String hostKey) {
        return findOne("SELECT * FROM hosts WHERE host_key = ?", hostKey);
    }

    @Override
    public List<Host> findAll() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM hosts ORDER BY host_name");
                ResultSet rs = ps.executeQuery()) {
            List<Host> hosts = new ArrayList<>();
            while (rs.next()) {
                hosts.add(mapRow(rs));
            }
            return hosts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list hosts", e);
        }
    }

    @Override
    public void touch(String hostName, Instant seenAt) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("UPDATE hosts SET last_seen = ? WHERE host_name = ?")) {
            ps.setTimestamp(1, toTimestamp(seenAt));
            ps.setString(2, hostName);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to touch host: " + hostName, e);
        }
    }

    private Optional<Host> findOne(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find host", e);
        }
    }

    private Host mapRow(ResultSet rs) throws SQLException {
        return new Host(
                rs.getString("host_name"),
                rs.getString("host_key"),
                toInstant(rs.getTimestamp("last_seen")),
                toInstant(rs.getTimestamp("created_at")));
    }
}
