package prism.coordinator.store;

import prism.coordinator.model.Trace;
import prism.coordinator.repository.TraceRepository;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static prism.coordinator.store.Database.toInstant;
import static prism.coordinator.store.Database.toTimestamp;

/**
 * JDBC implementation of TraceRepository.
 */
public class JdbcTraceRepository implements TraceRepository {

    private final Database db;

    public JdbcTraceRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Trace trace) {
        String sql = """
                    INSERT INTO traces (trace_id, trace_name, trace_timestamp, trace_filename, device_id, host_name, configuration_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, trace.id());
            ps.setString(2, trace.name());
            ps.setTimestamp(3, toTimestamp(trace.timestamp()));
            ps.setString(4, trace.filename());
            ps.setString(5, trace.deviceId());
            ps.setString(6, trace.hostName());
            ps.setString(7, trace.configurationId());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save trace: " + trace.id(), e);
        }
    }

    @Override
    public Optional<Trace> findById(String traceId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM traces WHERE trace_id = ?")) {
            ps.setString(1, traceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find trace: " + traceId, e);
        }
    }

    @Override
    public List<Trace> findByDevice(String deviceId) {
        String sql = "SELECT * FROM traces WHERE device_id = ? ORDER BY trace_timestamp DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, deviceId);
            List<Trace> traces = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    traces.add(mapRow(rs));
                }
            }
            return traces;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list traces of device: " + deviceId, e);
        }
    }

    @Override
    public String generateId() {
        return UUID.randomUUID().toString();
    }

    private Trace mapRow(ResultSet rs) throws SQLException {
        return new Trace(
                rs.getString("trace_id"),
                rs.getString("trace_name"),
                toInstant(rs.getTimestamp("trace_timestamp")),
                rs.getString("trace_filename"),
                rs.getString("device_id"),
                rs.getString("host_name"),
                rs.getString("configuration_id"));
    }
}
