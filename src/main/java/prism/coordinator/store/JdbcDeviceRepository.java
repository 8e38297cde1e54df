package prism.coordinator.store;

import prism.coordinator.model.Device;
import prism.coordinator.model.DeviceStatus;
import prism.coordinator.repository.DeviceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static prism.coordinator.store.Database.toInstant;
import static prism.coordinator.store.Database.toTimestamp;

/**
 * JDBC implementation of DeviceRepository.
 */
public class JdbcDeviceRepository implements DeviceRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcDeviceRepository.class);

    private final Database db;

    public JdbcDeviceRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Device device) {
        String sql = """
                    INSERT INTO devices (device_id, device_uuid, device_name, status, last_seen, current_host, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, device.id());
            ps.setString(2, device.serial());
            ps.setString(3, device.name());
            ps.setString(4, device.status().wireName());
            ps.setTimestamp(5, toTimestamp(device.lastSeen()));
            ps.setString(6, device.currentHost());
            ps.setTimestamp(7, toTimestamp(device.createdAt() != null ? device.createdAt() : Instant.now()));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved device: {} ({})", device.id(), device.serial());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save device: " + device.id(), e);
        }
    }

    @Override
    public Optional<Device> findById(String deviceId) {
        String sql = "SELECT * FROM devices WHERE device_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, deviceId);
            List<Device> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find device: " + deviceId, e);
        }
    }

    @Override
    public Optional<Device> findBySerialOrId(String serialOrId) {
        String sql = """
                    SELECT * FROM devices
                    WHERE device_uuid = ? OR device_id = ?
                    ORDER BY CASE WHEN device_uuid = ? THEN 0 ELSE 1 END, created_at
                    LIMIT 1
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, serialOrId);
            ps.setString(2, serialOrId);
            ps.setString(3, serialOrId);
            List<Device> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up device: " + serialOrId, e);
        }
    }

    @Override
    public List<Device> findAll() {
        String sql = "SELECT * FROM devices ORDER BY device_name, device_id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list devices", e);
        }
    }

    @Override
    public List<Device> findByHost(String hostName) {
        String sql = "SELECT * FROM devices WHERE current_host = ? ORDER BY device_id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, hostName);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list devices of host: " + hostName, e);
        }
    }

    @Override
    public boolean updateLiveness(String deviceId, DeviceStatus status, String hostName, Instant seenAt) {
        String sql = "UPDATE devices SET status = ?, current_host = ?, last_seen = ? WHERE device_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.wireName());
            ps.setString(2, hostName);
            ps.setTimestamp(3, toTimestamp(seenAt));
            ps.setString(4, deviceId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update device liveness: " + deviceId, e);
        }
    }

    @Override
    public boolean updateName(String deviceId, String name) {
        String sql = "UPDATE devices SET device_name = ? WHERE device_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, name);
            ps.setString(2, deviceId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to rename device: " + deviceId, e);
        }
    }

    @Override
    public boolean markOfflineIfOwnedBy(String deviceId, String hostName) {
        // current_host is re-checked at write time so a slow host cannot
        // take a device offline after another host has adopted it
        String sql = """
                    UPDATE devices SET status = 'offline'
                    WHERE device_id = ? AND current_host = ? AND status <> 'offline'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, deviceId);
            ps.setString(2, hostName);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to sweep device: " + deviceId, e);
        }
    }

    @Override
    public List<String> markStaleOffline(Instant cutoff) {
        String selectSql = """
                    SELECT device_id FROM devices
                    WHERE status <> 'offline' AND (last_seen IS NULL OR last_seen < ?)
                """;
        String updateSql = """
                    UPDATE devices SET status = 'offline'
                    WHERE device_id = ? AND status <> 'offline' AND (last_seen IS NULL OR last_seen < ?)
                """;

        List<String> changed = new ArrayList<>();
        try (Connection conn = db.getConnection()) {
            List<String> candidates = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                ps.setTimestamp(1, toTimestamp(cutoff));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getString(1));
                    }
                }
            }

            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                for (String id : candidates) {
                    ps.setString(1, id);
                    ps.setTimestamp(2, toTimestamp(cutoff));
                    if (ps.executeUpdate() > 0) {
                        changed.add(id);
                    }
                }
            }
            conn.commit();
            return changed;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark stale devices offline", e);
        }
    }

    @Override
    public String generateId() {
        return UUID.randomUUID().toString();
    }

    // --- Helpers ---

    private List<Device> executeQuery(PreparedStatement ps) throws SQLException {
        List<Device> devices = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                devices.add(mapRow(rs));
            }
        }
        return devices;
    }

    private Device mapRow(ResultSet rs) throws SQLException {
        return Device.builder()
                .id(rs.getString("device_id"))
                .serial(rs.getString("device_uuid"))
                .name(rs.getString("device_name"))
                .status(DeviceStatus.fromWire(rs.getString("status")))
                .lastSeen(toInstant(rs.getTimestamp("last_seen")))
                .currentHost(rs.getString("current_host"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }
}
