package prism.coordinator.store;

import prism.coordinator.model.Configuration;
import prism.coordinator.repository.ConfigurationRepository;
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
 * JDBC implementation of ConfigurationRepository.
 */
public class JdbcConfigurationRepository implements ConfigurationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcConfigurationRepository.class);

    private final Database db;

    public JdbcConfigurationRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Configuration configuration) {
        String sql = """
                    MERGE INTO configs (config_id, config_name, config_text, tracing_tool, default_duration, updated_at)
                    KEY (config_id)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, configuration.id());
            ps.setString(2, configuration.name());
            ps.setString(3, configuration.text());
            ps.setString(4, configuration.tool());
            if (configuration.defaultDuration() != null) {
                ps.setInt(5, configuration.defaultDuration());
            } else {
                ps.setNull(5, Types.INTEGER);
            }
            ps.setTimestamp(6, toTimestamp(
                    configuration.updatedAt() != null ? configuration.updatedAt() : Instant.now()));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved configuration: {} ({})", configuration.id(), configuration.name());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save configuration: " + configuration.id(), e);
        }
    }

    @Override
    public Optional<Configuration> findById(String configId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM configs WHERE config_id = ?")) {
            ps.setString(1, configId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find configuration: " + configId, e);
        }
    }

    @Override
    public List<Configuration> findAll() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM configs ORDER BY config_name");
                ResultSet rs = ps.executeQuery()) {
            List<Configuration> configs = new ArrayList<>();
            while (rs.next()) {
                configs.add(mapRow(rs));
            }
            return configs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list configurations", e);
        }
    }

    @Override
    public String generateId() {
        return "cfg-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private Configuration mapRow(ResultSet rs) throws SQLException {
        int duration = rs.getInt("default_duration");
        Integer defaultDuration = rs.wasNull() ? null : duration;
        return new Configuration(
                rs.getString("config_id"),
                rs.getString("config_name"),
                rs.getString("config_text"),
                rs.getString("tracing_tool"),
                defaultDuration,
                toInstant(rs.getTimestamp("updated_at")));
    }
}
