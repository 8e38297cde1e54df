package prism.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import prism.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit off; callers commit explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("prism-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- DEVICES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS devices (
                            device_id       VARCHAR(64) PRIMARY KEY,
                            device_uuid     VARCHAR(128),
                            device_name     VARCHAR(256) NOT NULL,
                            status          VARCHAR(16) DEFAULT 'offline' NOT NULL,
                            last_seen       TIMESTAMP(6),
                            current_host    VARCHAR(256),
                            created_at      TIMESTAMP(6) DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- HOSTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS hosts (
                            host_name       VARCHAR(256) PRIMARY KEY,
                            host_key        VARCHAR(128) NOT NULL,
                            last_seen       TIMESTAMP(6),
                            created_at      TIMESTAMP(6) DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- CONFIGS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS configs (
                            config_id        VARCHAR(64) PRIMARY KEY,
                            config_name      VARCHAR(256) NOT NULL,
                            config_text      CLOB NOT NULL,
                            tracing_tool     VARCHAR(32) DEFAULT 'perfetto',
                            default_duration INT,
                            updated_at       TIMESTAMP(6) DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- JOB REQUESTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_requests (
                            job_id           VARCHAR(64) PRIMARY KEY,
                            seq              BIGINT GENERATED BY DEFAULT AS IDENTITY,
                            config_id        VARCHAR(64) NOT NULL REFERENCES configs(config_id),
                            status           VARCHAR(16) DEFAULT 'pending' NOT NULL,
                            duration_seconds INT NOT NULL,
                            result_summary   VARCHAR(512),
                            created_at       TIMESTAMP(6) DEFAULT CURRENT_TIMESTAMP,
                            updated_at       TIMESTAMP(6)
                        );
                    """);

            // ---------- JOB DEVICES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_devices (
                            id               VARCHAR(64) PRIMARY KEY,
                            seq              BIGINT GENERATED BY DEFAULT AS IDENTITY,
                            job_id           VARCHAR(64) NOT NULL REFERENCES job_requests(job_id),
                            device_id        VARCHAR(64) NOT NULL REFERENCES devices(device_id),
                            status           VARCHAR(16) DEFAULT 'pending' NOT NULL,
                            claimed_by       VARCHAR(256),
                            claimed_at       TIMESTAMP(6),
                            updated_at       TIMESTAMP(6)
                        );
                    """);

            // ---------- JOB UPDATES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_updates (
                            update_id        VARCHAR(64) PRIMARY KEY,
                            job_id           VARCHAR(64) NOT NULL REFERENCES job_requests(job_id),
                            device_id        VARCHAR(64),
                            status           VARCHAR(32) NOT NULL,
                            message          VARCHAR(4096),
                            update_ts        TIMESTAMP(6) NOT NULL,
                            trace_id         VARCHAR(64)
                        );
                    """);

            // ---------- TRACES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS traces (
                            trace_id          VARCHAR(64) PRIMARY KEY,
                            trace_name        VARCHAR(512) NOT NULL,
                            trace_timestamp   TIMESTAMP(6) NOT NULL,
                            trace_filename    VARCHAR(1024) NOT NULL,
                            device_id         VARCHAR(64),
                            host_name         VARCHAR(256),
                            configuration_id  VARCHAR(64)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_devices_uuid ON devices(device_uuid);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_devices_host ON devices(current_host, status);");
            st.addBatch("CREATE UNIQUE INDEX IF NOT EXISTS idx_hosts_key ON hosts(host_key);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_devices_status ON job_devices(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_devices_job ON job_devices(job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_updates_job_ts ON job_updates(job_id, update_ts);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_traces_device ON traces(device_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
