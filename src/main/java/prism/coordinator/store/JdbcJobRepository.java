package prism.coordinator.store;

import prism.coordinator.model.*;
import prism.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.*;

import static prism.coordinator.store.Database.toInstant;
import static prism.coordinator.store.Database.toTimestamp;

/**
 * JDBC implementation of JobRepository.
 * Claims are conditional updates: a job device moves to running only if it
 * is still pending when the row is written.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void create(JobRequest job) {
        String jobSql = """
                    INSERT INTO job_requests (job_id, config_id, status, duration_seconds, result_summary, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
        String deviceSql = """
                    INSERT INTO job_devices (id, job_id, device_id, status, updated_at)
                    VALUES (?, ?, ?, ?, ?)
                """;

        Instant createdAt = job.createdAt() != null ? job.createdAt() : Instant.now();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement jobPs = conn.prepareStatement(jobSql);
                    PreparedStatement devicePs = conn.prepareStatement(deviceSql)) {

                jobPs.setString(1, job.id());
                jobPs.setString(2, job.configId());
                jobPs.setString(3, job.status().wireName());
                jobPs.setInt(4, job.duration());
                jobPs.setString(5, job.resultSummary());
                jobPs.setTimestamp(6, toTimestamp(createdAt));
                jobPs.setTimestamp(7, toTimestamp(job.updatedAt() != null ? job.updatedAt() : createdAt));
                jobPs.executeUpdate();

                for (JobDevice jd : job.devices()) {
                    devicePs.setString(1, jd.id());
                    devicePs.setString(2, job.id());
                    devicePs.setString(3, jd.deviceId());
                    devicePs.setString(4, jd.status().wireName());
                    devicePs.setTimestamp(5, toTimestamp(jd.updatedAt() != null ? jd.updatedAt() : createdAt));
                    devicePs.addBatch();
                }
                devicePs.executeBatch();

                conn.commit();
                log.debug("Created job {} with {} devices", job.id(), job.devices().size());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create job: " + job.id(), e);
        }
    }

    @Override
    public Optional<JobRequest> findById(String jobId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM job_requests WHERE job_id = ?")) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                JobRequest.Builder builder = mapRow(rs);
                return Optional.of(builder.devices(loadDevices(conn, jobId)).build());
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<JobRequest> findRecent(int limit) {
        String sql = "SELECT * FROM job_requests ORDER BY created_at DESC, seq DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<JobRequest.Builder> builders = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    builders.add(mapRow(rs));
                }
            }

            List<JobRequest> jobs = new ArrayList<>(builders.size());
            for (JobRequest.Builder b : builders) {
                JobRequest shell = b.build();
                jobs.add(shell.toBuilder().devices(loadDevices(conn, shell.id())).build());
            }
            return jobs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent jobs", e);
        }
    }

    @Override
    public Optional<JobDevice> findJobDevice(String jobDeviceId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM job_devices WHERE id = ?")) {

            ps.setString(1, jobDeviceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapJobDevice(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job device: " + jobDeviceId, e);
        }
    }

    @Override
    public List<PendingJobDevice> findPending() {
        String sql = """
                    SELECT jd.id, jd.job_id, jr.config_id, jd.device_id,
                           COALESCE(d.device_uuid, d.device_id) AS device_serial,
                           jr.duration_seconds, jd.status
                    FROM job_devices jd
                    JOIN job_requests jr ON jr.job_id = jd.job_id
                    JOIN devices d ON d.device_id = jd.device_id
                    WHERE jd.status = 'pending'
                    ORDER BY jr.created_at, jr.seq, jd.seq
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<PendingJobDevice> pending = new ArrayList<>();
            while (rs.next()) {
                pending.add(new PendingJobDevice(
                        rs.getString("id"),
                        rs.getString("job_id"),
                        rs.getString("config_id"),
                        rs.getString("device_id"),
                        rs.getString("device_serial"),
                        rs.getInt("duration_seconds"),
                        JobDeviceStatus.fromWire(rs.getString("status"))));
            }
            return pending;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list pending job devices", e);
        }
    }

    @Override
    public ClaimResult claim(String jobDeviceId, String hostName, Instant now) {
        String claimSql = """
                    UPDATE job_devices
                    SET status = 'running', claimed_by = ?, claimed_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'pending'
                """;
        String jobSql = """
                    UPDATE job_requests SET status = 'running', updated_at = ?
                    WHERE job_id = (SELECT job_id FROM job_devices WHERE id = ?) AND status = 'pending'
                """;

        try (Connection conn = db.getConnection()) {
            int claimed;
            try (PreparedStatement ps = conn.prepareStatement(claimSql)) {
                ps.setString(1, hostName);
                ps.setTimestamp(2, toTimestamp(now));
                ps.setTimestamp(3, toTimestamp(now));
                ps.setString(4, jobDeviceId);
                claimed = ps.executeUpdate();
            }

            if (claimed == 1) {
                try (PreparedStatement ps = conn.prepareStatement(jobSql)) {
                    ps.setTimestamp(1, toTimestamp(now));
                    ps.setString(2, jobDeviceId);
                    ps.executeUpdate();
                }
                conn.commit();
                log.debug("Job device {} claimed by {}", jobDeviceId, hostName);
                return ClaimResult.CLAIMED;
            }

            boolean exists = exists(conn, jobDeviceId);
            conn.commit();
            return exists ? ClaimResult.LOST : ClaimResult.NOT_FOUND;
        } catch (SQLException e) {
            if (isContention(e)) {
                log.debug("Claim of {} by {} hit a concurrent claim: {}", jobDeviceId, hostName, e.getMessage());
                return ClaimResult.LOST;
            }
            throw new RuntimeException("Failed to claim job device: " + jobDeviceId, e);
        }
    }

    @Override
    public JobDeviceUpdateResult finishJobDevice(String jobDeviceId, JobDeviceStatus status, Instant now) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("not a terminal job device status: " + status);
        }
        String sql = """
                    UPDATE job_devices SET status = ?, updated_at = ?
                    WHERE id = ? AND status IN ('pending', 'running')
                """;

        try (Connection conn = db.getConnection()) {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, status.wireName());
                ps.setTimestamp(2, toTimestamp(now));
                ps.setString(3, jobDeviceId);
                updated = ps.executeUpdate();
            }
            if (updated == 1) {
                conn.commit();
                return JobDeviceUpdateResult.UPDATED;
            }
            boolean exists = exists(conn, jobDeviceId);
            conn.commit();
            return exists ? JobDeviceUpdateResult.ALREADY_TERMINAL : JobDeviceUpdateResult.NOT_FOUND;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job device: " + jobDeviceId, e);
        }
    }

    @Override
    public boolean updateStatus(String jobId, JobStatus status, String resultSummary, Instant now) {
        String sql = """
                    UPDATE job_requests
                    SET status = ?, result_summary = COALESCE(?, result_summary), updated_at = ?
                    WHERE job_id = ? AND status IN ('pending', 'running')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.wireName());
            ps.setString(2, resultSummary);
            ps.setTimestamp(3, toTimestamp(now));
            ps.setString(4, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job status: " + jobId, e);
        }
    }

    /** Row lock held by a concurrent claimer: H2 lock timeout or concurrent update */
    private static boolean isContention(SQLException e) {
        return e.getErrorCode() == 50200 || e.getErrorCode() == 90131;
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Override
    public String generateJobDeviceId() {
        return UUID.randomUUID().toString();
    }

    // --- Helpers ---

    private boolean exists(Connection conn, String jobDeviceId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM job_devices WHERE id = ?")) {
            ps.setString(1, jobDeviceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private List<JobDevice> loadDevices(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM job_devices WHERE job_id = ? ORDER BY seq")) {
            ps.setString(1, jobId);
            List<JobDevice> devices = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    devices.add(mapJobDevice(rs));
                }
            }
            return devices;
        }
    }

    private JobRequest.Builder mapRow(ResultSet rs) throws SQLException {
        return JobRequest.builder()
                .id(rs.getString("job_id"))
                .configId(rs.getString("config_id"))
                .status(JobStatus.fromWire(rs.getString("status")))
                .duration(rs.getInt("duration_seconds"))
                .resultSummary(rs.getString("result_summary"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")));
    }

    private JobDevice mapJobDevice(ResultSet rs) throws SQLException {
        return new JobDevice(
                rs.getString("id"),
                rs.getString("job_id"),
                rs.getString("device_id"),
                JobDeviceStatus.fromWire(rs.getString("status")),
                rs.getString("claimed_by"),
                toInstant(rs.getTimestamp("claimed_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }
}
