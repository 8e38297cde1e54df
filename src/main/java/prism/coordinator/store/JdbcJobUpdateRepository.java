package prism.coordinator.store;

import prism.coordinator.model.JobUpdate;
import prism.coordinator.repository.JobUpdateRepository;

import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static prism.coordinator.store.Database.toInstant;
import static prism.coordinator.store.Database.toTimestamp;

/**
 * JDBC implementation of JobUpdateRepository.
 * Timestamps are microsecond precision; an append that would tie or precede
 * the job's latest event is moved one microsecond past it.
 */
public class JdbcJobUpdateRepository implements JobUpdateRepository {

    private final Database db;
    private final Clock clock;

    public JdbcJobUpdateRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcJobUpdateRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public synchronized JobUpdate append(JobUpdate update) {
        String maxSql = "SELECT MAX(update_ts) FROM job_updates WHERE job_id = ?";
        String insertSql = """
                    INSERT INTO job_updates (update_id, job_id, device_id, status, message, update_ts, trace_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            Instant ts = clock.instant().truncatedTo(ChronoUnit.MICROS);
            try (PreparedStatement ps = conn.prepareStatement(maxSql)) {
                ps.setString(1, update.jobId());
                try (ResultSet rs = ps.executeQuery()) {
                    Instant latest = rs.next() ? toInstant(rs.getTimestamp(1)) : null;
                    if (latest != null && !ts.isAfter(latest)) {
                        ts = latest.plus(1, ChronoUnit.MICROS);
                    }
                }
            }

            JobUpdate stored = new JobUpdate(
                    UUID.randomUUID().toString(),
                    update.jobId(),
                    update.deviceId(),
                    update.status(),
                    update.message(),
                    ts,
                    update.traceId());

            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                ps.setString(1, stored.id());
                ps.setString(2, stored.jobId());
                ps.setString(3, stored.deviceId());
                ps.setString(4, stored.status());
                ps.setString(5, truncate(stored.message()));
                ps.setTimestamp(6, toTimestamp(stored.timestamp()));
                ps.setString(7, stored.traceId());
                ps.executeUpdate();
            }
            conn.commit();
            return stored;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append update to job: " + update.jobId(), e);
        }
    }

    @Override
    public List<JobUpdate> findAfter(String jobId, Instant after) {
        String sql = after == null
                ? "SELECT * FROM job_updates WHERE job_id = ? ORDER BY update_ts"
                : "SELECT * FROM job_updates WHERE job_id = ? AND update_ts > ? ORDER BY update_ts";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            if (after != null) {
                ps.setTimestamp(2, toTimestamp(after));
            }
            List<JobUpdate> updates = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    updates.add(new JobUpdate(
                            rs.getString("update_id"),
                            rs.getString("job_id"),
                            rs.getString("device_id"),
                            rs.getString("status"),
                            rs.getString("message"),
                            toInstant(rs.getTimestamp("update_ts")),
                            rs.getString("trace_id")));
                }
            }
            return updates;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read updates of job: " + jobId, e);
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 4096) {
            return message;
        }
        return message.substring(0, 4093) + "...";
    }
}
