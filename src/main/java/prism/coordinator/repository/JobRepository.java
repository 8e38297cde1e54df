package prism.coordinator.repository;

import prism.coordinator.model.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for job requests and their job devices.
 */
public interface JobRepository {

    /**
     * Insert a job and all of its job devices in a single transaction.
     *
     * @param job the job, carrying its pending job devices
     */
    void create(JobRequest job);

    /**
     * Find a job by id, with its job devices.
     *
     * @param jobId the job id
     * @return the job if found
     */
    Optional<JobRequest> findById(String jobId);

    /**
     * Get recent jobs, newest first, with their job devices.
     *
     * @param limit maximum results
     */
    List<JobRequest> findRecent(int limit);

    /**
     * Find a single job device.
     */
    Optional<JobDevice> findJobDevice(String jobDeviceId);

    /**
     * Get every pending job device joined with its job and device,
     * oldest job first.
     */
    List<PendingJobDevice> findPending();

    /**
     * Move a job device from pending to running for the given host.
     * Only a row that is still pending at write time counts as claimed;
     * the parent job moves from pending to running in the same transaction.
     *
     * @param jobDeviceId the job device id
     * @param hostName    claiming host, may be null
     * @param now         claim time
     */
    ClaimResult claim(String jobDeviceId, String hostName, Instant now);

    /**
     * Write a terminal status unless the job device is already terminal.
     */
    JobDeviceUpdateResult finishJobDevice(String jobDeviceId, JobDeviceStatus status, Instant now);

    /**
     * Overwrite the job's status and summary unless the job is terminal.
     *
     * @return true if the row changed
     */
    boolean updateStatus(String jobId, JobStatus status, String resultSummary, Instant now);

    /**
     * Generate a new unique job id.
     */
    String generateId();

    /**
     * Generate a new unique job device id.
     */
    String generateJobDeviceId();
}
