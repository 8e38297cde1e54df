package prism.coordinator.service;

import prism.coordinator.model.*;
import prism.coordinator.repository.ConfigurationRepository;
import prism.coordinator.repository.DeviceRepository;
import prism.coordinator.repository.JobRepository;
import prism.coordinator.repository.JobUpdateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Business logic for trace-collection jobs.
 * Handles job creation, the dispatch claim, device transitions,
 * aggregate status and the progress-event log.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final int DEFAULT_LIST_LIMIT = 50;
    static final int MAX_LIST_LIMIT = 500;

    private final JobRepository jobRepository;
    private final JobUpdateRepository updateRepository;
    private final ConfigurationRepository configurationRepository;
    private final DeviceRepository deviceRepository;
    private final Clock clock;

    public JobService(JobRepository jobRepository,
            JobUpdateRepository updateRepository,
            ConfigurationRepository configurationRepository,
            DeviceRepository deviceRepository) {
        this(jobRepository, updateRepository, configurationRepository, deviceRepository, Clock.systemUTC());
    }

    public JobService(JobRepository jobRepository,
            JobUpdateRepository updateRepository,
            ConfigurationRepository configurationRepository,
            DeviceRepository deviceRepository,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.updateRepository = updateRepository;
        this.configurationRepository = configurationRepository;
        this.deviceRepository = deviceRepository;
        this.clock = clock;
    }

    /**
     * Create a job with one pending job device per target device.
     * Not idempotent: identical calls create distinct jobs.
     *
     * @param configId  trace configuration to run
     * @param deviceIds target devices, non-empty and without duplicates
     * @param duration  collection time per device in seconds, positive
     * @return the created job with its job devices
     * @throws IllegalArgumentException on invalid arguments
     * @throws NotFoundException        if the configuration or any device is unknown
     */
    public JobRequest createJob(String configId, List<String> deviceIds, int duration) {
        if (configId == null || configId.isBlank()) {
            throw new IllegalArgumentException("config_id is required");
        }
        if (deviceIds == null || deviceIds.isEmpty()) {
            throw new IllegalArgumentException("device_ids must not be empty");
        }
        if (duration <= 0) {
            throw new IllegalArgumentException("duration must be positive, got " + duration);
        }
        Set<String> seen = new HashSet<>();
        for (String id : deviceIds) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("device_ids must not contain blank ids");
            }
            if (!seen.add(id)) {
                throw new IllegalArgumentException("duplicate device id: " + id);
            }
        }

        if (configurationRepository.findById(configId).isEmpty()) {
            throw NotFoundException.of("configuration", configId);
        }
        for (String id : deviceIds) {
            if (deviceRepository.findById(id).isEmpty()) {
                throw NotFoundException.of("device", id);
            }
        }

        Instant now = clock.instant();
        String jobId = jobRepository.generateId();
        List<JobDevice> devices = new ArrayList<>(deviceIds.size());
        for (String deviceId : deviceIds) {
            devices.add(JobDevice.pending(jobRepository.generateJobDeviceId(), jobId, deviceId, now));
        }

        JobRequest job = JobRequest.builder()
                .id(jobId)
                .configId(configId)
                .status(JobStatus.PENDING)
                .duration(duration)
                .createdAt(now)
                .updatedAt(now)
                .devices(devices)
                .build();

        jobRepository.create(job);
        log.info("Created job {} (config {}) for {} device(s)", jobId, configId, devices.size());
        return job;
    }

    public Optional<JobRequest> getJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    /**
     * Get recent jobs, newest first.
     *
     * @param limit maximum results; non-positive means the default of 50, capped at 500
     */
    public List<JobRequest> listRecent(int limit) {
        int effective = limit <= 0 ? DEFAULT_LIST_LIMIT : Math.min(limit, MAX_LIST_LIMIT);
        return jobRepository.findRecent(effective);
    }

    /**
     * Set a job's status and summary. A terminal job is never changed.
     *
     * @return true if the job changed
     * @throws NotFoundException if the job does not exist
     */
    public boolean updateJobStatus(String jobId, JobStatus status, String resultSummary) {
        JobRequest job = jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.of("job", jobId));
        if (job.isTerminal()) {
            log.debug("Ignoring status {} for terminal job {} ({})", status.wireName(), jobId, job.status().wireName());
            return false;
        }
        boolean changed = jobRepository.updateStatus(jobId, status, resultSummary, clock.instant());
        if (changed) {
            log.info("Job {} -> {}{}", jobId, status.wireName(),
                    resultSummary != null ? " (" + resultSummary + ")" : "");
        }
        return changed;
    }

    /**
     * Claim a pending job device for a host.
     */
    public ClaimResult claim(String jobDeviceId, String hostName) {
        ClaimResult result = jobRepository.claim(jobDeviceId, hostName, clock.instant());
        if (result == ClaimResult.LOST) {
            log.debug("Claim of {} by {} lost", jobDeviceId, hostName);
        }
        return result;
    }

    /**
     * Move a job device to a terminal status.
     * {@code running} is only reachable through {@link #claim}, and
     * {@code pending} is never re-entered.
     */
    public JobDeviceUpdateResult updateJobDeviceStatus(String jobDeviceId, JobDeviceStatus status) {
        if (status == JobDeviceStatus.PENDING) {
            throw new IllegalArgumentException("job device cannot return to pending");
        }
        if (status == JobDeviceStatus.RUNNING) {
            throw new IllegalArgumentException("running is set by claiming the job device");
        }
        JobDeviceUpdateResult result = jobRepository.finishJobDevice(jobDeviceId, status, clock.instant());
        if (result == JobDeviceUpdateResult.ALREADY_TERMINAL) {
            log.warn("Job device {} already terminal, ignoring {}", jobDeviceId, status.wireName());
        }
        return result;
    }

    public Optional<JobDevice> getJobDevice(String jobDeviceId) {
        return jobRepository.findJobDevice(jobDeviceId);
    }

    /**
     * Read all of a job's devices and, once every one is terminal, write
     * the aggregate status and summary.
     *
     * @return the aggregate, or empty while the job is still in progress
     * @throws NotFoundException if the job does not exist
     */
    public Optional<JobAggregate> recomputeAggregate(String jobId) {
        JobRequest job = jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.of("job", jobId));
        Optional<JobAggregate> aggregate = JobAggregate.of(job);
        if (aggregate.isPresent() && !job.isTerminal()) {
            updateJobStatus(jobId, aggregate.get().status(), aggregate.get().summary());
        }
        return aggregate;
    }

    /**
     * Append a progress event to a job's log.
     *
     * @throws NotFoundException if the job does not exist
     */
    public JobUpdate appendJobUpdate(String jobId, String deviceId, String status, String message, String traceId) {
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        if (jobRepository.findById(jobId).isEmpty()) {
            throw NotFoundException.of("job", jobId);
        }
        JobUpdate stored = updateRepository.append(new JobUpdate(null, jobId, deviceId, status, message, null, traceId));
        log.debug("Job {} device {}: {} {}", jobId, deviceId, status, message != null ? message : "");
        return stored;
    }

    /**
     * Pending job devices, oldest job first.
     */
    public List<PendingJobDevice> listPendingJobDevices() {
        return jobRepository.findPending();
    }

    /**
     * Progress events of a job strictly newer than {@code after}, oldest first.
     */
    public List<JobUpdate> updatesAfter(String jobId, Instant after) {
        return updateRepository.findAfter(jobId, after);
    }
}
