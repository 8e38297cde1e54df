package prism.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One device's unit of work within a job; the item workers claim.
 *
 * @param claimedBy host that won the claim, null while pending
 */
public record JobDevice(
        String id,
        String jobId,
        String deviceId,
        JobDeviceStatus status,
        String claimedBy,
        Instant claimedAt,
        Instant updatedAt) {

    public JobDevice {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(deviceId, "deviceId is required");
        Objects.requireNonNull(status, "status is required");
    }

    public static JobDevice pending(String id, String jobId, String deviceId, Instant now) {
        return new JobDevice(id, jobId, deviceId, JobDeviceStatus.PENDING, null, null, now);
    }
}
