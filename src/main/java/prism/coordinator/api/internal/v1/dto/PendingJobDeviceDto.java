package prism.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import prism.coordinator.model.JobDeviceStatus;
import prism.coordinator.model.PendingJobDevice;

/**
 * One claimable work item.
 * GET /internal/v1/jobs/pending
 */
public record PendingJobDeviceDto(
        @JsonProperty("job_device_id") String jobDeviceId,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("config_id") String configId,
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("device_uuid") String deviceUuid,
        @JsonProperty("duration") int duration,
        @JsonProperty("status") String status) {

    public static PendingJobDeviceDto from(PendingJobDevice p) {
        return new PendingJobDeviceDto(p.jobDeviceId(), p.jobId(), p.configId(), p.deviceId(),
                p.deviceSerial(), p.duration(), p.status().wireName());
    }

    public PendingJobDevice toModel() {
        return new PendingJobDevice(jobDeviceId, jobId, configId, deviceId, deviceUuid, duration,
                JobDeviceStatus.fromWire(status));
    }
}
