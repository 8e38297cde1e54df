package prism.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import prism.coordinator.model.JobDevice;
import prism.coordinator.model.JobDeviceStatus;
import prism.coordinator.model.JobRequest;
import prism.coordinator.model.JobStatus;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("config_id") String configId,
        @JsonProperty("status") String status,
        @JsonProperty("duration") int duration,
        @JsonProperty("result_summary") String resultSummary,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("devices") List<JobDeviceResponse> devices) {

    /** One job device within a job response */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record JobDeviceResponse(
            @JsonProperty("id") String id,
            @JsonProperty("device_id") String deviceId,
            @JsonProperty("status") String status,
            @JsonProperty("claimed_by") String claimedBy,
            @JsonProperty("claimed_at") Instant claimedAt,
            @JsonProperty("updated_at") Instant updatedAt) {

        public static JobDeviceResponse from(JobDevice jd) {
            return new JobDeviceResponse(jd.id(), jd.deviceId(), jd.status().wireName(),
                    jd.claimedBy(), jd.claimedAt(), jd.updatedAt());
        }

        public JobDevice toModel(String jobId) {
            return new JobDevice(id, jobId, deviceId, JobDeviceStatus.fromWire(status),
                    claimedBy, claimedAt, updatedAt);
        }
    }

    /** Create response from domain model */
    public static JobResponse from(JobRequest job) {
        return new JobResponse(
                job.id(),
                job.configId(),
                job.status().wireName(),
                job.duration(),
                job.resultSummary(),
                job.createdAt(),
                job.updatedAt(),
                job.devices().stream().map(JobDeviceResponse::from).toList());
    }

    /** Rebuild the domain model, as read back by a worker */
    public JobRequest toModel() {
        return JobRequest.builder()
                .id(jobId)
                .configId(configId)
                .status(JobStatus.fromWire(status))
                .duration(duration)
                .resultSummary(resultSummary)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .devices(devices == null ? List.of() : devices.stream().map(d -> d.toModel(jobId)).toList())
                .build();
    }
}
