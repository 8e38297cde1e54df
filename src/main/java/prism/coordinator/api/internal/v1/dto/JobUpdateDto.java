package prism.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import prism.coordinator.model.JobUpdate;

import java.time.Instant;

/**
 * A stored progress event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobUpdateDto(
        @JsonProperty("update_id") String updateId,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("status") String status,
        @JsonProperty("message") String message,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("trace_id") String traceId) {

    public static JobUpdateDto from(JobUpdate u) {
        return new JobUpdateDto(u.id(), u.jobId(), u.deviceId(), u.status(), u.message(), u.timestamp(), u.traceId());
    }

    public JobUpdate toModel() {
        return new JobUpdate(updateId, jobId, deviceId, status, message, timestamp, traceId);
    }
}
