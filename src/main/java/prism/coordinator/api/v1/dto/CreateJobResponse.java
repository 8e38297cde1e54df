package prism.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import prism.coordinator.model.JobRequest;

/**
 * Response DTO for a created job.
 */
public record CreateJobResponse(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("status") String status) {

    public static CreateJobResponse from(JobRequest job) {
        return new CreateJobResponse(job.id(), job.status().wireName());
    }
}
