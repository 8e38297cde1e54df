package prism.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for creating a new job.
 * POST /api/v1/jobs
 *
 * @param duration seconds per device; when absent the configuration's default applies
 */
public record CreateJobRequest(
        @JsonProperty("config_id") String configId,
        @JsonProperty("device_ids") List<String> deviceIds,
        @JsonProperty("duration") Integer duration) {

    /** Validate the request shape; value checks are left to the job service */
    public void validate() {
        if (configId == null || configId.isBlank()) {
            throw new IllegalArgumentException("config_id is required");
        }
        if (deviceIds == null || deviceIds.isEmpty()) {
            throw new IllegalArgumentException("device_ids must not be empty");
        }
    }
}
