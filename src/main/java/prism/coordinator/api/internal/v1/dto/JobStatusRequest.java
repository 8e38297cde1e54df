package prism.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /internal/v1/jobs/{id}/status
 */
public record JobStatusRequest(
        @JsonProperty("status") String status,
        @JsonProperty("result_summary") String resultSummary) {
}
