package prism.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /internal/v1/jobs/{id}/updates
 */
public record JobUpdateRequest(
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("status") String status,
        @JsonProperty("message") String message,
        @JsonProperty("trace_id") String traceId) {
}
