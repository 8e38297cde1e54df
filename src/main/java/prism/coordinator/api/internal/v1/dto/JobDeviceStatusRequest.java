package prism.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /internal/v1/job-devices/{id}/status.
 * {@code running} claims the job device for {@code host}.
 */
public record JobDeviceStatusRequest(
        @JsonProperty("status") String status,
        @JsonProperty("host") String host) {
}
