package prism.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for registering a device by hand.
 * POST /api/v1/devices
 */
public record RegisterDeviceRequest(
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("device_uuid") String deviceUuid,
        @JsonProperty("device_name") String deviceName) {
}
