package prism.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A host's view of one device.
 * POST /internal/v1/devices (upsert + liveness), PUT /internal/v1/devices/{id}
 *
 * @param lastSeen informational; the coordinator stamps its own receive time
 */
public record DeviceReport(
        @JsonProperty("device_name") String deviceName,
        @JsonProperty("device_uuid") String deviceUuid,
        @JsonProperty("last_seen") Instant lastSeen,
        @JsonProperty("last_status") String lastStatus,
        @JsonProperty("host") String host) {
}
