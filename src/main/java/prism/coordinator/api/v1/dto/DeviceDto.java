package prism.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import prism.coordinator.model.Device;
import prism.coordinator.model.DeviceStatus;

import java.time.Instant;

/**
 * Device on the wire.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceDto(
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("device_uuid") String deviceUuid,
        @JsonProperty("device_name") String deviceName,
        @JsonProperty("status") String status,
        @JsonProperty("last_seen") Instant lastSeen,
        @JsonProperty("current_host") String currentHost,
        @JsonProperty("created_at") Instant createdAt) {

    public static DeviceDto from(Device d) {
        return new DeviceDto(d.id(), d.serial(), d.name(), d.status().wireName(),
                d.lastSeen(), d.currentHost(), d.createdAt());
    }

    public Device toModel() {
        return Device.builder()
                .id(deviceId)
                .serial(deviceUuid)
                .name(deviceName)
                .status(DeviceStatus.fromWire(status))
                .lastSeen(lastSeen)
                .currentHost(currentHost)
                .createdAt(createdAt)
                .build();
    }
}
