package prism.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * POST /internal/v1/hosts/{host}/sweep
 *
 * @param onlineDeviceIds devices the host still sees, tracing ones included
 */
public record SweepRequest(@JsonProperty("online_device_ids") List<String> onlineDeviceIds) {
}
