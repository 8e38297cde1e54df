package prism.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /api/v1/hosts
 */
public record HostRequest(@JsonProperty("host_name") String hostName) {
}
