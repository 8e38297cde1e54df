package prism.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * GET /api/v1/health
 */
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") boolean database,
        @JsonProperty("devices_online") long devicesOnline,
        @JsonProperty("active_streams") int activeStreams,
        @JsonProperty("time") Instant time) {
}
