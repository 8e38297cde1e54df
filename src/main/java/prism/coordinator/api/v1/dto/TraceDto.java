package prism.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import prism.coordinator.model.Trace;

import java.time.Instant;

/**
 * Trace metadata on the wire, in both directions.
 * GET /api/v1/traces/{id}, POST /internal/v1/traces
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceDto(
        @JsonProperty("trace_id") String traceId,
        @JsonProperty("trace_name") String traceName,
        @JsonProperty("trace_timestamp") Instant traceTimestamp,
        @JsonProperty("trace_filename") String traceFilename,
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("host_name") String hostName,
        @JsonProperty("configuration_id") String configurationId) {

    public static TraceDto from(Trace t) {
        return new TraceDto(t.id(), t.name(), t.timestamp(), t.filename(),
                t.deviceId(), t.hostName(), t.configurationId());
    }

    public Trace toModel() {
        return new Trace(traceId, traceName, traceTimestamp, traceFilename, deviceId, hostName, configurationId);
    }
}
