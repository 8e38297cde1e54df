package prism.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import prism.coordinator.model.Host;

import java.time.Instant;

/**
 * A host and, right after registration only, its key.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HostResponse(
        @JsonProperty("host_name") String hostName,
        @JsonProperty("host_key") String hostKey,
        @JsonProperty("last_seen") Instant lastSeen) {

    public static HostResponse withKey(Host host) {
        return new HostResponse(host.name(), host.key(), host.lastSeen());
    }

    public static HostResponse withoutKey(Host host) {
        return new HostResponse(host.name(), null, host.lastSeen());
    }
}
