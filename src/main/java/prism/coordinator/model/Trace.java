package prism.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata of a collected trace artifact. The file itself lives in object
 * storage under {@code filename}.
 */
public record Trace(
        String id,
        String name,
        Instant timestamp,
        String filename,
        String deviceId,
        String hostName,
        String configurationId) {

    public Trace {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(filename, "filename is required");
    }
}
