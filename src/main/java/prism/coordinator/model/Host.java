package prism.coordinator.model;

import java.time.Instant;

/**
 * A registered worker host and the key it authenticates with.
 */
public record Host(
        String name,
        String key,
        Instant lastSeen,
        Instant createdAt) {
}
