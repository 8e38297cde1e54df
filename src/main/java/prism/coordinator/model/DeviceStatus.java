package prism.coordinator.model;

import java.util.Locale;

/**
 * Liveness of a device as last reported by its host.
 */
public enum DeviceStatus {
    /** Attached to a host and idle */
    ONLINE,
    /** Not seen within the liveness window, or swept by its host */
    OFFLINE,
    /** Attached and currently tracing */
    BUSY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DeviceStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return OFFLINE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown device status: " + value);
        }
    }
}
