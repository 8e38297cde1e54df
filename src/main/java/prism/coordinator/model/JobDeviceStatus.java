package prism.coordinator.model;

import java.util.Locale;

/**
 * Status of one device's unit of work within a job.
 */
public enum JobDeviceStatus {
    /** Waiting for a worker with the device attached */
    PENDING,
    /** Claimed by a worker and being traced */
    RUNNING,
    /** Trace collected and stored */
    COMPLETED,
    /** Any pipeline step failed */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobDeviceStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("job device status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown job device status: " + value);
        }
    }
}
