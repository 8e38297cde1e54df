package prism.coordinator.model;

import java.util.Locale;

/**
 * Overall status of a job request.
 * Terminal states are never left once reached.
 */
public enum JobStatus {
    /** Job created, no device claimed yet */
    PENDING,
    /** At least one device claimed, not all devices terminal */
    RUNNING,
    /** Every device terminal, some completed and some failed */
    PARTIAL,
    /** Every device completed */
    COMPLETED,
    /** Every device failed */
    FAILED;

    public boolean isTerminal() {
        return this == PARTIAL || this == COMPLETED || this == FAILED;
    }

    /** Lowercase name used on the wire and in the database */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("job status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown job status: " + value);
        }
    }
}
