package prism.coordinator.model;

import java.time.Instant;

/**
 * One progress event in a job's audit trail. Never mutated or deleted.
 *
 * @param status free-form label: starting, running, uploading, completed, failed
 */
public record JobUpdate(
        String id,
        String jobId,
        String deviceId,
        String status,
        String message,
        Instant timestamp,
        String traceId) {
}
