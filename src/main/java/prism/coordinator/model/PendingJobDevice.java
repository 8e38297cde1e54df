package prism.coordinator.model;

/**
 * A pending job device joined with its job and device: the dispatch queue's
 * unit of work as handed to workers.
 */
public record PendingJobDevice(
        String jobDeviceId,
        String jobId,
        String configId,
        String deviceId,
        String deviceSerial,
        int duration,
        JobDeviceStatus status) {
}
