package prism.coordinator.model;

import java.util.Collection;
import java.util.Optional;

/**
 * Terminal aggregate of a job computed from its devices' statuses.
 */
public record JobAggregate(JobStatus status, int succeeded, int failed, int total) {

    /**
     * Decide the job's terminal status.
     *
     * @return empty while any device is still pending or running, or when
     *         there are no devices at all
     */
    public static Optional<JobAggregate> of(Collection<JobDeviceStatus> statuses) {
        if (statuses.isEmpty()) {
            return Optional.empty();
        }
        int succeeded = 0;
        int failed = 0;
        for (JobDeviceStatus status : statuses) {
            switch (status) {
                case COMPLETED -> succeeded++;
                case FAILED -> failed++;
                default -> {
                    return Optional.empty();
                }
            }
        }
        int total = statuses.size();
        JobStatus status;
        if (succeeded == total) {
            status = JobStatus.COMPLETED;
        } else if (failed == total) {
            status = JobStatus.FAILED;
        } else {
            status = JobStatus.PARTIAL;
        }
        return Optional.of(new JobAggregate(status, succeeded, failed, total));
    }

    /** Same as {@link #of(Collection)} over a job's device list */
    public static Optional<JobAggregate> of(JobRequest job) {
        return of(job.devices().stream().map(JobDevice::status).toList());
    }

    public String summary() {
        return "Completed: " + succeeded + "/" + total + " successful, " + failed + "/" + total + " failed";
    }
}
