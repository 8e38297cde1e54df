package prism.coordinator.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model of a multi-device trace-collection request.
 * Owns one {@link JobDevice} per target device.
 */
public final class JobRequest {
    private final String id;
    private final String configId;
    private final JobStatus status;
    private final int duration;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String resultSummary;
    private final List<JobDevice> devices;

    private JobRequest(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.configId = Objects.requireNonNull(builder.configId, "configId is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.duration = builder.duration;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.resultSummary = builder.resultSummary;
        this.devices = builder.devices != null ? List.copyOf(builder.devices) : List.of();
    }

    public String id() {
        return id;
    }

    public String configId() {
        return configId;
    }

    public JobStatus status() {
        return status;
    }

    /** Collection time per device, in seconds */
    public int duration() {
        return duration;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public String resultSummary() {
        return resultSummary;
    }

    public List<JobDevice> devices() {
        return devices;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .configId(configId)
                .status(status)
                .duration(duration)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .resultSummary(resultSummary)
                .devices(devices);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String configId;
        private JobStatus status = JobStatus.PENDING;
        private int duration;
        private Instant createdAt;
        private Instant updatedAt;
        private String resultSummary;
        private List<JobDevice> devices;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder configId(String configId) {
            this.configId = configId;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder duration(int duration) {
            this.duration = duration;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder resultSummary(String resultSummary) {
            this.resultSummary = resultSummary;
            return this;
        }

        public Builder devices(List<JobDevice> devices) {
            this.devices = devices;
            return this;
        }

        public JobRequest build() {
            return new JobRequest(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobRequest job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobRequest{id='" + id + "', status=" + status + ", devices=" + devices.size() + "}";
    }
}
