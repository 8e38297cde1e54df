package prism.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of an Android device known to the registry.
 * Identity fields never change; liveness fields are rewritten by the host
 * that currently has the device attached, or by the registry sweeps.
 */
public final class Device {
    private final String id;
    private final String serial;
    private final String name;
    private final DeviceStatus status;
    private final Instant lastSeen;
    private final String currentHost;
    private final Instant createdAt;

    private Device(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.serial = builder.serial;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.lastSeen = builder.lastSeen;
        this.currentHost = builder.currentHost;
        this.createdAt = builder.createdAt;
    }

    public String id() {
        return id;
    }

    /** Hardware serial used for attachment checks; falls back to the id */
    public String serial() {
        return serial != null ? serial : id;
    }

    public String name() {
        return name;
    }

    public DeviceStatus status() {
        return status;
    }

    public Instant lastSeen() {
        return lastSeen;
    }

    public String currentHost() {
        return currentHost;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isOnline() {
        return status != DeviceStatus.OFFLINE;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .serial(serial)
                .name(name)
                .status(status)
                .lastSeen(lastSeen)
                .currentHost(currentHost)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String serial;
        private String name;
        private DeviceStatus status = DeviceStatus.OFFLINE;
        private Instant lastSeen;
        private String currentHost;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder serial(String serial) {
            this.serial = serial;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder status(DeviceStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastSeen(Instant lastSeen) {
            this.lastSeen = lastSeen;
            return this;
        }

        public Builder currentHost(String currentHost) {
            this.currentHost = currentHost;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Device build() {
            return new Device(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Device device))
            return false;
        return Objects.equals(id, device.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Device{id='" + id + "', serial='" + serial() + "', status=" + status + ", host=" + currentHost + "}";
    }
}
