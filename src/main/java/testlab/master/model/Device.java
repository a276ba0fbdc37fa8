package testlab.master.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable domain model representing a lab device.
 */
public final class Device {
    private final String hostname;
    private final String deviceType;
    private final Set<String> tags;
    private final DeviceHealth health;
    private final DeviceStatus status;
    private final Long currentJobId;
    private final Instant idleSince;
    private final Instant lastHealthCheck;
    private final Instant registeredAt;

    private Device(Builder builder) {
        this.hostname = Objects.requireNonNull(builder.hostname, "hostname is required");
        this.deviceType = Objects.requireNonNull(builder.deviceType, "deviceType is required");
        this.tags = Set.copyOf(builder.tags);
        this.health = Objects.requireNonNull(builder.health, "health is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.currentJobId = builder.currentJobId;
        this.idleSince = builder.idleSince;
        this.lastHealthCheck = builder.lastHealthCheck;
        this.registeredAt = builder.registeredAt;
    }

    // Getters
    public String hostname() {
        return hostname;
    }

    public String deviceType() {
        return deviceType;
    }

    public Set<String> tags() {
        return tags;
    }

    public DeviceHealth health() {
        return health;
    }

    public DeviceStatus status() {
        return status;
    }

    public Long currentJobId() {
        return currentJobId;
    }

    public Instant idleSince() {
        return idleSince;
    }

    public Instant lastHealthCheck() {
        return lastHealthCheck;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    /** Device carries every one of the given tags (and possibly more). */
    public boolean hasAllTags(Collection<String> required) {
        return required == null || tags.containsAll(required);
    }

    /** Idle, healthy enough and not held by any job. */
    public boolean isAvailable() {
        return status == DeviceStatus.IDLE && health.isReservable() && currentJobId == null;
    }

    public Builder toBuilder() {
        return new Builder()
                .hostname(hostname)
                .deviceType(deviceType)
                .tags(tags)
                .health(health)
                .status(status)
                .currentJobId(currentJobId)
                .idleSince(idleSince)
                .lastHealthCheck(lastHealthCheck)
                .registeredAt(registeredAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String hostname;
        private String deviceType;
        private Set<String> tags = new TreeSet<>();
        private DeviceHealth health = DeviceHealth.UNKNOWN;
        private DeviceStatus status = DeviceStatus.IDLE;
        private Long currentJobId;
        private Instant idleSince;
        private Instant lastHealthCheck;
        private Instant registeredAt;

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder deviceType(String deviceType) {
            this.deviceType = deviceType;
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags = tags == null ? new TreeSet<>() : new TreeSet<>(tags);
            return this;
        }

        public Builder health(DeviceHealth health) {
            this.health = health;
            return this;
        }

        public Builder status(DeviceStatus status) {
            this.status = status;
            return this;
        }

        public Builder currentJobId(Long currentJobId) {
            this.currentJobId = currentJobId;
            return this;
        }

        public Builder idleSince(Instant idleSince) {
            this.idleSince = idleSince;
            return this;
        }

        public Builder lastHealthCheck(Instant lastHealthCheck) {
            this.lastHealthCheck = lastHealthCheck;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
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
        return Objects.equals(hostname, device.hostname);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hostname);
    }

    @Override
    public String toString() {
        return "Device{hostname='" + hostname + "', type=" + deviceType + ", status=" + status
                + ", health=" + health + "}";
    }
}
