package testlab.master.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable domain model representing a test job.
 *
 * A job asks either for a single device ({@link #requirement()}) or, for a
 * MultiNode job, for a group of devices keyed by role ({@link #roles()}).
 * Health-check jobs additionally pin a {@link #requestedDevice()}.
 */
public final class Job {
    private final long id;
    private final String description;
    private final String submitter;
    private final JobPriority priority;
    private final JobStatus status;
    private final DeviceRequirement requirement;
    private final Map<String, DeviceRequirement> roles;
    private final boolean healthCheck;
    private final String requestedDevice;
    private final String groupId;
    private final Instant submitTime;
    private final Instant startTime;
    private final Instant endTime;
    private final FailureKind failureKind;
    private final String failureComment;

    private Job(Builder builder) {
        this.id = builder.id;
        this.description = builder.description;
        this.submitter = builder.submitter;
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.requirement = builder.requirement;
        this.roles = builder.roles == null ? Map.of() : new TreeMap<>(builder.roles);
        this.healthCheck = builder.healthCheck;
        this.requestedDevice = builder.requestedDevice;
        this.groupId = builder.groupId;
        this.submitTime = builder.submitTime;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.failureKind = builder.failureKind;
        this.failureComment = builder.failureComment;
        if (requirement == null && roles.isEmpty()) {
            throw new IllegalArgumentException("job needs a device requirement or MultiNode roles");
        }
        if (requirement != null && !roles.isEmpty()) {
            throw new IllegalArgumentException("job cannot have both a device requirement and MultiNode roles");
        }
    }

    // Getters
    public long id() {
        return id;
    }

    public String description() {
        return description;
    }

    public String submitter() {
        return submitter;
    }

    public JobPriority priority() {
        return priority;
    }

    public JobStatus status() {
        return status;
    }

    public DeviceRequirement requirement() {
        return requirement;
    }

    /** Role name to requirement, sorted by role name. Empty for single-device jobs. */
    public Map<String, DeviceRequirement> roles() {
        return roles;
    }

    public boolean healthCheck() {
        return healthCheck;
    }

    public String requestedDevice() {
        return requestedDevice;
    }

    public String groupId() {
        return groupId;
    }

    public Instant submitTime() {
        return submitTime;
    }

    public Instant startTime() {
        return startTime;
    }

    public Instant endTime() {
        return endTime;
    }

    public FailureKind failureKind() {
        return failureKind;
    }

    public String failureComment() {
        return failureComment;
    }

    public boolean isMultinode() {
        return !roles.isEmpty();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Total number of devices this job occupies when scheduled. */
    public int deviceCount() {
        if (!isMultinode()) {
            return 1;
        }
        return roles.values().stream().mapToInt(DeviceRequirement::count).sum();
    }

    /** Device type shown in queue metrics; MultiNode jobs report their first role's type. */
    public String primaryDeviceType() {
        if (requirement != null) {
            return requirement.deviceType();
        }
        return roles.values().iterator().next().deviceType();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .description(description)
                .submitter(submitter)
                .priority(priority)
                .status(status)
                .requirement(requirement)
                .roles(roles)
                .healthCheck(healthCheck)
                .requestedDevice(requestedDevice)
                .groupId(groupId)
                .submitTime(submitTime)
                .startTime(startTime)
                .endTime(endTime)
                .failureKind(failureKind)
                .failureComment(failureComment);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String description;
        private String submitter;
        private JobPriority priority = JobPriority.MEDIUM;
        private JobStatus status = JobStatus.SUBMITTED;
        private DeviceRequirement requirement;
        private Map<String, DeviceRequirement> roles;
        private boolean healthCheck;
        private String requestedDevice;
        private String groupId;
        private Instant submitTime;
        private Instant startTime;
        private Instant endTime;
        private FailureKind failureKind;
        private String failureComment;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder submitter(String submitter) {
            this.submitter = submitter;
            return this;
        }

        public Builder priority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder requirement(DeviceRequirement requirement) {
            this.requirement = requirement;
            return this;
        }

        public Builder roles(Map<String, DeviceRequirement> roles) {
            this.roles = roles;
            return this;
        }

        public Builder healthCheck(boolean healthCheck) {
            this.healthCheck = healthCheck;
            return this;
        }

        public Builder requestedDevice(String requestedDevice) {
            this.requestedDevice = requestedDevice;
            return this;
        }

        public Builder groupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder submitTime(Instant submitTime) {
            this.submitTime = submitTime;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder failureKind(FailureKind failureKind) {
            this.failureKind = failureKind;
            return this;
        }

        public Builder failureComment(String failureComment) {
            this.failureComment = failureComment;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return id == job.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", status=" + status + ", priority=" + priority
                + (isMultinode() ? ", roles=" + roles.keySet() : "") + "}";
    }
}
