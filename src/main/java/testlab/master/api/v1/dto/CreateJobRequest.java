package testlab.master.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import testlab.master.model.DeviceRequirement;
import testlab.master.model.Job;
import testlab.master.model.JobPriority;

import java.util.Map;
import java.util.TreeMap;

/**
 * Request DTO for submitting a job.
 * POST /api/v1/jobs
 *
 * Either {@code device} (single-device job) or {@code roles} (MultiNode job)
 * must be given. A missing count means one device.
 */
public record CreateJobRequest(
        @JsonProperty("description") String description,
        @JsonProperty("submitter") String submitter,
        @JsonProperty("priority") String priority,
        @JsonProperty("device") DeviceRequirement device,
        @JsonProperty("roles") Map<String, DeviceRequirement> roles) {

    public void validate() {
        boolean hasRoles = roles != null && !roles.isEmpty();
        if (device == null && !hasRoles) {
            throw new IllegalArgumentException("either device or roles is required");
        }
        if (device != null && hasRoles) {
            throw new IllegalArgumentException("device and roles are mutually exclusive");
        }
        if (hasRoles) {
            roles.keySet().forEach(role -> {
                if (role == null || role.isBlank()) {
                    throw new IllegalArgumentException("role names must not be blank");
                }
            });
        }
        parsePriority();
    }

    public Job toJob() {
        validate();
        Job.Builder builder = Job.builder()
                .description(description)
                .submitter(submitter)
                .priority(parsePriority());
        if (device != null) {
            builder.requirement(withDefaultCount(device));
        } else {
            Map<String, DeviceRequirement> normalized = new TreeMap<>();
            roles.forEach((role, requirement) -> {
                if (requirement == null) {
                    throw new IllegalArgumentException("role '" + role + "' has no requirement");
                }
                normalized.put(role, withDefaultCount(requirement));
            });
            builder.roles(normalized);
        }
        return builder.build();
    }

    private JobPriority parsePriority() {
        try {
            return JobPriority.parse(priority);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown priority: " + priority);
        }
    }

    private static DeviceRequirement withDefaultCount(DeviceRequirement requirement) {
        if (requirement.count() != 0) {
            return requirement;
        }
        return new DeviceRequirement(requirement.deviceType(), 1, requirement.tags(), requirement.essential());
    }
}
