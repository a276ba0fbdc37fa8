package testlab.master.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * What a job (or one MultiNode role) needs from a device: a type, a tag set
 * the device must carry, and how many such devices.
 */
public record DeviceRequirement(
        @JsonProperty("deviceType") String deviceType,
        @JsonProperty("count") int count,
        @JsonProperty("tags") Set<String> tags,
        @JsonProperty("essential") boolean essential) {

    public DeviceRequirement {
        Objects.requireNonNull(deviceType, "deviceType is required");
        tags = tags == null ? Set.of() : Set.copyOf(new TreeSet<>(tags));
    }

    public static DeviceRequirement of(String deviceType, String... tags) {
        return new DeviceRequirement(deviceType, 1, Set.of(tags), false);
    }

    public static DeviceRequirement of(String deviceType, int count, List<String> tags) {
        return new DeviceRequirement(deviceType, count, Set.copyOf(tags), false);
    }

    public DeviceRequirement asEssential() {
        return new DeviceRequirement(deviceType, count, tags, true);
    }

    /** Whether the given device satisfies type and tags (ignores status/health). */
    public boolean matches(Device device) {
        return deviceType.equals(device.deviceType()) && device.hasAllTags(tags);
    }

    public void validate() {
        if (deviceType.isBlank()) {
            throw new IllegalArgumentException("deviceType is required");
        }
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive");
        }
    }
}
