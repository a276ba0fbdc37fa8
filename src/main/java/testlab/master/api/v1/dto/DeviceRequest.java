package testlab.master.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for registering a device.
 * POST /api/v1/devices
 */
public record DeviceRequest(
        @JsonProperty("hostname") String hostname,
        @JsonProperty("deviceType") String deviceType,
        @JsonProperty("tags") List<String> tags) {
}
