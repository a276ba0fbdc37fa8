package testlab.master.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import testlab.master.model.Device;

import java.time.Instant;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceResponse(
        @JsonProperty("hostname") String hostname,
        @JsonProperty("deviceType") String deviceType,
        @JsonProperty("tags") Set<String> tags,
        @JsonProperty("health") String health,
        @JsonProperty("status") String status,
        @JsonProperty("currentJobId") Long currentJobId,
        @JsonProperty("idleSince") Instant idleSince,
        @JsonProperty("lastHealthCheck") Instant lastHealthCheck) {

    public static DeviceResponse from(Device device) {
        return new DeviceResponse(
                device.hostname(),
                device.deviceType(),
                device.tags(),
                device.health().name(),
                device.status().name(),
                device.currentJobId(),
                device.idleSince(),
                device.lastHealthCheck());
    }
}
