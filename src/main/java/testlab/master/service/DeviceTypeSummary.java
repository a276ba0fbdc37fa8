package testlab.master.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per device type counts, excluding retired devices.
 *
 * @param busy reserved or running
 */
public record DeviceTypeSummary(
        @JsonProperty("deviceType") String deviceType,
        @JsonProperty("idle") int idle,
        @JsonProperty("busy") int busy,
        @JsonProperty("offline") int offline) {
}
