package testlab.master.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What one scheduling pass did.
 *
 * @param conflicts reservations refused because a device was taken concurrently
 */
public record PassSummary(
        @JsonProperty("examined") int examined,
        @JsonProperty("scheduled") int scheduled,
        @JsonProperty("devicesReserved") int devicesReserved,
        @JsonProperty("conflicts") int conflicts) {
}
