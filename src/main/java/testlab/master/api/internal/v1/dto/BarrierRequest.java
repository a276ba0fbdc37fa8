package testlab.master.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import testlab.master.multinode.Participant;

import java.util.Map;

/**
 * A device arriving at a group barrier.
 * POST /internal/v1/groups/{groupId}/barrier
 *
 * @param timeoutMs how long to wait; absent or non-positive means the master default
 */
public record BarrierRequest(
        @JsonProperty("role") String role,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("syncId") String syncId,
        @JsonProperty("payload") Map<String, String> payload,
        @JsonProperty("timeoutMs") Long timeoutMs) {

    public void validate() {
        Requests.requireText(role, "role");
        Requests.requireText(hostname, "hostname");
        Requests.requireText(syncId, "syncId");
        Requests.requireNoNulls(payload, "payload");
    }

    public Participant participant() {
        return new Participant(role, hostname);
    }
}
