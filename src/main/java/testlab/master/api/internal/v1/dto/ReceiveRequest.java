package testlab.master.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import testlab.master.multinode.Participant;

/**
 * POST /internal/v1/groups/{groupId}/receive
 */
public record ReceiveRequest(
        @JsonProperty("role") String role,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("messageId") String messageId,
        @JsonProperty("timeoutMs") Long timeoutMs) {

    public void validate() {
        Requests.requireText(role, "role");
        Requests.requireText(hostname, "hostname");
        Requests.requireText(messageId, "messageId");
    }

    public Participant participant() {
        return new Participant(role, hostname);
    }
}
