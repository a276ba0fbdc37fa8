package testlab.master.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import testlab.master.multinode.Participant;

import java.util.Map;
import java.util.Set;

/**
 * POST /internal/v1/groups/{groupId}/send
 *
 * @param toRoles target roles; absent or empty sends to every other member
 */
public record SendRequest(
        @JsonProperty("role") String role,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("messageId") String messageId,
        @JsonProperty("toRoles") Set<String> toRoles,
        @JsonProperty("payload") Map<String, String> payload) {

    public void validate() {
        Requests.requireText(role, "role");
        Requests.requireText(hostname, "hostname");
        Requests.requireText(messageId, "messageId");
        Requests.requireNoNulls(toRoles, "toRoles");
        Requests.requireNoNulls(payload, "payload");
    }

    public Participant participant() {
        return new Participant(role, hostname);
    }
}
