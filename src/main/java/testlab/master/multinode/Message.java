package testlab.master.multinode;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A key/value payload sent by one participant to the given roles of its group.
 *
 * @param sequence per-group send order, assigned by the coordinator
 * @param toRoles  target roles; empty means every other participant
 */
public record Message(
        @JsonProperty("groupId") String groupId,
        @JsonProperty("messageId") String messageId,
        @JsonProperty("sequence") long sequence,
        @JsonProperty("from") Participant from,
        @JsonProperty("toRoles") Set<String> toRoles,
        @JsonProperty("payload") Map<String, String> payload,
        @JsonProperty("sentAt") Instant sentAt) {

    public Message {
        Objects.requireNonNull(groupId, "groupId is required");
        Objects.requireNonNull(messageId, "messageId is required");
        Objects.requireNonNull(from, "from is required");
        toRoles = toRoles == null ? Set.of() : Set.copyOf(new TreeSet<>(toRoles));
        payload = payload == null ? Map.of() : Map.copyOf(new TreeMap<>(payload));
    }
}
