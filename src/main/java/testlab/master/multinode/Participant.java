package testlab.master.multinode;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.Objects;

/**
 * A device taking part in a MultiNode group, identified by its role and hostname.
 */
public record Participant(
        @JsonProperty("role") String role,
        @JsonProperty("hostname") String hostname) implements Comparable<Participant> {

    private static final Comparator<Participant> ORDER = Comparator
            .comparing(Participant::role)
            .thenComparing(Participant::hostname);

    public Participant {
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(hostname, "hostname is required");
    }

    @Override
    public int compareTo(Participant other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return role + "@" + hostname;
    }
}
