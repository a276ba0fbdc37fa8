package testlab.master.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Devices bound to one MultiNode job, sharing an opaque group id.
 */
public record DeviceGroup(
        String groupId,
        long jobId,
        List<GroupMember> members,
        Instant createdAt) {

    public DeviceGroup {
        members = List.copyOf(members);
    }

    /** hostname -> role for every member, in hostname order. */
    public Map<String, String> roleByHostname() {
        Map<String, String> roles = new TreeMap<>();
        for (GroupMember m : members) {
            roles.put(m.hostname(), m.role());
        }
        return roles;
    }

    /** role -> number of devices bound to it. */
    public Map<String, Integer> roleCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (GroupMember m : members) {
            counts.merge(m.role(), 1, Integer::sum);
        }
        return counts;
    }

    public Optional<GroupMember> member(String hostname) {
        return members.stream().filter(m -> m.hostname().equals(hostname)).findFirst();
    }

    public boolean allTerminal() {
        return members.stream().allMatch(GroupMember::isTerminal);
    }
}
