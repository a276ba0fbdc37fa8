package testlab.master.multinode;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One synchronisation point of a group. Guarded by the owning group's lock.
 */
final class Barrier {

    private final String syncId;
    private final Map<Participant, Map<String, String>> arrivals = new TreeMap<>();
    private Map<String, Map<String, String>> result;
    private boolean timedOut;

    Barrier(String syncId) {
        this.syncId = syncId;
    }

    String syncId() {
        return syncId;
    }

    void arrive(Participant participant, Map<String, String> payload) {
        arrivals.put(participant, payload == null ? Map.of() : Map.copyOf(payload));
    }

    void withdraw(Participant participant) {
        arrivals.remove(participant);
    }

    int arrivedCount() {
        return arrivals.size();
    }

    /** Every role has its full declared count of participants. */
    boolean isComplete(Map<String, Integer> roleCounts) {
        Map<String, Integer> arrived = new TreeMap<>();
        for (Participant p : arrivals.keySet()) {
            arrived.merge(p.role(), 1, Integer::sum);
        }
        for (Map.Entry<String, Integer> e : roleCounts.entrySet()) {
            if (arrived.getOrDefault(e.getKey(), 0) < e.getValue()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Merge payloads per role. Arrivals are kept sorted by role then hostname,
     * so for duplicate keys within a role the lexicographically last hostname wins
     * regardless of arrival order.
     */
    void release() {
        Map<String, Map<String, String>> merged = new TreeMap<>();
        arrivals.forEach((participant, payload) ->
                merged.computeIfAbsent(participant.role(), r -> new TreeMap<>()).putAll(payload));
        Map<String, Map<String, String>> frozen = new TreeMap<>();
        merged.forEach((role, payload) -> frozen.put(role, Collections.unmodifiableMap(payload)));
        this.result = Collections.unmodifiableMap(frozen);
    }

    boolean isReleased() {
        return result != null;
    }

    Map<String, Map<String, String>> result() {
        return result;
    }

    void markTimedOut() {
        this.timedOut = true;
    }

    boolean isTimedOut() {
        return timedOut;
    }
}
