package testlab.master.multinode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runtime state of one MultiNode group: barriers, undelivered messages and
 * the failure flags. Every field is guarded by {@link #lock}.
 */
final class GroupState {

    final String groupId;
    final ReentrantLock lock = new ReentrantLock();
    final Condition changed = lock.newCondition();

    /** hostname -> role */
    private final Map<String, String> members;
    private final Map<String, Integer> roleCounts;
    private final Map<String, Barrier> barriers = new HashMap<>();
    private final List<Envelope> mailbox = new ArrayList<>();
    private long nextSequence = 1;

    private boolean peerFailed;
    private boolean canceled;

    GroupState(String groupId, Map<String, String> members) {
        this.groupId = groupId;
        this.members = Map.copyOf(members);
        Map<String, Integer> counts = new TreeMap<>();
        members.values().forEach(role -> counts.merge(role, 1, Integer::sum));
        this.roleCounts = Map.copyOf(counts);
    }

    Map<String, Integer> roleCounts() {
        return roleCounts;
    }

    void checkMember(Participant participant) {
        String role = members.get(participant.hostname());
        if (role == null) {
            throw new IllegalArgumentException(participant.hostname() + " is not a member of group " + groupId);
        }
        if (!role.equals(participant.role())) {
            throw new IllegalArgumentException(participant.hostname() + " has role " + role
                    + " in group " + groupId + ", not " + participant.role());
        }
    }

    Barrier barrier(String syncId) {
        return barriers.computeIfAbsent(syncId, Barrier::new);
    }

    /** Drop a barrier if it is still the registered one for its id. */
    void discard(Barrier barrier) {
        barriers.remove(barrier.syncId(), barrier);
    }

    int openBarriers() {
        return barriers.size();
    }

    /**
     * Devices a message must reach: members of the target roles (every role
     * when empty), never the sender itself.
     */
    Set<String> recipientsOf(Participant from, Set<String> toRoles) {
        for (String role : toRoles) {
            if (!roleCounts.containsKey(role)) {
                throw new IllegalArgumentException("Unknown role " + role + " in group " + groupId);
            }
        }
        Set<String> recipients = new TreeSet<>();
        members.forEach((hostname, role) -> {
            if (!hostname.equals(from.hostname()) && (toRoles.isEmpty() || toRoles.contains(role))) {
                recipients.add(hostname);
            }
        });
        return recipients;
    }

    long allocateSequence() {
        return nextSequence++;
    }

    void post(Message message, Set<String> recipients) {
        mailbox.add(new Envelope(message, new TreeSet<>(recipients)));
        nextSequence = Math.max(nextSequence, message.sequence() + 1);
    }

    /**
     * Take the oldest message with this id still owed to the device, removing
     * the device from its recipients.
     */
    Message take(String messageId, String hostname) {
        Iterator<Envelope> it = mailbox.iterator();
        while (it.hasNext()) {
            Envelope e = it.next();
            if (e.message.messageId().equals(messageId) && e.pending.remove(hostname)) {
                if (e.pending.isEmpty()) {
                    it.remove();
                }
                return e.message;
            }
        }
        return null;
    }

    int undelivered() {
        return mailbox.size();
    }

    boolean isPeerFailed() {
        return peerFailed;
    }

    void markPeerFailed() {
        peerFailed = true;
    }

    boolean isCanceled() {
        return canceled;
    }

    void cancel() {
        canceled = true;
        barriers.clear();
        mailbox.clear();
    }

    private record Envelope(Message message, Set<String> pending) {
    }
}
