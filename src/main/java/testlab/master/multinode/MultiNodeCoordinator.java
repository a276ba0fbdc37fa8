package testlab.master.multinode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.repository.MessageRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime synchronisation for MultiNode groups: barriers, send and receive.
 *
 * <p>Each group has its own lock and condition; callers block on the
 * condition with their own timeout, so there is no polling and groups never
 * contend with each other. A blocked caller wakes up with:
 * <ul>
 * <li>OK when the barrier releases or a message addressed to it arrives,</li>
 * <li>TIMEOUT when its timeout elapses first,</li>
 * <li>PEER_FAILED as soon as another member of the group fails,</li>
 * <li>CANCELED when the group is torn down or its job canceled.</li>
 * </ul>
 * Messages are journaled through the {@link MessageRepository} until every
 * recipient has consumed them.
 */
public class MultiNodeCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MultiNodeCoordinator.class);

    private final ConcurrentHashMap<String, GroupState> groups = new ConcurrentHashMap<>();
    private final MessageRepository journal;

    public MultiNodeCoordinator(MessageRepository journal) {
        this.journal = journal;
    }

    // ==================== Lifecycle ====================

    /**
     * Declare a group once at scheduling time.
     *
     * @param members hostname to role for every device of the group; the
     *                role counts a barrier waits for are derived from it
     */
    public void declareGroup(String groupId, Map<String, String> members) {
        Objects.requireNonNull(groupId, "groupId");
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("group " + groupId + " has no members");
        }
        GroupState previous = groups.putIfAbsent(groupId, new GroupState(groupId, members));
        if (previous != null) {
            throw new IllegalStateException("group already declared: " + groupId);
        }
        log.info("Declared group {} with roles {}", groupId, groups.get(groupId).roleCounts());
    }

    /**
     * Re-declare a group after a master restart and reload its undelivered
     * messages from the journal.
     */
    public void restoreGroup(String groupId, Map<String, String> members) {
        GroupState state = new GroupState(groupId, members);
        for (MessageRepository.PendingMessage pending : journal.findPending(groupId)) {
            state.post(pending.message(), pending.recipients());
        }
        groups.put(groupId, state);
        log.info("Restored group {} with {} undelivered messages", groupId, state.undelivered());
    }

    public boolean isDeclared(String groupId) {
        return groups.containsKey(groupId);
    }

    /**
     * A member failed: blocked barrier waiters and receivers without an
     * available message return PEER_FAILED, and so do later barrier calls.
     */
    public void peerFailed(String groupId, Participant failed) {
        GroupState g = groups.get(groupId);
        if (g == null) {
            return;
        }
        g.lock.lock();
        try {
            if (!g.isPeerFailed()) {
                g.markPeerFailed();
                log.warn("Group {}: peer {} failed, waking blocked members", groupId, failed);
            }
            g.changed.signalAll();
        } finally {
            g.lock.unlock();
        }
    }

    /**
     * Discard all state of the group; blocked callers return CANCELED.
     * Used both when every member is terminal and when the job is canceled.
     */
    public void teardown(String groupId) {
        GroupState g = groups.remove(groupId);
        if (g != null) {
            g.lock.lock();
            try {
                g.cancel();
                g.changed.signalAll();
            } finally {
                g.lock.unlock();
            }
            log.info("Group {} torn down", groupId);
        }
        journal.deleteGroup(groupId);
    }

    // ==================== Barrier ====================

    /**
     * Block until every declared role has its full count of participants at
     * this sync id.
     *
     * @return role to merged payload on OK; TIMEOUT, PEER_FAILED or CANCELED otherwise
     * @throws InterruptedException     if the calling thread is interrupted while waiting;
     *                                  its arrival is withdrawn
     * @throws IllegalArgumentException if the participant is not a member of the group
     */
    public SyncResult<Map<String, Map<String, String>>> waitBarrier(String groupId, String syncId,
            Participant participant, Map<String, String> payload, Duration timeout) throws InterruptedException {
        GroupState g = groups.get(groupId);
        if (g == null) {
            return SyncResult.canceled();
        }

        g.lock.lock();
        try {
            if (g.isCanceled()) {
                return SyncResult.canceled();
            }
            g.checkMember(participant);
            if (g.isPeerFailed()) {
                return SyncResult.peerFailed();
            }

            Barrier barrier = g.barrier(syncId);
            barrier.arrive(participant, payload);
            if (barrier.isComplete(g.roleCounts())) {
                barrier.release();
                g.discard(barrier);
                g.changed.signalAll();
                log.debug("Group {}: barrier '{}' released by {}", groupId, syncId, participant);
                return SyncResult.ok(barrier.result());
            }

            long nanos = timeout.toNanos();
            try {
                while (true) {
                    if (barrier.isReleased()) {
                        return SyncResult.ok(barrier.result());
                    }
                    if (barrier.isTimedOut()) {
                        return SyncResult.timeout();
                    }
                    if (g.isCanceled()) {
                        return SyncResult.canceled();
                    }
                    if (g.isPeerFailed()) {
                        return SyncResult.peerFailed();
                    }
                    if (nanos <= 0) {
                        barrier.markTimedOut();
                        g.discard(barrier);
                        g.changed.signalAll();
                        log.warn("Group {}: barrier '{}' timed out with {} of {} participants", groupId, syncId,
                                barrier.arrivedCount(), g.roleCounts().values().stream().mapToInt(i -> i).sum());
                        return SyncResult.timeout();
                    }
                    nanos = g.changed.awaitNanos(nanos);
                }
            } catch (InterruptedException e) {
                if (!barrier.isReleased()) {
                    barrier.withdraw(participant);
                }
                throw e;
            }
        } finally {
            g.lock.unlock();
        }
    }

    // ==================== Messages ====================

    /**
     * Post a message to the target roles (every other participant when
     * {@code toRoles} is empty). Never blocks.
     *
     * @return the stored message on OK; CANCELED if the group is gone
     */
    public SyncResult<Message> sendMessage(String groupId, String messageId, Participant from, Set<String> toRoles,
            Map<String, String> payload) {
        Objects.requireNonNull(messageId, "messageId");
        GroupState g = groups.get(groupId);
        if (g == null) {
            return SyncResult.canceled();
        }

        g.lock.lock();
        try {
            if (g.isCanceled()) {
                return SyncResult.canceled();
            }
            g.checkMember(from);
            Set<String> roles = toRoles == null ? Set.of() : toRoles;
            Set<String> recipients = g.recipientsOf(from, roles);

            Message message = new Message(groupId, messageId, g.allocateSequence(), from, roles, payload,
                    Instant.now());
            if (!recipients.isEmpty()) {
                journal.append(message, recipients);
                g.post(message, recipients);
                g.changed.signalAll();
            }
            log.debug("Group {}: {} sent '{}' to {}", groupId, from, messageId, recipients);
            return SyncResult.ok(message);
        } finally {
            g.lock.unlock();
        }
    }

    /**
     * Block until a message with this id addressed to the participant is
     * available. Each send is delivered to each recipient exactly once.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public SyncResult<Message> receiveMessage(String groupId, String messageId, Participant participant,
            Duration timeout) throws InterruptedException {
        GroupState g = groups.get(groupId);
        if (g == null) {
            return SyncResult.canceled();
        }

        g.lock.lock();
        try {
            if (g.isCanceled()) {
                return SyncResult.canceled();
            }
            g.checkMember(participant);

            long nanos = timeout.toNanos();
            while (true) {
                if (g.isCanceled()) {
                    return SyncResult.canceled();
                }
                Message message = g.take(messageId, participant.hostname());
                if (message != null) {
                    journal.markDelivered(groupId, message.sequence(), participant.hostname());
                    return SyncResult.ok(message);
                }
                if (g.isPeerFailed()) {
                    return SyncResult.peerFailed();
                }
                if (nanos <= 0) {
                    return SyncResult.timeout();
                }
                nanos = g.changed.awaitNanos(nanos);
            }
        } finally {
            g.lock.unlock();
        }
    }

    /**
     * Client bound to one participant of a group, for use inside a device pipeline.
     */
    public MultiNodeClient client(String groupId, Participant participant, Duration defaultTimeout) {
        return new MultiNodeClient(this, groupId, participant, defaultTimeout);
    }

    int activeGroups() {
        return groups.size();
    }
}
