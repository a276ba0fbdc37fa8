package testlab.master.multinode;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * The coordinator operations as seen by one participant. The plain methods
 * throw {@link SyncFailedException} on a non-OK result; the {@code try*}
 * variants return the {@link SyncResult} for callers that branch on it.
 */
public final class MultiNodeClient {

    private final MultiNodeCoordinator coordinator;
    private final String groupId;
    private final Participant self;
    private final Duration defaultTimeout;

    MultiNodeClient(MultiNodeCoordinator coordinator, String groupId, Participant self, Duration defaultTimeout) {
        this.coordinator = coordinator;
        this.groupId = groupId;
        this.self = self;
        this.defaultTimeout = defaultTimeout;
    }

    public String groupId() {
        return groupId;
    }

    public Participant self() {
        return self;
    }

    public SyncResult<Map<String, Map<String, String>>> tryBarrier(String syncId, Map<String, String> payload,
            Duration timeout) throws InterruptedException {
        return coordinator.waitBarrier(groupId, syncId, self, payload, timeout);
    }

    public Map<String, Map<String, String>> barrier(String syncId, Map<String, String> payload)
            throws InterruptedException {
        return tryBarrier(syncId, payload, defaultTimeout).orElseThrow("barrier '" + syncId + "'");
    }

    public Map<String, Map<String, String>> barrier(String syncId) throws InterruptedException {
        return barrier(syncId, Map.of());
    }

    /**
     * @param toRoles target roles; none means every other participant
     */
    public Message send(String messageId, Map<String, String> payload, String... toRoles) {
        return coordinator.sendMessage(groupId, messageId, self, Set.of(toRoles), payload)
                .orElseThrow("send '" + messageId + "'");
    }

    public SyncResult<Message> tryReceive(String messageId, Duration timeout) throws InterruptedException {
        return coordinator.receiveMessage(groupId, messageId, self, timeout);
    }

    public Message receive(String messageId) throws InterruptedException {
        return tryReceive(messageId, defaultTimeout).orElseThrow("receive '" + messageId + "'");
    }
}
