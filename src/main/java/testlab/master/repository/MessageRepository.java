package testlab.master.repository;

import testlab.master.multinode.Message;

import java.util.List;
import java.util.Set;

/**
 * Journal of MultiNode messages that still have recipients waiting for them.
 */
public interface MessageRepository {

    /**
     * Record a sent message and the devices it must still be delivered to.
     */
    void append(Message message, Set<String> recipients);

    /**
     * Record that one recipient consumed a message. The message is dropped once
     * no recipient is left.
     */
    void markDelivered(String groupId, long sequence, String hostname);

    /**
     * Undelivered messages of a group in send order, with their pending recipients.
     */
    List<PendingMessage> findPending(String groupId);

    /**
     * Drop everything journaled for a group.
     */
    void deleteGroup(String groupId);

    record PendingMessage(Message message, Set<String> recipients) {
    }
}
