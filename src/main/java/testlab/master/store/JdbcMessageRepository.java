package testlab.master.store;

import testlab.master.multinode.Message;
import testlab.master.multinode.Participant;
import testlab.master.repository.MessageRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static testlab.master.store.JdbcSupport.*;

/**
 * JDBC implementation of MessageRepository.
 * One row per message plus one row per recipient that has not consumed it yet.
 */
public class JdbcMessageRepository implements MessageRepository {

    private final Database db;

    public JdbcMessageRepository(Database db) {
        this.db = db;
    }

    @Override
    public void append(Message message, Set<String> recipients) {
        String messageSql = """
                    INSERT INTO group_messages (group_id, seq, message_id, from_role, from_hostname, to_roles, payload, sent_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        String recipientSql = "INSERT INTO message_recipients (group_id, seq, hostname) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(messageSql);
                    PreparedStatement rps = conn.prepareStatement(recipientSql)) {

                ps.setString(1, message.groupId());
                ps.setLong(2, message.sequence());
                ps.setString(3, message.messageId());
                ps.setString(4, message.from().role());
                ps.setString(5, message.from().hostname());
                ps.setString(6, joinNames(message.toRoles()));
                ps.setString(7, JsonColumns.writeStringMap(message.payload()));
                setTimestamp(ps, 8, message.sentAt());
                ps.executeUpdate();

                for (String hostname : recipients) {
                    rps.setString(1, message.groupId());
                    rps.setLong(2, message.sequence());
                    rps.setString(3, hostname);
                    rps.addBatch();
                }
                rps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to journal message " + message.messageId()
                    + " of group " + message.groupId(), e);
        }
    }

    @Override
    public void markDelivered(String groupId, long sequence, String hostname) {
        String deleteRecipient = "DELETE FROM message_recipients WHERE group_id = ? AND seq = ? AND hostname = ?";
        String deleteDrained = """
                    DELETE FROM group_messages
                    WHERE group_id = ? AND seq = ?
                      AND NOT EXISTS (SELECT 1 FROM message_recipients r WHERE r.group_id = ? AND r.seq = ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(deleteRecipient);
                PreparedStatement drained = conn.prepareStatement(deleteDrained)) {

            ps.setString(1, groupId);
            ps.setLong(2, sequence);
            ps.setString(3, hostname);
            ps.executeUpdate();

            drained.setString(1, groupId);
            drained.setLong(2, sequence);
            drained.setString(3, groupId);
            drained.setLong(4, sequence);
            drained.executeUpdate();

            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record delivery of message " + sequence + " to " + hostname, e);
        }
    }

    @Override
    public List<PendingMessage> findPending(String groupId) {
        String sql = """
                    SELECT m.*, r.hostname AS recipient
                    FROM group_messages m
                    JOIN message_recipients r ON r.group_id = m.group_id AND r.seq = m.seq
                    WHERE m.group_id = ?
                    ORDER BY m.seq, r.hostname
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, groupId);
            Map<Long, Message> messages = new LinkedHashMap<>();
            Map<Long, Set<String>> recipients = new LinkedHashMap<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long seq = rs.getLong("seq");
                    if (!messages.containsKey(seq)) {
                        messages.put(seq, mapRow(rs));
                    }
                    recipients.computeIfAbsent(seq, k -> new TreeSet<>()).add(rs.getString("recipient"));
                }
            }

            List<PendingMessage> pending = new ArrayList<>();
            messages.forEach((seq, message) -> pending.add(new PendingMessage(message, recipients.get(seq))));
            return pending;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load pending messages of group " + groupId, e);
        }
    }

    @Override
    public void deleteGroup(String groupId) {
        try (Connection conn = db.getConnection();
                PreparedStatement recipients = conn.prepareStatement(
                        "DELETE FROM message_recipients WHERE group_id = ?");
                PreparedStatement messages = conn.prepareStatement(
                        "DELETE FROM group_messages WHERE group_id = ?")) {

            recipients.setString(1, groupId);
            recipients.executeUpdate();
            messages.setString(1, groupId);
            messages.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete messages of group " + groupId, e);
        }
    }

    private Message mapRow(ResultSet rs) throws SQLException {
        return new Message(
                rs.getString("group_id"),
                rs.getString("message_id"),
                rs.getLong("seq"),
                new Participant(rs.getString("from_role"), rs.getString("from_hostname")),
                splitNames(rs.getString("to_roles")),
                JsonColumns.readStringMap(rs.getString("payload")),
                toInstant(rs.getTimestamp("sent_at")));
    }
}
