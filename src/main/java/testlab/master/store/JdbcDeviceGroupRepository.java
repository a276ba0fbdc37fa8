package testlab.master.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.model.DeviceGroup;
import testlab.master.model.FailureKind;
import testlab.master.model.GroupMember;
import testlab.master.model.JobStatus;
import testlab.master.repository.DeviceGroupRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static testlab.master.store.JdbcSupport.*;

/**
 * JDBC implementation of DeviceGroupRepository.
 * A group and its members are written in one transaction.
 */
public class JdbcDeviceGroupRepository implements DeviceGroupRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcDeviceGroupRepository.class);

    private final Database db;

    public JdbcDeviceGroupRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(DeviceGroup group) {
        String groupSql = "INSERT INTO device_groups (group_id, job_id, created_at) VALUES (?, ?, ?)";
        String memberSql = """
                    INSERT INTO group_members (group_id, hostname, role_name, sub_id, status)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement groupPs = conn.prepareStatement(groupSql);
                    PreparedStatement memberPs = conn.prepareStatement(memberSql)) {

                groupPs.setString(1, group.groupId());
                groupPs.setLong(2, group.jobId());
                setTimestamp(groupPs, 3, group.createdAt() != null ? group.createdAt() : Instant.now());
                groupPs.executeUpdate();

                for (GroupMember m : group.members()) {
                    memberPs.setString(1, group.groupId());
                    memberPs.setString(2, m.hostname());
                    memberPs.setString(3, m.role());
                    memberPs.setString(4, m.subId());
                    memberPs.setString(5, m.status().name());
                    memberPs.addBatch();
                }
                memberPs.executeBatch();

                conn.commit();
                log.debug("Saved group {} for job {} with {} members",
                        group.groupId(), group.jobId(), group.members().size());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save group: " + group.groupId(), e);
        }
    }

    @Override
    public Optional<DeviceGroup> findById(String groupId) {
        return findOne("SELECT * FROM device_groups WHERE group_id = ?", ps -> ps.setString(1, groupId),
                "group " + groupId);
    }

    @Override
    public Optional<DeviceGroup> findByJobId(long jobId) {
        return findOne("SELECT * FROM device_groups WHERE job_id = ?", ps -> ps.setLong(1, jobId),
                "group of job " + jobId);
    }

    @Override
    public boolean updateMember(JobStatus expected, GroupMember updated) {
        String sql = """
                    UPDATE group_members SET status = ?, failure_kind = ?, failure_comment = ?
                    WHERE group_id = ? AND hostname = ? AND status = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, updated.status().name());
            ps.setString(2, updated.failureKind() != null ? updated.failureKind().name() : null);
            ps.setString(3, updated.failureComment());
            ps.setString(4, updated.groupId());
            ps.setString(5, updated.hostname());
            ps.setString(6, expected.name());
            int rows = ps.executeUpdate();
            conn.commit();
            return rows > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update member " + updated.hostname()
                    + " of group " + updated.groupId(), e);
        }
    }

    @Override
    public List<DeviceGroup> findActive() {
        String sql = """
                    SELECT g.* FROM device_groups g
                    WHERE EXISTS (
                        SELECT 1 FROM group_members m
                        WHERE m.group_id = g.group_id AND m.status IN ('SCHEDULED', 'RUNNING')
                    )
                    ORDER BY g.job_id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            List<DeviceGroup> groups = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    groups.add(mapGroup(conn, rs));
                }
            }
            return groups;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find active groups", e);
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private Optional<DeviceGroup> findOne(String sql, Binder binder, String what) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapGroup(conn, rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find " + what, e);
        }
    }

    private DeviceGroup mapGroup(Connection conn, ResultSet rs) throws SQLException {
        String groupId = rs.getString("group_id");
        long jobId = rs.getLong("job_id");
        return new DeviceGroup(groupId, jobId, loadMembers(conn, groupId, jobId),
                toInstant(rs.getTimestamp("created_at")));
    }

    private List<GroupMember> loadMembers(Connection conn, String groupId, long jobId) throws SQLException {
        // sub ids are "<jobId>.<n>"; order by n
        String sql = """
                    SELECT * FROM group_members WHERE group_id = ?
                    ORDER BY LENGTH(sub_id), sub_id
                """;

        List<GroupMember> members = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, groupId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String failureKind = rs.getString("failure_kind");
                    members.add(new GroupMember(
                            groupId,
                            jobId,
                            rs.getString("sub_id"),
                            rs.getString("role_name"),
                            rs.getString("hostname"),
                            JobStatus.valueOf(rs.getString("status")),
                            failureKind != null ? FailureKind.valueOf(failureKind) : null,
                            rs.getString("failure_comment")));
                }
            }
        }
        return members;
    }
}
