package testlab.master.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.model.FailureKind;
import testlab.master.model.Job;
import testlab.master.model.JobPriority;
import testlab.master.model.JobStatus;
import testlab.master.repository.JobRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static testlab.master.store.JdbcSupport.*;

/**
 * JDBC implementation of JobRepository.
 * Device requirements are stored as a JSON column; the primary device type is
 * denormalized for queue metrics.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public long nextId() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT NEXT VALUE FOR job_ids")) {
            rs.next();
            long id = rs.getLong(1);
            conn.commit();
            return id;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to allocate job id", e);
        }
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO jobs (id, description, submitter, priority, status, health_check, requested_device,
                                      device_type, requirements, group_id, submit_time, start_time, end_time,
                                      failure_kind, failure_comment)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, job.id());
            ps.setString(2, job.description());
            ps.setString(3, job.submitter());
            ps.setInt(4, job.priority().weight());
            ps.setString(5, job.status().name());
            ps.setBoolean(6, job.healthCheck());
            ps.setString(7, job.requestedDevice());
            ps.setString(8, job.primaryDeviceType());
            ps.setString(9, JsonColumns.writeRequirements(job.requirement(), job.roles()));
            ps.setString(10, job.groupId());
            setTimestamp(ps, 11, job.submitTime() != null ? job.submitTime() : Instant.now());
            setTimestamp(ps, 12, job.startTime());
            setTimestamp(ps, 13, job.endTime());
            ps.setString(14, job.failureKind() != null ? job.failureKind().name() : null);
            ps.setString(15, job.failureComment());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved job: {}", job.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(long jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        String sql = "SELECT * FROM jobs WHERE status = ? ORDER BY submit_time, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs by status: " + status, e);
        }
    }

    @Override
    public List<Job> findSubmittedInQueueOrder() {
        String sql = """
                    SELECT * FROM jobs
                    WHERE status = 'SUBMITTED'
                    ORDER BY health_check DESC, priority DESC, submit_time, id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read job queue", e);
        }
    }

    @Override
    public Optional<Job> findActiveHealthCheck(String hostname) {
        String sql = """
                    SELECT * FROM jobs
                    WHERE health_check = TRUE AND requested_device = ?
                      AND status IN ('SUBMITTED', 'SCHEDULED', 'RUNNING')
                    ORDER BY id
                    LIMIT 1
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, hostname);
            List<Job> jobs = executeQuery(ps);
            return jobs.stream().findFirst();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find health check for device: " + hostname, e);
        }
    }

    @Override
    public boolean compareAndSet(JobStatus expected, Job updated) {
        String sql = """
                    UPDATE jobs
                    SET status = ?, group_id = ?, start_time = ?, end_time = ?, failure_kind = ?, failure_comment = ?
                    WHERE id = ? AND status = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, updated.status().name());
            ps.setString(2, updated.groupId());
            setTimestamp(ps, 3, updated.startTime());
            setTimestamp(ps, 4, updated.endTime());
            ps.setString(5, updated.failureKind() != null ? updated.failureKind().name() : null);
            ps.setString(6, updated.failureComment());
            ps.setLong(7, updated.id());
            ps.setString(8, expected.name());

            int rows = ps.executeUpdate();
            conn.commit();
            return rows > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job: " + updated.id(), e);
        }
    }

    @Override
    public int countByStatus(JobStatus status) {
        String sql = "SELECT COUNT(*) FROM jobs WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs by status: " + status, e);
        }
    }

    @Override
    public Map<String, Integer> countSubmittedByDeviceType() {
        String sql = """
                    SELECT device_type, COUNT(*) AS pending FROM jobs
                    WHERE status = 'SUBMITTED'
                    GROUP BY device_type
                """;

        Map<String, Integer> counts = new TreeMap<>();
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                counts.put(rs.getString("device_type"), rs.getInt("pending"));
            }
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count pending jobs by device type", e);
        }
    }

    @Override
    public List<Job> findRecent(int limit) {
        String sql = "SELECT * FROM jobs ORDER BY id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent jobs", e);
        }
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        JsonColumns.Requirements requirements = JsonColumns.readRequirements(rs.getString("requirements"));
        String failureKind = rs.getString("failure_kind");

        return Job.builder()
                .id(rs.getLong("id"))
                .description(rs.getString("description"))
                .submitter(rs.getString("submitter"))
                .priority(JobPriority.fromWeight(rs.getInt("priority")))
                .status(JobStatus.valueOf(rs.getString("status")))
                .healthCheck(rs.getBoolean("health_check"))
                .requestedDevice(rs.getString("requested_device"))
                .requirement(requirements.device())
                .roles(requirements.roles())
                .groupId(rs.getString("group_id"))
                .submitTime(toInstant(rs.getTimestamp("submit_time")))
                .startTime(toInstant(rs.getTimestamp("start_time")))
                .endTime(toInstant(rs.getTimestamp("end_time")))
                .failureKind(failureKind != null ? FailureKind.valueOf(failureKind) : null)
                .failureComment(rs.getString("failure_comment"))
                .build();
    }
}
