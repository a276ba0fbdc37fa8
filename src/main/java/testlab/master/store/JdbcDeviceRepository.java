package testlab.master.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.model.Device;
import testlab.master.model.DeviceHealth;
import testlab.master.model.DeviceStatus;
import testlab.master.model.ReservationResult;
import testlab.master.repository.DeviceRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static testlab.master.store.JdbcSupport.*;

/**
 * JDBC implementation of DeviceRepository.
 * Reservation is a guarded single-row UPDATE committed before returning.
 */
public class JdbcDeviceRepository implements DeviceRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcDeviceRepository.class);

    private static final String UNRESERVABLE_HEALTH = "('BAD', 'MAINTENANCE', 'RETIRED')";

    private final Database db;

    public JdbcDeviceRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Device device) {
        String sql = """
                    INSERT INTO devices (hostname, device_type, tags, health, status, current_job,
                                         idle_since, last_health_check, registered_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, device.hostname());
            ps.setString(2, device.deviceType());
            ps.setString(3, joinNames(device.tags()));
            ps.setString(4, device.health().name());
            ps.setString(5, device.status().name());
            setLongOrNull(ps, 6, device.currentJobId());
            setTimestamp(ps, 7, device.idleSince());
            setTimestamp(ps, 8, device.lastHealthCheck());
            setTimestamp(ps, 9, device.registeredAt() != null ? device.registeredAt() : Instant.now());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLIntegrityConstraintViolationException e) {
            throw new IllegalArgumentException("Device already registered: " + device.hostname(), e);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save device: " + device.hostname(), e);
        }
    }

    @Override
    public boolean update(Device device) {
        String sql = """
                    UPDATE devices
                    SET device_type = ?, tags = ?, health = ?, status = ?, current_job = ?,
                        idle_since = ?, last_health_check = ?
                    WHERE hostname = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, device.deviceType());
            ps.setString(2, joinNames(device.tags()));
            ps.setString(3, device.health().name());
            ps.setString(4, device.status().name());
            setLongOrNull(ps, 5, device.currentJobId());
            setTimestamp(ps, 6, device.idleSince());
            setTimestamp(ps, 7, device.lastHealthCheck());
            ps.setString(8, device.hostname());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update device: " + device.hostname(), e);
        }
    }

    @Override
    public Optional<Device> findByHostname(String hostname) {
        String sql = "SELECT * FROM devices WHERE hostname = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, hostname);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find device: " + hostname, e);
        }
    }

    @Override
    public List<Device> findAll() {
        String sql = "SELECT * FROM devices ORDER BY hostname";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list devices", e);
        }
    }

    @Override
    public List<Device> findByType(String deviceType) {
        String sql = "SELECT * FROM devices WHERE device_type = ? ORDER BY hostname";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, deviceType);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find devices of type: " + deviceType, e);
        }
    }

    @Override
    public List<Device> findBusy() {
        String sql = "SELECT * FROM devices WHERE status IN ('RESERVED', 'RUNNING') ORDER BY hostname";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find busy devices", e);
        }
    }

    @Override
    public ReservationResult reserve(String hostname, long jobId) {
        String sql = """
                    UPDATE devices
                    SET status = 'RESERVED', current_job = ?
                    WHERE hostname = ?
                      AND status = 'IDLE'
                      AND current_job IS NULL
                      AND health NOT IN %s
                """.formatted(UNRESERVABLE_HEALTH);

        try (Connection conn = db.getConnection()) {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, jobId);
                ps.setString(2, hostname);
                updated = ps.executeUpdate();
            }
            conn.commit();

            if (updated == 1) {
                return ReservationResult.RESERVED;
            }
            return exists(conn, hostname) ? ReservationResult.CONFLICT : ReservationResult.NOT_FOUND;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reserve device " + hostname + " for job " + jobId, e);
        }
    }

    @Override
    public boolean markRunning(String hostname, long jobId) {
        String sql = """
                    UPDATE devices
                    SET status = 'RUNNING'
                    WHERE hostname = ? AND current_job = ? AND status = 'RESERVED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, hostname);
            ps.setLong(2, jobId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark device running: " + hostname, e);
        }
    }

    @Override
    public boolean release(String hostname, long jobId) {
        String sql = """
                    UPDATE devices
                    SET status = CASE WHEN health IN %1$s THEN 'OFFLINE' ELSE 'IDLE' END,
                        idle_since = CASE WHEN health IN %1$s THEN idle_since ELSE ? END,
                        current_job = NULL
                    WHERE hostname = ? AND current_job = ? AND status IN ('RESERVED', 'RUNNING')
                """.formatted(UNRESERVABLE_HEALTH);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, Instant.now());
            ps.setString(2, hostname);
            ps.setLong(3, jobId);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                log.debug("Release of {} for job {} was a no-op", hostname, jobId);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release device: " + hostname, e);
        }
    }

    private boolean exists(Connection conn, String hostname) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM devices WHERE hostname = ?")) {
            ps.setString(1, hostname);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private List<Device> executeQuery(PreparedStatement ps) throws SQLException {
        List<Device> devices = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                devices.add(mapRow(rs));
            }
        }
        return devices;
    }

    private Device mapRow(ResultSet rs) throws SQLException {
        return Device.builder()
                .hostname(rs.getString("hostname"))
                .deviceType(rs.getString("device_type"))
                .tags(splitNames(rs.getString("tags")))
                .health(DeviceHealth.valueOf(rs.getString("health")))
                .status(DeviceStatus.valueOf(rs.getString("status")))
                .currentJobId(getLongOrNull(rs, "current_job"))
                .idleSince(toInstant(rs.getTimestamp("idle_since")))
                .lastHealthCheck(toInstant(rs.getTimestamp("last_health_check")))
                .registeredAt(toInstant(rs.getTimestamp("registered_at")))
                .build();
    }
}
