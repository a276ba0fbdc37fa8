package testlab.master.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testlab.master.config.MasterConfig;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with
 * auto-commit disabled.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(MasterConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("testlab-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- DEVICES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS devices (
                            hostname          VARCHAR(255) PRIMARY KEY,
                            device_type       VARCHAR(255) NOT NULL,
                            tags              VARCHAR(2048) NOT NULL DEFAULT '',
                            health            VARCHAR(20) NOT NULL DEFAULT 'UNKNOWN',
                            status            VARCHAR(20) NOT NULL DEFAULT 'IDLE',
                            current_job       BIGINT,
                            idle_since        TIMESTAMP,
                            last_health_check TIMESTAMP,
                            registered_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- JOBS ----------
            st.addBatch("CREATE SEQUENCE IF NOT EXISTS job_ids START WITH 1");
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id              BIGINT PRIMARY KEY,
                            description     VARCHAR(1024),
                            submitter       VARCHAR(255),
                            priority        INT NOT NULL DEFAULT 50,
                            status          VARCHAR(20) NOT NULL DEFAULT 'SUBMITTED',
                            health_check    BOOLEAN NOT NULL DEFAULT FALSE,
                            requested_device VARCHAR(255),
                            device_type     VARCHAR(255) NOT NULL,
                            requirements    CLOB NOT NULL,
                            group_id        VARCHAR(64),
                            submit_time     TIMESTAMP NOT NULL,
                            start_time      TIMESTAMP,
                            end_time        TIMESTAMP,
                            failure_kind    VARCHAR(32),
                            failure_comment VARCHAR(2048)
                        );
                    """);

            // ---------- MULTINODE GROUPS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS device_groups (
                            group_id        VARCHAR(64) PRIMARY KEY,
                            job_id          BIGINT NOT NULL,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS group_members (
                            group_id        VARCHAR(64) NOT NULL,
                            hostname        VARCHAR(255) NOT NULL,
                            role_name       VARCHAR(255) NOT NULL,
                            sub_id          VARCHAR(64) NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            failure_kind    VARCHAR(32),
                            failure_comment VARCHAR(2048),
                            PRIMARY KEY (group_id, hostname)
                        );
                    """);

            // ---------- MESSAGE JOURNAL ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS group_messages (
                            group_id        VARCHAR(64) NOT NULL,
                            seq             BIGINT NOT NULL,
                            message_id      VARCHAR(255) NOT NULL,
                            from_role       VARCHAR(255) NOT NULL,
                            from_hostname   VARCHAR(255) NOT NULL,
                            to_roles        VARCHAR(2048) NOT NULL DEFAULT '',
                            payload         CLOB NOT NULL,
                            sent_at         TIMESTAMP NOT NULL,
                            PRIMARY KEY (group_id, seq)
                        );
                    """);
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS message_recipients (
                            group_id        VARCHAR(64) NOT NULL,
                            seq             BIGINT NOT NULL,
                            hostname        VARCHAR(255) NOT NULL,
                            PRIMARY KEY (group_id, seq, hostname)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_queue ON jobs(status, health_check, priority, submit_time, id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_requested_device ON jobs(requested_device, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_devices_type_status ON devices(device_type, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_groups_job ON device_groups(job_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
