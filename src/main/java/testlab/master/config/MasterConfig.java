package testlab.master.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for the lab master.
 * All settings have sensible defaults; they can be overridden from the
 * environment, from an INI file, or fluently in tests.
 */
public final class MasterConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/testlab;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private int blockingThreads = 256;

    // Scheduler settings
    private Duration passInterval = Duration.ofSeconds(5);
    private Duration reaperInterval = Duration.ofSeconds(30);
    private Duration healthCheckInterval = Duration.ofMinutes(1);
    private Duration healthCheckStaleAfter = Duration.ofHours(24);

    // MultiNode settings
    private Duration defaultSyncTimeout = Duration.ofMinutes(5);
    private Duration maxSyncTimeout = Duration.ofHours(1);

    // Dispatch settings
    private Duration simulatedRunTime = Duration.ofMillis(200);

    // Auth settings (optional)
    private String agentKey = null; // If set, internal callers must provide X-Lab-Key header

    private MasterConfig() {
    }

    public static MasterConfig defaults() {
        return new MasterConfig();
    }

    public static MasterConfig fromEnv() {
        MasterConfig config = new MasterConfig();

        String dbUrl = System.getenv("LAB_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("LAB_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String agentKey = System.getenv("LAB_AGENT_KEY");
        if (agentKey != null && !agentKey.isBlank()) {
            config.agentKey = agentKey;
        }

        String passMs = System.getenv("LAB_PASS_INTERVAL_MS");
        if (passMs != null && !passMs.isBlank()) {
            config.passInterval = Duration.ofMillis(Long.parseLong(passMs));
        }

        return config;
    }

    /**
     * Load settings from an INI file. Missing sections and keys keep their defaults.
     *
     * <pre>
     * [database]   url, pool_size
     * [server]     host, port, agent_key, blocking_threads
     * [scheduler]  pass_interval_ms, reaper_interval_ms, health_check_interval_ms, health_check_stale_hours
     * [multinode]  default_timeout_ms, max_timeout_ms
     * [dispatch]   simulated_run_ms
     * </pre>
     */
    public static MasterConfig fromIni(Path file) {
        Ini ini;
        try {
            ini = new Ini(file.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file: " + file, e);
        }

        MasterConfig config = new MasterConfig();

        Profile.Section database = ini.get("database");
        if (database != null) {
            config.databaseUrl = opt(database, "url", config.databaseUrl);
            config.databasePoolSize = optInt(database, "pool_size", config.databasePoolSize);
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            config.serverHost = opt(server, "host", config.serverHost);
            config.serverPort = optInt(server, "port", config.serverPort);
            config.agentKey = opt(server, "agent_key", config.agentKey);
            config.blockingThreads = optInt(server, "blocking_threads", config.blockingThreads);
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            config.passInterval = optMillis(scheduler, "pass_interval_ms", config.passInterval);
            config.reaperInterval = optMillis(scheduler, "reaper_interval_ms", config.reaperInterval);
            config.healthCheckInterval = optMillis(scheduler, "health_check_interval_ms", config.healthCheckInterval);
            String staleHours = opt(scheduler, "health_check_stale_hours", null);
            if (staleHours != null) {
                config.healthCheckStaleAfter = Duration.ofHours(Long.parseLong(staleHours));
            }
        }

        Profile.Section multinode = ini.get("multinode");
        if (multinode != null) {
            config.defaultSyncTimeout = optMillis(multinode, "default_timeout_ms", config.defaultSyncTimeout);
            config.maxSyncTimeout = optMillis(multinode, "max_timeout_ms", config.maxSyncTimeout);
        }

        Profile.Section dispatch = ini.get("dispatch");
        if (dispatch != null) {
            config.simulatedRunTime = optMillis(dispatch, "simulated_run_ms", config.simulatedRunTime);
        }

        return config;
    }

    private static String opt(Profile.Section section, String key, String fallback) {
        String value = section.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int optInt(Profile.Section section, String key, int fallback) {
        String value = opt(section, key, null);
        return value == null ? fallback : Integer.parseInt(value);
    }

    private static Duration optMillis(Profile.Section section, String key, Duration fallback) {
        String value = opt(section, key, null);
        return value == null ? fallback : Duration.ofMillis(Long.parseLong(value));
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int blockingThreads() {
        return blockingThreads;
    }

    public Duration passInterval() {
        return passInterval;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public Duration healthCheckStaleAfter() {
        return healthCheckStaleAfter;
    }

    public Duration defaultSyncTimeout() {
        return defaultSyncTimeout;
    }

    public Duration maxSyncTimeout() {
        return maxSyncTimeout;
    }

    public Duration simulatedRunTime() {
        return simulatedRunTime;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    // Fluent setters for testing/customization
    public MasterConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public MasterConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public MasterConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public MasterConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public MasterConfig withPassInterval(Duration interval) {
        this.passInterval = interval;
        return this;
    }

    public MasterConfig withHealthCheckStaleAfter(Duration staleAfter) {
        this.healthCheckStaleAfter = staleAfter;
        return this;
    }

    public MasterConfig withDefaultSyncTimeout(Duration timeout) {
        this.defaultSyncTimeout = timeout;
        return this;
    }

    public MasterConfig withMaxSyncTimeout(Duration timeout) {
        this.maxSyncTimeout = timeout;
        return this;
    }

    public MasterConfig withSimulatedRunTime(Duration runTime) {
        this.simulatedRunTime = runTime;
        return this;
    }

    @Override
    public String toString() {
        return "MasterConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", passInterval=" + passInterval +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
