package testlab.master.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for the master's own health.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("devices") Integer devices,
        @JsonProperty("queueDepth") Integer queueDepth,
        @JsonProperty("runningJobs") Integer runningJobs,
        @JsonProperty("liveDispatches") Integer liveDispatches,
        @JsonProperty("schedulerRunning") Boolean schedulerRunning) {

    public static HealthResponse healthy(String uptime, String version, int devices, int queueDepth,
            int runningJobs, int liveDispatches, boolean schedulerRunning) {
        return new HealthResponse("healthy", "ok", uptime, version, devices, queueDepth, runningJobs,
                liveDispatches, schedulerRunning);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null, null);
    }
}
