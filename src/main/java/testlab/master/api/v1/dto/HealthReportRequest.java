package testlab.master.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import testlab.master.model.HealthProbeResult;

/**
 * Result of an external health probe.
 * POST /api/v1/devices/{hostname}/health
 */
public record HealthReportRequest(
        @JsonProperty("result") HealthProbeResult result) {

    public void validate() {
        if (result == null) {
            throw new IllegalArgumentException("result is required (PASS or FAIL)");
        }
    }
}
