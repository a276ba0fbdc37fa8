package testlab.master.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import testlab.master.model.DispatchOutcome;
import testlab.master.model.FailureKind;
import testlab.master.model.JobStatus;

/**
 * Terminal outcome of a device's pipeline, reported by the gateway.
 * POST /internal/v1/jobs/{jobId}/devices/{hostname}/outcome
 */
public record OutcomeRequest(
        @JsonProperty("status") JobStatus status,
        @JsonProperty("failureKind") FailureKind failureKind,
        @JsonProperty("reason") String reason) {

    public DispatchOutcome toOutcome() {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        return switch (status) {
            case COMPLETE -> DispatchOutcome.complete();
            case INCOMPLETE -> DispatchOutcome.incomplete(
                    failureKind == null ? FailureKind.INFRASTRUCTURE : failureKind, reason);
            case CANCELED -> DispatchOutcome.canceled(reason);
            default -> throw new IllegalArgumentException("outcome status must be terminal: " + status);
        };
    }
}
