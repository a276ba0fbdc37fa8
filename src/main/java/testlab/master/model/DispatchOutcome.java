package testlab.master.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Terminal outcome of one device's pipeline, reported by the dispatch gateway.
 */
public record DispatchOutcome(
        @JsonProperty("status") JobStatus status,
        @JsonProperty("failureKind") FailureKind failureKind,
        @JsonProperty("reason") String reason) {

    public DispatchOutcome {
        Objects.requireNonNull(status, "status is required");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("outcome status must be terminal: " + status);
        }
    }

    public static DispatchOutcome complete() {
        return new DispatchOutcome(JobStatus.COMPLETE, null, null);
    }

    public static DispatchOutcome incomplete(FailureKind kind, String reason) {
        return new DispatchOutcome(JobStatus.INCOMPLETE, kind, reason);
    }

    public static DispatchOutcome canceled(String reason) {
        return new DispatchOutcome(JobStatus.CANCELED, FailureKind.CANCELED, reason);
    }
}
