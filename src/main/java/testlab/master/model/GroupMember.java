package testlab.master.model;

import java.util.Objects;

/**
 * One (role, device) binding of a MultiNode group, with its own lifecycle.
 *
 * @param subId "jobId.n", numbered in binding order
 */
public record GroupMember(
        String groupId,
        long jobId,
        String subId,
        String role,
        String hostname,
        JobStatus status,
        FailureKind failureKind,
        String failureComment) {

    public GroupMember {
        Objects.requireNonNull(groupId, "groupId is required");
        Objects.requireNonNull(subId, "subId is required");
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(hostname, "hostname is required");
        Objects.requireNonNull(status, "status is required");
    }

    public static GroupMember scheduled(String groupId, long jobId, int index, String role, String hostname) {
        return new GroupMember(groupId, jobId, jobId + "." + index, role, hostname, JobStatus.SCHEDULED, null, null);
    }

    /**
     * @throws IllegalStateTransitionException if the member cannot move to {@code newStatus}
     */
    public GroupMember withStatus(JobStatus newStatus) {
        return new GroupMember(groupId, jobId, subId, role, hostname, status.transitionTo(newStatus),
                failureKind, failureComment);
    }

    public GroupMember withOutcome(DispatchOutcome outcome) {
        return new GroupMember(groupId, jobId, subId, role, hostname, status.transitionTo(outcome.status()),
                outcome.failureKind(), outcome.reason());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
