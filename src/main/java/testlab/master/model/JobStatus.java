package testlab.master.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Job (and MultiNode group member) lifecycle.
 *
 * <pre>
 * SUBMITTED -> SCHEDULED, CANCELED
 * SCHEDULED -> RUNNING, CANCELED, INCOMPLETE
 * RUNNING   -> COMPLETE, INCOMPLETE, CANCELED
 * </pre>
 */
public enum JobStatus {
    /** Waiting in the queue for devices */
    SUBMITTED,
    /** Devices reserved, handed to the dispatch gateway */
    SCHEDULED,
    /** At least one pipeline has started */
    RUNNING,
    /** Finished successfully */
    COMPLETE,
    /** Failed: infrastructure, timeout or peer failure */
    INCOMPLETE,
    /** Canceled by the owner or by the master */
    CANCELED;

    private static final Map<JobStatus, Set<JobStatus>> TRANSITIONS = Map.of(
            SUBMITTED, EnumSet.of(SCHEDULED, CANCELED),
            SCHEDULED, EnumSet.of(RUNNING, CANCELED, INCOMPLETE),
            RUNNING, EnumSet.of(COMPLETE, INCOMPLETE, CANCELED),
            COMPLETE, EnumSet.noneOf(JobStatus.class),
            INCOMPLETE, EnumSet.noneOf(JobStatus.class),
            CANCELED, EnumSet.noneOf(JobStatus.class));

    public boolean canTransitionTo(JobStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    /**
     * Validate a transition.
     *
     * @throws IllegalStateTransitionException if the table does not allow it
     */
    public JobStatus transitionTo(JobStatus target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateTransitionException("job", name(), target.name());
        }
        return target;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == INCOMPLETE || this == CANCELED;
    }
}
