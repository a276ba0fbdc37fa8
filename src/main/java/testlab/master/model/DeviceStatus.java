package testlab.master.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Device occupancy status with an explicit transition table.
 *
 * <pre>
 * IDLE     -> RESERVED, OFFLINE
 * RESERVED -> RUNNING, IDLE, OFFLINE
 * RUNNING  -> IDLE, OFFLINE
 * OFFLINE  -> IDLE
 * </pre>
 */
public enum DeviceStatus {
    IDLE,
    RESERVED,
    RUNNING,
    OFFLINE;

    private static final Map<DeviceStatus, Set<DeviceStatus>> TRANSITIONS = Map.of(
            IDLE, EnumSet.of(RESERVED, OFFLINE),
            RESERVED, EnumSet.of(RUNNING, IDLE, OFFLINE),
            RUNNING, EnumSet.of(IDLE, OFFLINE),
            OFFLINE, EnumSet.of(IDLE));

    public boolean canTransitionTo(DeviceStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    /**
     * Validate a transition.
     *
     * @throws IllegalStateTransitionException if the table does not allow it
     */
    public DeviceStatus transitionTo(DeviceStatus target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateTransitionException("device", name(), target.name());
        }
        return target;
    }

    /** Device is held by a job */
    public boolean isBusy() {
        return this == RESERVED || this == RUNNING;
    }
}
