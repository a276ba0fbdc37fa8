package testlab.master.model;

/**
 * Device health as last established by a health check or an administrator.
 */
public enum DeviceHealth {
    /** Last health check passed */
    GOOD,
    /** Never checked, or the last check was canceled / inconclusive */
    UNKNOWN,
    /** Device runs health checks back to back; results do not change health */
    LOOPING,
    /** Last health check failed */
    BAD,
    /** Taken out of service by an administrator */
    MAINTENANCE,
    /** Permanently removed from service */
    RETIRED;

    /** Whether a device in this health may be reserved for a job at all. */
    public boolean isReservable() {
        return this != BAD && this != MAINTENANCE && this != RETIRED;
    }
}
