package testlab.master.model;

/**
 * Result of a dispatch gateway reporting a device outcome.
 */
public enum OutcomeResult {
    /** Outcome recorded */
    RECORDED,

    /** The device's part of the job had already ended - idempotent success */
    ALREADY_TERMINAL,

    /** Job not found */
    NOT_FOUND,

    /** The device is not part of this job */
    WRONG_DEVICE
}
