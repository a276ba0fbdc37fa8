package testlab.master.model;

/**
 * Result of canceling a job.
 */
public enum CancelResult {
    CANCELED,

    /** Job already ended - idempotent success */
    ALREADY_TERMINAL,

    NOT_FOUND
}
