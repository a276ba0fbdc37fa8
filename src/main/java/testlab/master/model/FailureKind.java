package testlab.master.model;

/**
 * Why a job ended without completing. Recorded on the job for its owner.
 */
public enum FailureKind {
    /** A MultiNode peer went incomplete */
    PEER_FAILED,
    /** No signal within the caller's bound */
    TIMEOUT,
    /** Gateway unreachable, device lost, pipeline crashed */
    INFRASTRUCTURE,
    /** Canceled by owner or master */
    CANCELED
}
