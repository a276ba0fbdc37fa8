package testlab.master.multinode;

/**
 * Outcome of a blocking MultiNode call.
 */
public enum SyncStatus {
    OK,
    /** The caller's timeout elapsed first */
    TIMEOUT,
    /** Another member of the group failed */
    PEER_FAILED,
    /** The group was torn down or its job canceled */
    CANCELED
}
