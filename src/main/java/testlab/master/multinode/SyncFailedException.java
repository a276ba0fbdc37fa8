package testlab.master.multinode;

/**
 * Raised inside a device pipeline when a MultiNode call did not return OK.
 */
public class SyncFailedException extends RuntimeException {

    private final SyncStatus status;

    public SyncFailedException(String operation, SyncStatus status) {
        super(operation + " failed: " + status);
        this.status = status;
    }

    public SyncStatus status() {
        return status;
    }
}
