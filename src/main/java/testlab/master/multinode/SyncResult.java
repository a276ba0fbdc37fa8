package testlab.master.multinode;

import java.util.Objects;

/**
 * Result of a barrier wait or a receive. Carries a value only when {@link #status()} is OK.
 */
public final class SyncResult<T> {

    private final SyncStatus status;
    private final T value;

    private SyncResult(SyncStatus status, T value) {
        this.status = Objects.requireNonNull(status);
        this.value = value;
    }

    public static <T> SyncResult<T> ok(T value) {
        return new SyncResult<>(SyncStatus.OK, value);
    }

    public static <T> SyncResult<T> failed(SyncStatus status) {
        if (status == SyncStatus.OK) {
            throw new IllegalArgumentException("failed result needs a non-OK status");
        }
        return new SyncResult<>(status, null);
    }

    public static <T> SyncResult<T> timeout() {
        return failed(SyncStatus.TIMEOUT);
    }

    public static <T> SyncResult<T> peerFailed() {
        return failed(SyncStatus.PEER_FAILED);
    }

    public static <T> SyncResult<T> canceled() {
        return failed(SyncStatus.CANCELED);
    }

    public SyncStatus status() {
        return status;
    }

    public boolean isOk() {
        return status == SyncStatus.OK;
    }

    /**
     * @throws IllegalStateException if the result is not OK
     */
    public T value() {
        if (!isOk()) {
            throw new IllegalStateException("no value for status " + status);
        }
        return value;
    }

    /**
     * The value, or a {@link SyncFailedException} carrying the status.
     */
    public T orElseThrow(String operation) {
        if (!isOk()) {
            throw new SyncFailedException(operation, status);
        }
        return value;
    }

    @Override
    public String toString() {
        return isOk() ? "SyncResult{OK, " + value + "}" : "SyncResult{" + status + "}";
    }
}
