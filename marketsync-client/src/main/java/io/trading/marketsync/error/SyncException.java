package io.trading.marketsync.error;

/**
 * Usage or connection error returned synchronously to the caller.
 */
public class SyncException extends RuntimeException {

    private final SyncError error;

    public SyncException(SyncError error) {
        super(error.message());
        this.error = error;
    }

    public SyncException(SyncError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public SyncException(ErrorKind kind, String message) {
        this(SyncError.of(kind, message));
    }

    public SyncError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.kind();
    }
}
