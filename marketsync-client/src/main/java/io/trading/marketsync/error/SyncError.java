package io.trading.marketsync.error;

/**
 * A reported failure.
 *
 * @param kind    Failure category
 * @param code    Server error code or close code, null when not applicable
 * @param message Human readable description
 */
public record SyncError(
    ErrorKind kind,
    String code,
    String message
) {
    public SyncError {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null) {
            message = "";
        }
    }

    public static SyncError of(ErrorKind kind, String message) {
        return new SyncError(kind, null, message);
    }

    public static SyncError sequenceGap(String orderbookId, long expected, long received) {
        return new SyncError(ErrorKind.SEQUENCE_GAP, null,
            "Sequence gap on " + orderbookId + ": expected " + expected + ", received " + received);
    }

    public static SyncError connectionClosed(int code, String reason) {
        return new SyncError(ErrorKind.CONNECTION_CLOSED, String.valueOf(code),
            "Connection closed: code " + code + ", reason: " + reason);
    }

    public static SyncError rateLimited() {
        return of(ErrorKind.RATE_LIMITED, "Rate limited by server");
    }

    public static SyncError pingTimeout() {
        return of(ErrorKind.PING_TIMEOUT, "No pong received within timeout");
    }

    public static SyncError serverError(String code, String message) {
        return new SyncError(ErrorKind.SERVER_ERROR, code, message);
    }

    public static SyncError parseError(String message) {
        return of(ErrorKind.PARSE_ERROR, message);
    }

    public static SyncError notConnected() {
        return of(ErrorKind.NOT_CONNECTED, "Not connected");
    }
}
