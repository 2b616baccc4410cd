package io.trading.marketsync.error;

/**
 * Every failure this client reports, either as an error event or as a thrown {@link SyncException}.
 */
public enum ErrorKind {
    // Surfaced on the event channel
    SEQUENCE_GAP,
    RESYNC_REQUIRED,
    CONNECTION_CLOSED,
    CONNECTION_FAILED,
    RATE_LIMITED,
    PARSE_ERROR,
    SERVER_ERROR,
    PING_TIMEOUT,

    // Returned to the caller
    SUBSCRIPTION_FAILED,
    NOT_CONNECTED,
    ALREADY_CONNECTED,
    CHANNEL_CLOSED,
    SEND_FAILED,
    TIMEOUT,
    INVALID_URL,
    INVALID_AUTH_TOKEN
}
