package io.trading.marketsync.connection;

/**
 * Lifecycle state of a client connection. Written only by the {@link ConnectionManager}.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    DISCONNECTING
}
