package io.trading.marketsync.protocol.api;

/**
 * WebSocket close codes with a meaning for this protocol.
 */
public final class CloseCodes {

    /** Graceful close, used for client initiated disconnects. */
    public static final int NORMAL = 1000;

    /** No close frame was received, the connection dropped. */
    public static final int ABNORMAL = 1006;

    /** Sent by the server when the client exceeded its rate limit. */
    public static final int RATE_LIMITED = 1008;

    private CloseCodes() {
    }
}
