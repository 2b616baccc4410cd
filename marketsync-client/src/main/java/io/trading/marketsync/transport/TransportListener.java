package io.trading.marketsync.transport;

/**
 * Callbacks for a single transport session. Invoked on the transport's I/O thread.
 */
public interface TransportListener {

    void onText(String text);

    /**
     * A WebSocket pong control frame was received.
     */
    void onPong();

    /**
     * The session ended. Called at most once, with the close code sent by the peer
     * or 1006 when the connection dropped without a close frame. Never called for a session
     * whose open failed; that is reported through the future returned by
     * {@link Transport#open} alone.
     */
    void onClose(int code, String reason);

    void onError(Throwable cause);
}
