package io.trading.marketsync.transport;

/**
 * An open WebSocket session.
 */
public interface TransportSession {

    /**
     * Queues a text frame for sending.
     *
     * @throws IllegalStateException if the session is already closed
     */
    void send(String text);

    /**
     * Sends a close frame with the given code and reason, then closes the connection.
     * Closing an already closed session is a no-op.
     */
    void close(int code, String reason);

    boolean isOpen();
}
