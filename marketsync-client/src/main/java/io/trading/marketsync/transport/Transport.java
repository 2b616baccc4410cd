package io.trading.marketsync.transport;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Opens WebSocket sessions. The production implementation is backed by Netty; tests
 * substitute an in-memory transport.
 */
public interface Transport extends AutoCloseable {

    /**
     * Opens a session to the given ws/wss endpoint. The returned future completes once the
     * WebSocket handshake has finished, or exceptionally when the connection or handshake fails.
     *
     * @param uri      the endpoint
     * @param headers  extra handshake headers, e.g. the auth cookie
     * @param listener receives frames and lifecycle callbacks for this session only
     */
    CompletableFuture<TransportSession> open(URI uri, Map<String, String> headers, TransportListener listener);

    @Override
    void close();
}
