package io.trading.marketsync.bootstrap;

import io.trading.marketsync.protocol.model.BookUpdate;

import java.io.IOException;

/**
 * Request/response read used to seed an order book that the stream does not snapshot.
 */
@FunctionalInterface
public interface SnapshotSource {

    /**
     * Fetches the current depth of an order book.
     *
     * @return an update with {@code snapshot} set
     * @throws IOException when the request fails
     */
    BookUpdate fetchOrderBook(String orderbookId) throws IOException;
}
