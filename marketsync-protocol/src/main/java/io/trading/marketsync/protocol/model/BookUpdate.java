package io.trading.marketsync.protocol.model;

import java.util.List;

/**
 * Order book snapshot or delta from the {@code book_update} channel.
 *
 * @param orderbookId Orderbook identifier
 * @param timestamp   Server timestamp, as sent
 * @param seq         Per-orderbook sequence number
 * @param bids        Bid levels
 * @param asks        Ask levels
 * @param snapshot    Whether this replaces the whole book
 * @param resync      Server asks the client to discard its book
 * @param message     Optional server message accompanying a resync
 */
public record BookUpdate(
    String orderbookId,
    String timestamp,
    long seq,
    List<PriceLevel> bids,
    List<PriceLevel> asks,
    boolean snapshot,
    boolean resync,
    String message
) {
    public BookUpdate {
        if (orderbookId == null || orderbookId.isEmpty()) {
            throw new IllegalArgumentException("orderbookId cannot be null or empty");
        }
        bids = bids == null ? List.of() : List.copyOf(bids);
        asks = asks == null ? List.of() : List.copyOf(asks);
    }

    public static BookUpdate snapshot(String orderbookId, long seq, List<PriceLevel> bids, List<PriceLevel> asks) {
        return new BookUpdate(orderbookId, "", seq, bids, asks, true, false, null);
    }

    public static BookUpdate delta(String orderbookId, long seq, List<PriceLevel> bids, List<PriceLevel> asks) {
        return new BookUpdate(orderbookId, "", seq, bids, asks, false, false, null);
    }
}
