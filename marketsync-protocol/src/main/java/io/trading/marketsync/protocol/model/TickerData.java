package io.trading.marketsync.protocol.model;

import java.math.BigDecimal;

/**
 * Top of book summary. Any price may be null when that side of the book is empty.
 */
public record TickerData(
    String orderbookId,
    BigDecimal bestBid,
    BigDecimal bestAsk,
    BigDecimal mid,
    String timestamp
) {
}
