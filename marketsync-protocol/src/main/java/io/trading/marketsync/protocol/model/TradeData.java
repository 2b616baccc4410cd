package io.trading.marketsync.protocol.model;

import java.math.BigDecimal;

/**
 * Trade execution from the {@code trades} channel.
 */
public record TradeData(
    String orderbookId,
    BigDecimal price,
    BigDecimal size,
    Side side,
    String timestamp,
    String tradeId,
    long sequence
) {
}
