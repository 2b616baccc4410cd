package io.trading.marketsync.protocol.model;

import java.math.BigDecimal;

/**
 * Open order as listed in a user snapshot.
 */
public record OrderData(
    String orderHash,
    String marketPubkey,
    String orderbookId,
    Side side,
    BigDecimal makerAmount,
    BigDecimal takerAmount,
    BigDecimal remaining,
    BigDecimal filled,
    BigDecimal price,
    long createdAt,
    long expiration
) {
}
