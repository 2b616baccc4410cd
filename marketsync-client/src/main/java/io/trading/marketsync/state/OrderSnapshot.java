package io.trading.marketsync.state;

import io.trading.marketsync.protocol.model.Side;

import java.math.BigDecimal;

/**
 * A user's open order as tracked locally.
 */
public record OrderSnapshot(
    String orderHash,
    String marketPubkey,
    String orderbookId,
    Side side,
    BigDecimal makerAmount,
    BigDecimal takerAmount,
    BigDecimal remaining,
    BigDecimal filled,
    BigDecimal price,
    OrderStatus status,
    long createdAt,
    long expiration
) {
    OrderSnapshot withFill(BigDecimal remaining, BigDecimal filled, OrderStatus status) {
        return new OrderSnapshot(
            orderHash,
            marketPubkey,
            orderbookId,
            side,
            makerAmount,
            takerAmount,
            remaining,
            filled,
            price,
            status,
            createdAt,
            expiration
        );
    }
}
