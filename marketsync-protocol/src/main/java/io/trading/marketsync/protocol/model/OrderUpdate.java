package io.trading.marketsync.protocol.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Order placement or fill carried by a user {@code order} event.
 *
 * @param status  Server supplied status, may be null
 * @param balance Outcome balances after the event, may be null
 */
public record OrderUpdate(
    String orderHash,
    BigDecimal price,
    BigDecimal fillAmount,
    BigDecimal remaining,
    BigDecimal filled,
    Side side,
    boolean maker,
    long createdAt,
    String status,
    List<OutcomeBalance> balance
) {
}
