package io.trading.marketsync.protocol.model;

import java.math.BigDecimal;

/**
 * Balance of one outcome token.
 *
 * @param outcomeIndex Outcome index within the market
 * @param mint         Conditional token mint
 * @param idle         Amount available to trade
 * @param onBook       Amount locked in resting orders
 */
public record OutcomeBalance(
    int outcomeIndex,
    String mint,
    BigDecimal idle,
    BigDecimal onBook
) {
}
