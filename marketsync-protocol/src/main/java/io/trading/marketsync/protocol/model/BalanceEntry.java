package io.trading.marketsync.protocol.model;

import java.util.List;

/**
 * Per-outcome balances of a user within one market.
 */
public record BalanceEntry(
    String marketPubkey,
    String depositMint,
    List<OutcomeBalance> outcomes
) {
    public BalanceEntry {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }
}
