package io.trading.marketsync.protocol.model;

public record MarketEventData(
    MarketEventType eventType,
    String marketPubkey,
    String orderbookId,
    String timestamp
) {
}
