package io.trading.marketsync.protocol.model;

/**
 * Lifecycle events of a market.
 */
public enum MarketEventType {
    ORDERBOOK_CREATED,
    SETTLED,
    OPENED,
    PAUSED,
    UNKNOWN;

    public static MarketEventType fromString(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value) {
            case "orderbook_created" -> ORDERBOOK_CREATED;
            case "settled" -> SETTLED;
            case "opened" -> OPENED;
            case "paused" -> PAUSED;
            default -> UNKNOWN;
        };
    }
}
