package io.trading.marketsync.protocol.model;

/**
 * Order or trade side.
 */
public enum Side {
    BUY,
    SELL,
    UNKNOWN;

    public static Side fromString(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.toLowerCase()) {
            case "buy", "bid", "b", "0" -> BUY;
            case "sell", "ask", "s", "1" -> SELL;
            default -> UNKNOWN;
        };
    }

    /**
     * Numeric encoding used by user order payloads: 0 = buy, anything else = sell.
     */
    public static Side fromCode(int code) {
        return code == 0 ? BUY : SELL;
    }
}
