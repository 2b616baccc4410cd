package io.trading.marketsync.state;

/**
 * Status of a tracked order. Fully filled or cancelled orders are removed rather than kept.
 */
public enum OrderStatus {
    OPEN,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED;

    static OrderStatus fromString(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.toLowerCase()) {
            case "open", "placed", "new" -> OPEN;
            case "partially_filled", "partial", "partial_fill" -> PARTIALLY_FILLED;
            case "filled" -> FILLED;
            case "cancelled", "canceled" -> CANCELLED;
            default -> null;
        };
    }
}
