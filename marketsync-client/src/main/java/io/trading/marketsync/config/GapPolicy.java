package io.trading.marketsync.config;

/**
 * What the client does after discarding an order book because of a sequence gap.
 */
public enum GapPolicy {

    /** Surface ResyncRequired and leave recovery to the application. */
    NOTIFY,

    /** Surface ResyncRequired and re-subscribe the book so the server sends a fresh snapshot. */
    RESUBSCRIBE;

    public static GapPolicy fromString(String value) {
        if (value == null || value.isBlank()) {
            return NOTIFY;
        }
        return switch (value.trim().toLowerCase()) {
            case "resubscribe" -> RESUBSCRIBE;
            case "notify" -> NOTIFY;
            default -> throw new IllegalArgumentException("Unknown gap policy: " + value);
        };
    }
}
