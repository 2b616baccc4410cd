package io.trading.marketsync.protocol.api;

import java.util.Optional;

/**
 * Candle resolution for price history channels.
 */
public enum Resolution {
    ONE_MINUTE("1m"),
    FIVE_MINUTES("5m"),
    FIFTEEN_MINUTES("15m"),
    ONE_HOUR("1h"),
    FOUR_HOURS("4h"),
    ONE_DAY("1d");

    private final String tag;

    Resolution(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<Resolution> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return switch (tag) {
            case "1m" -> Optional.of(ONE_MINUTE);
            case "5m" -> Optional.of(FIVE_MINUTES);
            case "15m" -> Optional.of(FIFTEEN_MINUTES);
            case "1h" -> Optional.of(ONE_HOUR);
            case "4h" -> Optional.of(FOUR_HOURS);
            case "1d" -> Optional.of(ONE_DAY);
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return tag;
    }
}
