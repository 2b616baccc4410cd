package io.trading.marketsync.protocol.api;

/**
 * Channels a client can subscribe to, with their outbound {@code params.type} tag.
 */
public enum SubscriptionType {
    BOOK_UPDATE("book_update"),
    TRADES("trades"),
    USER("user"),
    PRICE_HISTORY("price_history"),
    MARKET("market"),
    TICKER("ticker");

    private final String tag;

    SubscriptionType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
