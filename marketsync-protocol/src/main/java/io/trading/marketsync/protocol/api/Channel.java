package io.trading.marketsync.protocol.api;

import java.util.Optional;

/**
 * Inbound channel tags carried in the {@code type} field of every server frame.
 */
public enum Channel {
    BOOK_UPDATE("book_update"),
    TRADES("trades"),
    USER("user"),
    PRICE_HISTORY("price_history"),
    MARKET("market"),
    ERROR("error"),
    PONG("pong"),
    TICKER("ticker"),
    AUTH("auth");

    private final String tag;

    Channel(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolves a wire tag. Unknown tags yield an empty result rather than an exception,
     * the stream may carry channels this client does not understand yet.
     */
    public static Optional<Channel> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        for (Channel channel : values()) {
            if (channel.tag.equals(tag)) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }
}
