package io.trading.marketsync.protocol.api;

import java.util.List;
import java.util.Objects;

/**
 * A logical subscription. Each variant knows its channel and the parameters it is sent with.
 */
public interface Subscription {

    SubscriptionType type();

    /**
     * Order book deltas and snapshots for one or more orderbooks.
     */
    record Books(List<String> orderbookIds) implements Subscription {
        public Books {
            orderbookIds = requireIds(orderbookIds);
        }

        @Override
        public SubscriptionType type() {
            return SubscriptionType.BOOK_UPDATE;
        }
    }

    record Trades(List<String> orderbookIds) implements Subscription {
        public Trades {
            orderbookIds = requireIds(orderbookIds);
        }

        @Override
        public SubscriptionType type() {
            return SubscriptionType.TRADES;
        }
    }

    /**
     * Orders, balances and nonce of one wallet. Requires an authenticated connection.
     */
    record User(String wallet) implements Subscription {
        public User {
            wallet = requireText(wallet, "wallet");
        }

        @Override
        public SubscriptionType type() {
            return SubscriptionType.USER;
        }
    }

    record PriceHistory(String orderbookId, Resolution resolution, boolean includeOhlcv) implements Subscription {
        public PriceHistory {
            orderbookId = requireText(orderbookId, "orderbookId");
            Objects.requireNonNull(resolution, "resolution");
        }

        @Override
        public SubscriptionType type() {
            return SubscriptionType.PRICE_HISTORY;
        }
    }

    record Market(String marketPubkey) implements Subscription {
        public Market {
            marketPubkey = requireText(marketPubkey, "marketPubkey");
        }

        @Override
        public SubscriptionType type() {
            return SubscriptionType.MARKET;
        }
    }

    record Ticker(List<String> orderbookIds) implements Subscription {
        public Ticker {
            orderbookIds = requireIds(orderbookIds);
        }

        @Override
        public SubscriptionType type() {
            return SubscriptionType.TICKER;
        }
    }

    private static List<String> requireIds(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("orderbookIds cannot be null or empty");
        }
        for (String id : ids) {
            requireText(id, "orderbookId");
        }
        return List.copyOf(ids);
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or empty");
        }
        return value;
    }
}
