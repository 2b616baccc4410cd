package io.trading.marketsync.subscription;

import io.trading.marketsync.protocol.api.Subscription;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Active subscriptions of a client, replayed after every reconnect.
 *
 * Orderbook ids are tracked per channel so that {@link #all()} can batch them into a single
 * subscription per channel. At most one user channel is tracked: one connection serves one
 * authenticated user.
 *
 * Thread-safe.
 */
public class SubscriptionRegistry {

    private final Set<String> bookIds = new LinkedHashSet<>();
    private final Set<String> tradeIds = new LinkedHashSet<>();
    private final Set<String> tickerIds = new LinkedHashSet<>();
    private final Set<Subscription.PriceHistory> priceHistories = new LinkedHashSet<>();
    private final Set<String> markets = new LinkedHashSet<>();
    private String user;

    /**
     * Records a subscription.
     *
     * @return the part of the subscription that was not active before this call, empty when
     *         everything it names was already registered. Removing it undoes this call.
     * @throws IllegalStateException if a different user channel is already active
     */
    public synchronized Optional<Subscription> add(Subscription subscription) {
        if (subscription instanceof Subscription.Books books) {
            List<String> added = addIds(bookIds, books.orderbookIds());
            return added.isEmpty() ? Optional.empty() : Optional.of(new Subscription.Books(added));
        } else if (subscription instanceof Subscription.Trades trades) {
            List<String> added = addIds(tradeIds, trades.orderbookIds());
            return added.isEmpty() ? Optional.empty() : Optional.of(new Subscription.Trades(added));
        } else if (subscription instanceof Subscription.Ticker ticker) {
            List<String> added = addIds(tickerIds, ticker.orderbookIds());
            return added.isEmpty() ? Optional.empty() : Optional.of(new Subscription.Ticker(added));
        } else if (subscription instanceof Subscription.User newUser) {
            if (user != null && !user.equals(newUser.wallet())) {
                throw new IllegalStateException(
                    "User channel already active for " + user + ", unsubscribe it before subscribing " + newUser.wallet());
            }
            if (newUser.wallet().equals(user)) {
                return Optional.empty();
            }
            user = newUser.wallet();
            return Optional.of(newUser);
        } else if (subscription instanceof Subscription.PriceHistory history) {
            boolean existed = priceHistories.removeIf(h -> sameHistory(h, history));
            priceHistories.add(history);
            return existed ? Optional.empty() : Optional.of(history);
        } else if (subscription instanceof Subscription.Market market) {
            return markets.add(market.marketPubkey()) ? Optional.of(market) : Optional.empty();
        } else {
            throw new IllegalArgumentException("Unsupported subscription: " + subscription);
        }
    }

    private static List<String> addIds(Set<String> target, List<String> ids) {
        List<String> added = new ArrayList<>();
        for (String id : ids) {
            if (target.add(id)) {
                added.add(id);
            }
        }
        return added;
    }

    public synchronized void remove(Subscription subscription) {
        if (subscription instanceof Subscription.Books books) {
            books.orderbookIds().forEach(bookIds::remove);
        } else if (subscription instanceof Subscription.Trades trades) {
            trades.orderbookIds().forEach(tradeIds::remove);
        } else if (subscription instanceof Subscription.Ticker ticker) {
            ticker.orderbookIds().forEach(tickerIds::remove);
        } else if (subscription instanceof Subscription.User oldUser) {
            if (oldUser.wallet().equals(user)) {
                user = null;
            }
        } else if (subscription instanceof Subscription.PriceHistory history) {
            priceHistories.removeIf(h -> sameHistory(h, history));
        } else if (subscription instanceof Subscription.Market market) {
            markets.remove(market.marketPubkey());
        }
    }

    // include_ohlcv is a delivery option, not part of the identity
    private static boolean sameHistory(Subscription.PriceHistory a, Subscription.PriceHistory b) {
        return a.orderbookId().equals(b.orderbookId()) && a.resolution() == b.resolution();
    }

    /**
     * Every active subscription, with orderbook ids batched per channel.
     */
    public synchronized List<Subscription> all() {
        List<Subscription> result = new ArrayList<>();
        if (!bookIds.isEmpty()) {
            result.add(new Subscription.Books(List.copyOf(bookIds)));
        }
        if (!tradeIds.isEmpty()) {
            result.add(new Subscription.Trades(List.copyOf(tradeIds)));
        }
        if (user != null) {
            result.add(new Subscription.User(user));
        }
        result.addAll(priceHistories);
        for (String market : markets) {
            result.add(new Subscription.Market(market));
        }
        if (!tickerIds.isEmpty()) {
            result.add(new Subscription.Ticker(List.copyOf(tickerIds)));
        }
        return result;
    }

    public synchronized boolean isBookSubscribed(String orderbookId) {
        return bookIds.contains(orderbookId);
    }

    public synchronized Optional<String> subscribedUser() {
        return Optional.ofNullable(user);
    }

    /**
     * Number of logical subscriptions, counting each orderbook id separately.
     */
    public synchronized int size() {
        return bookIds.size() + tradeIds.size() + tickerIds.size()
            + priceHistories.size() + markets.size() + (user == null ? 0 : 1);
    }

    public synchronized boolean isEmpty() {
        return size() == 0;
    }

    public synchronized void clear() {
        bookIds.clear();
        tradeIds.clear();
        tickerIds.clear();
        priceHistories.clear();
        markets.clear();
        user = null;
    }
}
