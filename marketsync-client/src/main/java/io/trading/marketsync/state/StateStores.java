package io.trading.marketsync.state;

import io.trading.marketsync.protocol.api.Resolution;
import io.trading.marketsync.protocol.api.Subscription;
import io.trading.marketsync.protocol.model.BookUpdate;
import io.trading.marketsync.protocol.model.PriceHistoryEvent;
import io.trading.marketsync.protocol.model.UserEvent;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds every entity store of a client behind one read-write lock.
 *
 * Mutators are only called from the connection loop, one inbound message at a time, each
 * under the write lock. Readers on any thread take the read lock and get detached copies.
 */
public class StateStores {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, OrderBookState> orderBooks = new HashMap<>();
    private final Map<String, UserState> users = new HashMap<>();
    private final Map<PriceHistoryKey, PriceHistoryState> priceHistories = new HashMap<>();

    // Writers

    public Optional<SequenceGap> applyBook(BookUpdate update) {
        Lock write = lock.writeLock();
        write.lock();
        try {
            return orderBooks.computeIfAbsent(update.orderbookId(), OrderBookState::new).apply(update);
        } finally {
            write.unlock();
        }
    }

    public void clearBook(String orderbookId) {
        Lock write = lock.writeLock();
        write.lock();
        try {
            OrderBookState book = orderBooks.get(orderbookId);
            if (book != null) {
                book.clear();
            }
        } finally {
            write.unlock();
        }
    }

    /**
     * @return false if no state exists for the user, i.e. the user channel was never subscribed
     */
    public boolean applyUser(String user, UserEvent event) {
        Lock write = lock.writeLock();
        write.lock();
        try {
            UserState state = users.get(user);
            if (state == null) {
                return false;
            }
            state.apply(event);
            return true;
        } finally {
            write.unlock();
        }
    }

    public void applyPriceSnapshot(PriceHistoryEvent.Snapshot snapshot) {
        Lock write = lock.writeLock();
        write.lock();
        try {
            PriceHistoryKey key = new PriceHistoryKey(snapshot.orderbookId(), snapshot.resolution());
            priceHistories
                .computeIfAbsent(key, k -> new PriceHistoryState(
                    k.orderbookId(), k.resolution(), Boolean.TRUE.equals(snapshot.includeOhlcv())))
                .applySnapshot(snapshot.prices(), snapshot.includeOhlcv(), snapshot.lastTimestamp(), snapshot.serverTime());
        } finally {
            write.unlock();
        }
    }

    /**
     * @return false if there is no history for the update's key yet
     */
    public boolean applyPriceUpdate(PriceHistoryEvent.Update update) {
        Lock write = lock.writeLock();
        write.lock();
        try {
            PriceHistoryState state = priceHistories.get(new PriceHistoryKey(update.orderbookId(), update.resolution()));
            if (state == null) {
                return false;
            }
            state.applyUpdate(update.candle());
            return true;
        } finally {
            write.unlock();
        }
    }

    public void applyHeartbeat(long serverTime) {
        Lock write = lock.writeLock();
        write.lock();
        try {
            for (PriceHistoryState state : priceHistories.values()) {
                state.applyHeartbeat(serverTime);
            }
        } finally {
            write.unlock();
        }
    }

    /**
     * Creates empty entries for the entities a subscription covers, so that reads succeed
     * before the first snapshot arrives.
     */
    public void prepare(Subscription subscription) {
        Lock write = lock.writeLock();
        write.lock();
        try {
            if (subscription instanceof Subscription.Books books) {
                for (String id : books.orderbookIds()) {
                    orderBooks.computeIfAbsent(id, OrderBookState::new);
                }
            } else if (subscription instanceof Subscription.User user) {
                users.computeIfAbsent(user.wallet(), UserState::new);
            } else if (subscription instanceof Subscription.PriceHistory history) {
                priceHistories.computeIfAbsent(
                    new PriceHistoryKey(history.orderbookId(), history.resolution()),
                    k -> new PriceHistoryState(k.orderbookId(), k.resolution(), history.includeOhlcv()));
            }
        } finally {
            write.unlock();
        }
    }

    /**
     * Drops every entry of every store.
     */
    public void clearAll() {
        Lock write = lock.writeLock();
        write.lock();
        try {
            orderBooks.clear();
            users.clear();
            priceHistories.clear();
        } finally {
            write.unlock();
        }
    }

    // Readers

    public Optional<OrderBookState> orderBook(String orderbookId) {
        Lock read = lock.readLock();
        read.lock();
        try {
            OrderBookState book = orderBooks.get(orderbookId);
            return book == null ? Optional.empty() : Optional.of(book.copy());
        } finally {
            read.unlock();
        }
    }

    public Optional<UserState> userState(String user) {
        Lock read = lock.readLock();
        read.lock();
        try {
            UserState state = users.get(user);
            return state == null ? Optional.empty() : Optional.of(state.copy());
        } finally {
            read.unlock();
        }
    }

    public Optional<PriceHistoryState> priceHistory(String orderbookId, Resolution resolution) {
        Lock read = lock.readLock();
        read.lock();
        try {
            PriceHistoryState state = priceHistories.get(new PriceHistoryKey(orderbookId, resolution));
            return state == null ? Optional.empty() : Optional.of(state.copy());
        } finally {
            read.unlock();
        }
    }

    public Set<String> orderBookIds() {
        Lock read = lock.readLock();
        read.lock();
        try {
            return new TreeSet<>(orderBooks.keySet());
        } finally {
            read.unlock();
        }
    }

    public boolean hasUser(String user) {
        Lock read = lock.readLock();
        read.lock();
        try {
            return users.containsKey(user);
        } finally {
            read.unlock();
        }
    }

    /**
     * True when no store holds any level, order, balance or candle.
     */
    public boolean isEmpty() {
        Lock read = lock.readLock();
        read.lock();
        try {
            for (OrderBookState book : orderBooks.values()) {
                if (!book.isEmpty() || book.hasSnapshot()) {
                    return false;
                }
            }
            for (UserState user : users.values()) {
                if (!user.isEmpty() || user.hasSnapshot()) {
                    return false;
                }
            }
            for (PriceHistoryState history : priceHistories.values()) {
                if (history.candleCount() > 0 || history.hasSnapshot()) {
                    return false;
                }
            }
            return true;
        } finally {
            read.unlock();
        }
    }
}
