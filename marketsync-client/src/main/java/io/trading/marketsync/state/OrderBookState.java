package io.trading.marketsync.state;

import io.trading.marketsync.protocol.model.BookUpdate;
import io.trading.marketsync.protocol.model.PriceLevel;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Local mirror of one order book, rebuilt from a snapshot and kept current with in-sequence deltas.
 *
 * Invariants: a level with zero size is never stored, and {@code expectedSequence} is always
 * the sequence number of the last accepted update plus one. Everything else (best prices,
 * spread, depth) is derived on demand.
 *
 * Not thread-safe, access is guarded by {@link StateStores}.
 */
public class OrderBookState {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final String orderbookId;
    private final TreeMap<BigDecimal, BigDecimal> bids = new TreeMap<>(Comparator.reverseOrder());
    private final TreeMap<BigDecimal, BigDecimal> asks = new TreeMap<>();
    private long expectedSequence;
    private boolean hasSnapshot;
    private String lastTimestamp;

    public OrderBookState(String orderbookId) {
        this.orderbookId = orderbookId;
    }

    private OrderBookState(OrderBookState other) {
        this.orderbookId = other.orderbookId;
        this.bids.putAll(other.bids);
        this.asks.putAll(other.asks);
        this.expectedSequence = other.expectedSequence;
        this.hasSnapshot = other.hasSnapshot;
        this.lastTimestamp = other.lastTimestamp;
    }

    /**
     * Applies a snapshot or a delta.
     *
     * @return the gap if the update is a delta whose sequence is not the expected one;
     *         the book is left untouched in that case
     */
    public Optional<SequenceGap> apply(BookUpdate update) {
        if (update.snapshot()) {
            applySnapshot(update);
            return Optional.empty();
        }
        return applyDelta(update);
    }

    private void applySnapshot(BookUpdate update) {
        bids.clear();
        asks.clear();
        for (PriceLevel level : update.bids()) {
            if (!level.isEmpty()) {
                bids.put(level.price(), level.size());
            }
        }
        for (PriceLevel level : update.asks()) {
            if (!level.isEmpty()) {
                asks.put(level.price(), level.size());
            }
        }
        expectedSequence = update.seq() + 1;
        hasSnapshot = true;
        lastTimestamp = update.timestamp();
    }

    private Optional<SequenceGap> applyDelta(BookUpdate update) {
        if (update.seq() != expectedSequence) {
            return Optional.of(new SequenceGap(expectedSequence, update.seq()));
        }
        for (PriceLevel level : update.bids()) {
            applyLevel(bids, level);
        }
        for (PriceLevel level : update.asks()) {
            applyLevel(asks, level);
        }
        expectedSequence = update.seq() + 1;
        lastTimestamp = update.timestamp();
        return Optional.empty();
    }

    private static void applyLevel(Map<BigDecimal, BigDecimal> side, PriceLevel level) {
        if (level.isEmpty()) {
            side.remove(level.price());
        } else {
            side.put(level.price(), level.size());
        }
    }

    /**
     * Discards all levels. The next update must be a snapshot to rebuild the book.
     */
    public void clear() {
        bids.clear();
        asks.clear();
        expectedSequence = 0;
        hasSnapshot = false;
        lastTimestamp = null;
    }

    public Optional<PriceLevel> bestBid() {
        return first(bids);
    }

    public Optional<PriceLevel> bestAsk() {
        return first(asks);
    }

    private static Optional<PriceLevel> first(NavigableMap<BigDecimal, BigDecimal> side) {
        Map.Entry<BigDecimal, BigDecimal> entry = side.firstEntry();
        return entry == null ? Optional.empty() : Optional.of(new PriceLevel(entry.getKey(), entry.getValue()));
    }

    /**
     * Best ask minus best bid, empty if either side is empty.
     */
    public Optional<BigDecimal> spread() {
        if (bids.isEmpty() || asks.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(asks.firstKey().subtract(bids.firstKey()));
    }

    public Optional<BigDecimal> midpoint() {
        if (bids.isEmpty() || asks.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(asks.firstKey().add(bids.firstKey()).divide(TWO));
    }

    public BigDecimal totalBidDepth() {
        return sum(bids);
    }

    public BigDecimal totalAskDepth() {
        return sum(asks);
    }

    private static BigDecimal sum(Map<BigDecimal, BigDecimal> side) {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal size : side.values()) {
            total = total.add(size);
        }
        return total;
    }

    public List<PriceLevel> topBids(int n) {
        return top(bids, n);
    }

    public List<PriceLevel> topAsks(int n) {
        return top(asks, n);
    }

    private static List<PriceLevel> top(Map<BigDecimal, BigDecimal> side, int n) {
        List<PriceLevel> levels = new ArrayList<>(Math.min(n, side.size()));
        for (Map.Entry<BigDecimal, BigDecimal> entry : side.entrySet()) {
            if (levels.size() >= n) {
                break;
            }
            levels.add(new PriceLevel(entry.getKey(), entry.getValue()));
        }
        return levels;
    }

    /**
     * Bids, highest price first.
     */
    public NavigableMap<BigDecimal, BigDecimal> bids() {
        return Collections.unmodifiableNavigableMap(bids);
    }

    /**
     * Asks, lowest price first.
     */
    public NavigableMap<BigDecimal, BigDecimal> asks() {
        return Collections.unmodifiableNavigableMap(asks);
    }

    public int bidCount() {
        return bids.size();
    }

    public int askCount() {
        return asks.size();
    }

    public String orderbookId() {
        return orderbookId;
    }

    public long expectedSequence() {
        return expectedSequence;
    }

    public boolean hasSnapshot() {
        return hasSnapshot;
    }

    public String lastTimestamp() {
        return lastTimestamp;
    }

    public boolean isEmpty() {
        return bids.isEmpty() && asks.isEmpty();
    }

    /**
     * Returns a detached copy, safe to hand out to other threads.
     */
    public OrderBookState copy() {
        return new OrderBookState(this);
    }

    @Override
    public String toString() {
        return "OrderBookState{id=" + orderbookId
            + ", bids=" + bids.size()
            + ", asks=" + asks.size()
            + ", expectedSequence=" + expectedSequence
            + ", hasSnapshot=" + hasSnapshot + '}';
    }
}
