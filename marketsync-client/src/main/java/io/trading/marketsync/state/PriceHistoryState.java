package io.trading.marketsync.state;

import io.trading.marketsync.protocol.api.Resolution;
import io.trading.marketsync.protocol.model.Candle;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Candle history for one orderbook and resolution.
 *
 * Candles are kept newest first, so the latest candle is at index 0, with a timestamp
 * to position index alongside. At most {@value #MAX_CANDLES} candles are retained.
 *
 * Not thread-safe, access is guarded by {@link StateStores}.
 */
public class PriceHistoryState {

    public static final int MAX_CANDLES = 1000;

    private final String orderbookId;
    private final Resolution resolution;
    private final List<Candle> candles = new ArrayList<>();
    private final Map<Long, Integer> index = new HashMap<>();
    private boolean includeOhlcv;
    private Long lastTimestamp;
    private Long serverTime;
    private boolean hasSnapshot;

    public PriceHistoryState(String orderbookId, Resolution resolution, boolean includeOhlcv) {
        this.orderbookId = orderbookId;
        this.resolution = resolution;
        this.includeOhlcv = includeOhlcv;
    }

    private PriceHistoryState(PriceHistoryState other) {
        this.orderbookId = other.orderbookId;
        this.resolution = other.resolution;
        this.candles.addAll(other.candles);
        this.index.putAll(other.index);
        this.includeOhlcv = other.includeOhlcv;
        this.lastTimestamp = other.lastTimestamp;
        this.serverTime = other.serverTime;
        this.hasSnapshot = other.hasSnapshot;
    }

    /**
     * Replaces the history.
     *
     * @param oldestFirst candles in the order the server sends them
     */
    public void applySnapshot(List<Candle> oldestFirst, Boolean includeOhlcv, Long lastTimestamp, Long serverTime) {
        candles.clear();
        for (int i = oldestFirst.size() - 1; i >= 0 && candles.size() < MAX_CANDLES; i--) {
            candles.add(oldestFirst.get(i));
        }
        rebuildIndex(0);

        if (includeOhlcv != null) {
            this.includeOhlcv = includeOhlcv;
        }
        this.lastTimestamp = lastTimestamp != null ? lastTimestamp : newestTimestamp();
        if (serverTime != null) {
            this.serverTime = serverTime;
        }
        hasSnapshot = true;
    }

    /**
     * Inserts or replaces a single candle.
     */
    public void applyUpdate(Candle candle) {
        Integer existing = index.get(candle.t());
        if (existing != null) {
            candles.set(existing, candle);
        } else {
            int position = 0;
            while (position < candles.size() && candles.get(position).t() > candle.t()) {
                position++;
            }
            candles.add(position, candle);
            rebuildIndex(position);

            if (candles.size() > MAX_CANDLES) {
                Candle evicted = candles.remove(candles.size() - 1);
                index.remove(evicted.t());
            }
        }
        lastTimestamp = newestTimestamp();
    }

    public void applyHeartbeat(long serverTime) {
        this.serverTime = serverTime;
    }

    private void rebuildIndex(int from) {
        if (from == 0) {
            index.clear();
        }
        for (int i = from; i < candles.size(); i++) {
            index.put(candles.get(i).t(), i);
        }
    }

    private Long newestTimestamp() {
        return candles.isEmpty() ? null : candles.get(0).t();
    }

    public void clear() {
        candles.clear();
        index.clear();
        lastTimestamp = null;
        serverTime = null;
        hasSnapshot = false;
    }

    /**
     * All candles, newest first.
     */
    public List<Candle> candles() {
        return Collections.unmodifiableList(candles);
    }

    public List<Candle> recentCandles(int n) {
        return List.copyOf(candles.subList(0, Math.min(n, candles.size())));
    }

    public Optional<Candle> candle(long timestamp) {
        Integer position = index.get(timestamp);
        return position == null ? Optional.empty() : Optional.of(candles.get(position));
    }

    public Optional<Candle> latest() {
        return candles.isEmpty() ? Optional.empty() : Optional.of(candles.get(0));
    }

    public Optional<Candle> oldest() {
        return candles.isEmpty() ? Optional.empty() : Optional.of(candles.get(candles.size() - 1));
    }

    public Optional<BigDecimal> currentMidpoint() {
        return latest().map(Candle::m);
    }

    public Optional<BigDecimal> currentBestBid() {
        return latest().map(Candle::bb);
    }

    public Optional<BigDecimal> currentBestAsk() {
        return latest().map(Candle::ba);
    }

    public int candleCount() {
        return candles.size();
    }

    public String orderbookId() {
        return orderbookId;
    }

    public Resolution resolution() {
        return resolution;
    }

    public PriceHistoryKey key() {
        return new PriceHistoryKey(orderbookId, resolution);
    }

    public boolean includeOhlcv() {
        return includeOhlcv;
    }

    public Optional<Long> lastTimestamp() {
        return Optional.ofNullable(lastTimestamp);
    }

    public Optional<Long> serverTime() {
        return Optional.ofNullable(serverTime);
    }

    public boolean hasSnapshot() {
        return hasSnapshot;
    }

    public PriceHistoryState copy() {
        return new PriceHistoryState(this);
    }
}
