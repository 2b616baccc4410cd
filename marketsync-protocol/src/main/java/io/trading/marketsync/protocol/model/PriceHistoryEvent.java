package io.trading.marketsync.protocol.model;

import io.trading.marketsync.protocol.api.Resolution;

import java.util.List;

/**
 * Payload of the {@code price_history} channel.
 */
public interface PriceHistoryEvent {

    /**
     * Candle history for one orderbook and resolution, oldest candle first.
     */
    record Snapshot(
        String orderbookId,
        Resolution resolution,
        Boolean includeOhlcv,
        List<Candle> prices,
        Long lastTimestamp,
        Long serverTime
    ) implements PriceHistoryEvent {
        public Snapshot {
            prices = prices == null ? List.of() : List.copyOf(prices);
        }
    }

    record Update(
        String orderbookId,
        Resolution resolution,
        Candle candle
    ) implements PriceHistoryEvent {
    }

    record Heartbeat(long serverTime) implements PriceHistoryEvent {
    }
}
