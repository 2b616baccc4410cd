package io.trading.marketsync.state;

import io.trading.marketsync.protocol.api.Resolution;

public record PriceHistoryKey(String orderbookId, Resolution resolution) {

    @Override
    public String toString() {
        return orderbookId + ":" + resolution.tag();
    }
}
