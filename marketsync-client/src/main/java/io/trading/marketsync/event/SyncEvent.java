package io.trading.marketsync.event;

import io.trading.marketsync.error.SyncError;
import io.trading.marketsync.protocol.api.Resolution;
import io.trading.marketsync.protocol.model.AuthData;
import io.trading.marketsync.protocol.model.MarketEventData;
import io.trading.marketsync.protocol.model.TickerData;
import io.trading.marketsync.protocol.model.TradeData;
import io.trading.marketsync.protocol.model.UserEventType;

/**
 * High-level events delivered to the application through the {@link EventChannel}.
 * State changes are announced, not carried: read the affected state through the client.
 */
public interface SyncEvent {

    EventType type();

    record Connected() implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.CONNECTED;
        }
    }

    /**
     * @param code   Close code, -1 when the connection ended without one
     * @param reason Close reason or a local description
     */
    record Disconnected(int code, String reason) implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.DISCONNECTED;
        }
    }

    record Reconnecting(int attempt) implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.RECONNECTING;
        }
    }

    record BookUpdated(String orderbookId, boolean snapshot) implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.BOOK_UPDATED;
        }
    }

    record TradeReceived(TradeData trade) implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.TRADE;
        }
    }

    record UserUpdated(UserEventType eventType, String user) implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.USER_UPDATED;
        }
    }

    record NonceUpdated(String user, long nonce) implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.NONCE_UPDATED;
        }
    }

    record PriceUpdated(String orderbookId, Resolution resolution) implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.PRICE_UPDATED;
        }
    }

    record MarketEvent(MarketEventData market) implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.MARKET;
        }
    }

    record TickerUpdated(TickerData ticker) implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.TICKER;
        }
    }

    record AuthUpdated(AuthData auth) implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.AUTH;
        }
    }

    /**
     * The local book was discarded and must be rebuilt from a fresh snapshot.
     */
    record ResyncRequired(String orderbookId) implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.RESYNC_REQUIRED;
        }
    }

    record Pong() implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.PONG;
        }
    }

    record ErrorRaised(SyncError error) implements SyncEvent {
        @Override
        public EventType type() {
            return EventType.ERROR;
        }
    }
}
