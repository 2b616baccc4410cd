package io.trading.marketsync.event;

public enum EventType {
    CONNECTED,
    DISCONNECTED,
    RECONNECTING,
    BOOK_UPDATED,
    TRADE,
    USER_UPDATED,
    NONCE_UPDATED,
    PRICE_UPDATED,
    MARKET,
    TICKER,
    AUTH,
    RESYNC_REQUIRED,
    PONG,
    ERROR
}
