package io.trading.marketsync.protocol.model;

/**
 * In-band error reported by the server, e.g. {@code RATE_LIMITED} or {@code INVALID_METHOD}.
 */
public record ServerErrorData(
    String code,
    String message,
    String orderbookId
) {
}
