package io.trading.marketsync.protocol.model;

/**
 * Result of the connection authentication, sent once after the upgrade.
 */
public record AuthData(
    AuthStatus status,
    String wallet,
    String message
) {
}
