package io.trading.marketsync.protocol.model;

import java.util.Optional;

/**
 * The {@code event_type} values of the user channel.
 */
public enum UserEventType {
    SNAPSHOT,
    ORDER,
    BALANCE_UPDATE,
    NONCE;

    public static Optional<UserEventType> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value) {
            case "snapshot" -> Optional.of(SNAPSHOT);
            case "order", "order_update" -> Optional.of(ORDER);
            case "balance_update" -> Optional.of(BALANCE_UPDATE);
            case "nonce" -> Optional.of(NONCE);
            default -> Optional.empty();
        };
    }
}
