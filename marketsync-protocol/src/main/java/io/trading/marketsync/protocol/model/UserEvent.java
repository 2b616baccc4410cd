package io.trading.marketsync.protocol.model;

import java.util.List;
import java.util.Map;

/**
 * Payload of the {@code user} channel.
 */
public interface UserEvent {

    UserEventType type();

    /**
     * Full replacement of a user's orders and balances.
     *
     * @param balances Balance entries keyed by orderbook id
     * @param nonce    Current nonce, null when the server omits it
     */
    record Snapshot(
        List<OrderData> orders,
        Map<String, BalanceEntry> balances,
        Long nonce,
        String timestamp
    ) implements UserEvent {
        public Snapshot {
            orders = orders == null ? List.of() : List.copyOf(orders);
            balances = balances == null ? Map.of() : Map.copyOf(balances);
        }

        @Override
        public UserEventType type() {
            return UserEventType.SNAPSHOT;
        }
    }

    record OrderEvent(
        OrderUpdate order,
        String marketPubkey,
        String orderbookId,
        String depositMint,
        String timestamp
    ) implements UserEvent {
        @Override
        public UserEventType type() {
            return UserEventType.ORDER;
        }
    }

    record BalanceUpdate(
        String orderbookId,
        BalanceEntry balance,
        String timestamp
    ) implements UserEvent {
        @Override
        public UserEventType type() {
            return UserEventType.BALANCE_UPDATE;
        }
    }

    record NonceUpdate(
        String userPubkey,
        long newNonce,
        String timestamp
    ) implements UserEvent {
        @Override
        public UserEventType type() {
            return UserEventType.NONCE;
        }
    }
}
