package io.trading.marketsync.state;

import io.trading.marketsync.protocol.model.BalanceEntry;
import io.trading.marketsync.protocol.model.OrderData;
import io.trading.marketsync.protocol.model.OrderUpdate;
import io.trading.marketsync.protocol.model.OutcomeBalance;
import io.trading.marketsync.protocol.model.UserEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Local mirror of one user's open orders, balances and nonce.
 *
 * Amount checks use {@link BigDecimal#compareTo}, so {@code "0"}, {@code "0.000"} and
 * {@code "0E-6"} are all treated as zero.
 *
 * Not thread-safe, access is guarded by {@link StateStores}.
 */
public class UserState {

    private static final Logger LOGGER = LoggerFactory.getLogger(UserState.class);

    private final String user;
    private final Map<String, OrderSnapshot> orders = new LinkedHashMap<>();
    private final Map<String, BalanceEntry> balances = new LinkedHashMap<>();
    private long nonce;
    private boolean hasSnapshot;
    private String lastTimestamp;

    public UserState(String user) {
        this.user = user;
    }

    private UserState(UserState other) {
        this.user = other.user;
        this.orders.putAll(other.orders);
        this.balances.putAll(other.balances);
        this.nonce = other.nonce;
        this.hasSnapshot = other.hasSnapshot;
        this.lastTimestamp = other.lastTimestamp;
    }

    public void apply(UserEvent event) {
        if (event instanceof UserEvent.Snapshot snapshot) {
            applySnapshot(snapshot);
        } else if (event instanceof UserEvent.OrderEvent orderEvent) {
            applyOrderEvent(orderEvent);
        } else if (event instanceof UserEvent.BalanceUpdate balanceUpdate) {
            applyBalanceUpdate(balanceUpdate);
        } else if (event instanceof UserEvent.NonceUpdate nonceUpdate) {
            nonce = nonceUpdate.newNonce();
            touch(nonceUpdate.timestamp());
        } else {
            throw new IllegalArgumentException("Unsupported user event: " + event);
        }
    }

    private void applySnapshot(UserEvent.Snapshot snapshot) {
        orders.clear();
        for (OrderData order : snapshot.orders()) {
            if (isZero(order.remaining())) {
                continue;
            }
            orders.put(order.orderHash(), new OrderSnapshot(
                order.orderHash(),
                order.marketPubkey(),
                order.orderbookId(),
                order.side(),
                order.makerAmount(),
                order.takerAmount(),
                order.remaining(),
                order.filled(),
                order.price(),
                statusFor(order.filled(), null),
                order.createdAt(),
                order.expiration()
            ));
        }

        balances.clear();
        balances.putAll(snapshot.balances());

        if (snapshot.nonce() != null) {
            nonce = snapshot.nonce();
        }
        hasSnapshot = true;
        touch(snapshot.timestamp());
    }

    private void applyOrderEvent(UserEvent.OrderEvent event) {
        OrderUpdate update = event.order();
        String hash = update.orderHash();

        if (isZero(update.remaining())) {
            if (orders.remove(hash) != null) {
                LOGGER.debug("Order {} for {} closed", hash, user);
            }
        } else {
            OrderStatus status = statusFor(update.filled(), update.status());
            OrderSnapshot existing = orders.get(hash);
            if (existing != null) {
                orders.put(hash, existing.withFill(update.remaining(), update.filled(), status));
            } else {
                // First sighting of a placement looks like any other update
                orders.put(hash, new OrderSnapshot(
                    hash,
                    event.marketPubkey(),
                    event.orderbookId(),
                    update.side(),
                    update.remaining().add(update.filled()),
                    BigDecimal.ZERO,
                    update.remaining(),
                    update.filled(),
                    update.price(),
                    status,
                    update.createdAt(),
                    0
                ));
            }
        }

        if (update.balance() != null && event.orderbookId() != null) {
            balances.put(event.orderbookId(),
                new BalanceEntry(event.marketPubkey(), event.depositMint(), update.balance()));
        }
        touch(event.timestamp());
    }

    private void applyBalanceUpdate(UserEvent.BalanceUpdate update) {
        balances.put(update.orderbookId(), update.balance());
        touch(update.timestamp());
    }

    private void touch(String timestamp) {
        if (timestamp != null) {
            lastTimestamp = timestamp;
        }
    }

    private static OrderStatus statusFor(BigDecimal filled, String reported) {
        OrderStatus status = OrderStatus.fromString(reported);
        if (status == OrderStatus.OPEN || status == OrderStatus.PARTIALLY_FILLED) {
            return status;
        }
        return filled != null && filled.compareTo(BigDecimal.ZERO) > 0
            ? OrderStatus.PARTIALLY_FILLED
            : OrderStatus.OPEN;
    }

    private static boolean isZero(BigDecimal amount) {
        return amount.compareTo(BigDecimal.ZERO) == 0;
    }

    public void clear() {
        orders.clear();
        balances.clear();
        nonce = 0;
        hasSnapshot = false;
        lastTimestamp = null;
    }

    public Optional<OrderSnapshot> order(String orderHash) {
        return Optional.ofNullable(orders.get(orderHash));
    }

    public List<OrderSnapshot> openOrders() {
        return List.copyOf(orders.values());
    }

    public List<OrderSnapshot> ordersForMarket(String marketPubkey) {
        List<OrderSnapshot> result = new ArrayList<>();
        for (OrderSnapshot order : orders.values()) {
            if (marketPubkey.equals(order.marketPubkey())) {
                result.add(order);
            }
        }
        return result;
    }

    public List<OrderSnapshot> ordersForOrderbook(String orderbookId) {
        List<OrderSnapshot> result = new ArrayList<>();
        for (OrderSnapshot order : orders.values()) {
            if (orderbookId.equals(order.orderbookId())) {
                result.add(order);
            }
        }
        return result;
    }

    public Optional<BalanceEntry> balance(String orderbookId) {
        return Optional.ofNullable(balances.get(orderbookId));
    }

    public Map<String, BalanceEntry> balances() {
        return Collections.unmodifiableMap(balances);
    }

    public Optional<BigDecimal> idleBalance(String orderbookId, int outcomeIndex) {
        return outcome(orderbookId, outcomeIndex).map(OutcomeBalance::idle);
    }

    public Optional<BigDecimal> onBookBalance(String orderbookId, int outcomeIndex) {
        return outcome(orderbookId, outcomeIndex).map(OutcomeBalance::onBook);
    }

    private Optional<OutcomeBalance> outcome(String orderbookId, int outcomeIndex) {
        BalanceEntry entry = balances.get(orderbookId);
        if (entry == null) {
            return Optional.empty();
        }
        for (OutcomeBalance outcome : entry.outcomes()) {
            if (outcome.outcomeIndex() == outcomeIndex) {
                return Optional.of(outcome);
            }
        }
        return Optional.empty();
    }

    public int orderCount() {
        return orders.size();
    }

    public String user() {
        return user;
    }

    public long nonce() {
        return nonce;
    }

    public boolean hasSnapshot() {
        return hasSnapshot;
    }

    public String lastTimestamp() {
        return lastTimestamp;
    }

    public boolean isEmpty() {
        return orders.isEmpty() && balances.isEmpty();
    }

    public UserState copy() {
        return new UserState(this);
    }
}
