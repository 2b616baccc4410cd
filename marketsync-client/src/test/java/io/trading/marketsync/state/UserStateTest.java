package io.trading.marketsync.state;

import io.trading.marketsync.protocol.model.BalanceEntry;
import io.trading.marketsync.protocol.model.OrderData;
import io.trading.marketsync.protocol.model.OrderUpdate;
import io.trading.marketsync.protocol.model.OutcomeBalance;
import io.trading.marketsync.protocol.model.Side;
import io.trading.marketsync.protocol.model.UserEvent;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for UserState.
 */
class UserStateTest {

    private static final String WALLET = "wallet-1";
    private static final String MARKET = "market-1";
    private static final String BOOK = "ob-1";

    private static BigDecimal dec(String value) {
        return new BigDecimal(value);
    }

    private static OrderData order(String hash, String remaining, String filled) {
        return new OrderData(hash, MARKET, BOOK, Side.BUY, dec("10"), dec("5"),
            dec(remaining), dec(filled), dec("0.5"), 1000L, 0L);
    }

    private static OrderUpdate update(String hash, String remaining, String filled, List<OutcomeBalance> balance) {
        return new OrderUpdate(hash, dec("0.5"), dec("1"), dec(remaining), dec(filled), Side.BUY,
            true, 1000L, null, balance);
    }

    private static BalanceEntry balance(String idle, String onBook) {
        return new BalanceEntry(MARKET, "mint", List.of(new OutcomeBalance(0, "mint-0", dec(idle), dec(onBook))));
    }

    private static UserState seeded() {
        UserState state = new UserState(WALLET);
        state.apply(new UserEvent.Snapshot(
            List.of(order("h1", "10", "0"), order("h2", "4", "6"), order("h3", "0", "10")),
            Map.of(BOOK, balance("100", "5")),
            7L,
            "t0"));
        return state;
    }

    @Test
    void testSnapshotSkipsFilledOrders() {
        UserState state = seeded();

        assertTrue(state.hasSnapshot());
        assertEquals(2, state.orderCount());
        assertTrue(state.order("h3").isEmpty());
        assertEquals(OrderStatus.OPEN, state.order("h1").orElseThrow().status());
        assertEquals(OrderStatus.PARTIALLY_FILLED, state.order("h2").orElseThrow().status());
        assertEquals(7, state.nonce());
        assertEquals(0, dec("100").compareTo(state.idleBalance(BOOK, 0).orElseThrow()));
        assertEquals(0, dec("5").compareTo(state.onBookBalance(BOOK, 0).orElseThrow()));
    }

    @Test
    void testSnapshotReplacesOrdersAndBalances() {
        UserState state = seeded();

        state.apply(new UserEvent.Snapshot(List.of(order("h9", "1", "0")), Map.of(), null, "t1"));

        assertEquals(1, state.orderCount());
        assertTrue(state.order("h1").isEmpty());
        assertTrue(state.balances().isEmpty());
        assertEquals(7, state.nonce());
    }

    @Test
    void testOrderUpdateFillsExistingOrder() {
        UserState state = seeded();

        state.apply(new UserEvent.OrderEvent(update("h1", "6", "4", null), MARKET, BOOK, "mint", "t1"));

        OrderSnapshot order = state.order("h1").orElseThrow();
        assertEquals(0, dec("6").compareTo(order.remaining()));
        assertEquals(0, dec("4").compareTo(order.filled()));
        assertEquals(0, dec("10").compareTo(order.makerAmount()));
        assertEquals(OrderStatus.PARTIALLY_FILLED, order.status());
        assertEquals("t1", state.lastTimestamp());
    }

    @Test
    void testOrderUpdateWithZeroRemainingRemovesOrder() {
        UserState state = seeded();

        state.apply(new UserEvent.OrderEvent(update("h2", "0.000", "10", null), MARKET, BOOK, "mint", "t1"));

        assertTrue(state.order("h2").isEmpty());
        assertEquals(1, state.orderCount());
    }

    @Test
    void testOrderUpdateForUnknownOrderInsertsIt() {
        UserState state = seeded();

        state.apply(new UserEvent.OrderEvent(update("h5", "3", "0", null), MARKET, BOOK, "mint", "t1"));

        OrderSnapshot order = state.order("h5").orElseThrow();
        assertEquals(0, dec("3").compareTo(order.makerAmount()));
        assertEquals(OrderStatus.OPEN, order.status());
        assertEquals(1, state.ordersForOrderbook(BOOK).stream().filter(o -> o.orderHash().equals("h5")).count());
        assertEquals(3, state.ordersForMarket(MARKET).size());
    }

    @Test
    void testOrderUpdateCarriesBalance() {
        UserState state = seeded();

        state.apply(new UserEvent.OrderEvent(
            update("h1", "6", "4", List.of(new OutcomeBalance(0, "mint-0", dec("90"), dec("15")))),
            MARKET, BOOK, "mint", "t1"));

        assertEquals(0, dec("90").compareTo(state.idleBalance(BOOK, 0).orElseThrow()));
        assertEquals(0, dec("15").compareTo(state.onBookBalance(BOOK, 0).orElseThrow()));
    }

    @Test
    void testBalanceUpdateReplacesEntry() {
        UserState state = seeded();

        state.apply(new UserEvent.BalanceUpdate("ob-2", balance("1", "2"), "t2"));

        assertEquals(2, state.balances().size());
        assertEquals(0, dec("1").compareTo(state.idleBalance("ob-2", 0).orElseThrow()));
        assertTrue(state.idleBalance("ob-2", 1).isEmpty());
    }

    @Test
    void testNonceUpdate() {
        UserState state = seeded();

        state.apply(new UserEvent.NonceUpdate(WALLET, 42, "t3"));

        assertEquals(42, state.nonce());
    }

    @Test
    void testClear() {
        UserState state = seeded();

        state.clear();

        assertTrue(state.isEmpty());
        assertFalse(state.hasSnapshot());
        assertEquals(0, state.nonce());
    }
}
