package io.trading.marketsync.state;

import io.trading.marketsync.protocol.api.Resolution;
import io.trading.marketsync.protocol.api.Subscription;
import io.trading.marketsync.protocol.model.BookUpdate;
import io.trading.marketsync.protocol.model.Candle;
import io.trading.marketsync.protocol.model.PriceHistoryEvent;
import io.trading.marketsync.protocol.model.PriceLevel;
import io.trading.marketsync.protocol.model.UserEvent;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StateStores.
 */
class StateStoresTest {

    private final StateStores stores = new StateStores();

    @Test
    void testReadersReceiveCopies() {
        stores.applyBook(BookUpdate.snapshot("ob-1", 0, List.of(PriceLevel.of("0.5", "1")), List.of()));

        OrderBookState copy = stores.orderBook("ob-1").orElseThrow();
        stores.applyBook(BookUpdate.delta("ob-1", 1, List.of(PriceLevel.of("0.5", "0")), List.of()));

        assertEquals(1, copy.bidCount());
        assertEquals(0, stores.orderBook("ob-1").orElseThrow().bidCount());
    }

    @Test
    void testUserEventWithoutPreparedStateIsRejected() {
        assertFalse(stores.applyUser("wallet-1", new UserEvent.NonceUpdate("wallet-1", 3, null)));

        stores.prepare(new Subscription.User("wallet-1"));

        assertTrue(stores.applyUser("wallet-1", new UserEvent.NonceUpdate("wallet-1", 3, null)));
        assertEquals(3, stores.userState("wallet-1").orElseThrow().nonce());
    }

    @Test
    void testPriceUpdateRequiresKnownHistory() {
        Candle candle = Candle.ofMidpoint(60, new BigDecimal("0.5"));
        assertFalse(stores.applyPriceUpdate(new PriceHistoryEvent.Update("ob-1", Resolution.ONE_MINUTE, candle)));

        stores.prepare(new Subscription.PriceHistory("ob-1", Resolution.ONE_MINUTE, true));

        assertTrue(stores.applyPriceUpdate(new PriceHistoryEvent.Update("ob-1", Resolution.ONE_MINUTE, candle)));
        assertEquals(1, stores.priceHistory("ob-1", Resolution.ONE_MINUTE).orElseThrow().candleCount());
        assertTrue(stores.priceHistory("ob-1", Resolution.FIVE_MINUTES).isEmpty());
    }

    @Test
    void testPrepareCreatesEmptyEntries() {
        stores.prepare(new Subscription.Books(List.of("ob-1", "ob-2")));

        assertEquals(2, stores.orderBookIds().size());
        assertTrue(stores.isEmpty());
        assertFalse(stores.orderBook("ob-1").orElseThrow().hasSnapshot());
    }

    @Test
    void testClearAllDropsEverything() {
        stores.applyBook(BookUpdate.snapshot("ob-1", 0, List.of(PriceLevel.of("0.5", "1")), List.of()));
        stores.prepare(new Subscription.User("wallet-1"));
        assertFalse(stores.isEmpty());

        stores.clearAll();

        assertTrue(stores.isEmpty());
        assertTrue(stores.orderBook("ob-1").isEmpty());
        assertFalse(stores.hasUser("wallet-1"));
    }

    @Test
    void testClearBookKeepsEntry() {
        stores.applyBook(BookUpdate.snapshot("ob-1", 4, List.of(PriceLevel.of("0.5", "1")), List.of()));

        stores.clearBook("ob-1");

        OrderBookState book = stores.orderBook("ob-1").orElseThrow();
        assertTrue(book.isEmpty());
        assertEquals(0, book.expectedSequence());
    }
}
