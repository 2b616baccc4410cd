package io.trading.marketsync.router;

import io.trading.marketsync.error.ErrorKind;
import io.trading.marketsync.event.EventType;
import io.trading.marketsync.event.SyncEvent;
import io.trading.marketsync.metrics.SyncMetrics;
import io.trading.marketsync.protocol.api.Resolution;
import io.trading.marketsync.protocol.api.Subscription;
import io.trading.marketsync.protocol.model.AuthStatus;
import io.trading.marketsync.protocol.model.UserEventType;
import io.trading.marketsync.state.OrderBookState;
import io.trading.marketsync.state.StateStores;
import io.trading.marketsync.subscription.SubscriptionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MessageRouter.
 */
class MessageRouterTest {

    private static final String SNAPSHOT = """
        {"type":"book_update","data":{"orderbook_id":"ob-1","timestamp":"t0","seq":0,"is_snapshot":true,
         "bids":[{"price":"0.50","size":"0.0010"},{"price":"0.49","size":"0.0020"}],
         "asks":[{"price":"0.51","size":"0.0005"}]}}
        """;

    private StateStores stores;
    private SubscriptionRegistry registry;
    private SyncMetrics metrics;
    private MessageRouter router;

    @BeforeEach
    void setUp() {
        stores = new StateStores();
        registry = new SubscriptionRegistry();
        metrics = new SyncMetrics();
        router = new MessageRouter(stores, registry, metrics);
    }

    private static String delta(long seq, String asks) {
        return "{\"type\":\"book_update\",\"data\":{\"orderbook_id\":\"ob-1\",\"seq\":" + seq
            + ",\"bids\":[],\"asks\":" + asks + "}}";
    }

    @Test
    void testSnapshotThenDelta() {
        List<SyncEvent> events = router.route(SNAPSHOT);
        assertEquals(List.of(new SyncEvent.BookUpdated("ob-1", true)), events);

        events = router.route(delta(1, "[{\"price\":\"0.51\",\"size\":\"0\"}]"));
        assertEquals(List.of(new SyncEvent.BookUpdated("ob-1", false)), events);

        OrderBookState book = stores.orderBook("ob-1").orElseThrow();
        assertTrue(book.bestAsk().isEmpty());
        assertEquals(2, book.expectedSequence());
        assertEquals(2.0, metrics.getFramesReceived("book_update"));
    }

    @Test
    void testSequenceGapClearsBook() {
        router.route(SNAPSHOT);

        List<SyncEvent> events = router.route(delta(5, "[]"));

        assertEquals(2, events.size());
        SyncEvent.ErrorRaised error = (SyncEvent.ErrorRaised) events.get(0);
        assertEquals(ErrorKind.SEQUENCE_GAP, error.error().kind());
        assertTrue(error.error().message().contains("expected 1"));
        assertEquals(new SyncEvent.ResyncRequired("ob-1"), events.get(1));

        OrderBookState book = stores.orderBook("ob-1").orElseThrow();
        assertTrue(book.isEmpty());
        assertFalse(book.hasSnapshot());
        assertEquals(1.0, metrics.getSequenceGaps("ob-1"));
    }

    @Test
    void testServerResyncClearsBook() {
        router.route(SNAPSHOT);

        List<SyncEvent> events = router.route(
            "{\"type\":\"book_update\",\"data\":{\"orderbook_id\":\"ob-1\",\"resync\":true,\"message\":\"stale\"}}");

        assertEquals(List.of(new SyncEvent.ResyncRequired("ob-1")), events);
        assertTrue(stores.orderBook("ob-1").orElseThrow().isEmpty());
    }

    @Test
    void testMalformedFrameBecomesParseError() {
        List<SyncEvent> events = router.route("{not json");

        assertEquals(1, events.size());
        assertEquals(EventType.ERROR, events.get(0).type());
        assertEquals(ErrorKind.PARSE_ERROR, ((SyncEvent.ErrorRaised) events.get(0)).error().kind());
        assertEquals(1.0, metrics.getParseErrors());
    }

    @Test
    void testInvalidPayloadBecomesParseError() {
        List<SyncEvent> events = router.route("{\"type\":\"book_update\",\"data\":{\"seq\":1}}");

        assertEquals(ErrorKind.PARSE_ERROR, ((SyncEvent.ErrorRaised) events.get(0)).error().kind());
    }

    @Test
    void testUnknownChannelIgnored() {
        assertTrue(router.route("{\"type\":\"funding\",\"data\":{}}").isEmpty());
    }

    @Test
    void testPong() {
        assertEquals(List.of(new SyncEvent.Pong()), router.route("{\"type\":\"pong\"}"));
    }

    @Test
    void testServerError() {
        List<SyncEvent> events = router.route(
            "{\"type\":\"error\",\"data\":{\"error\":\"Orderbook not found\",\"code\":\"NOT_FOUND\"}}");

        SyncEvent.ErrorRaised error = (SyncEvent.ErrorRaised) events.get(0);
        assertEquals(ErrorKind.SERVER_ERROR, error.error().kind());
        assertEquals("NOT_FOUND", error.error().code());
        assertEquals("Orderbook not found", error.error().message());
    }

    @Test
    void testUserEventsRequireSubscription() {
        String nonce = "{\"type\":\"user\",\"data\":{\"event_type\":\"nonce\",\"user_pubkey\":\"wallet-1\",\"new_nonce\":9}}";
        assertTrue(router.route(nonce).isEmpty());

        Subscription.User user = new Subscription.User("wallet-1");
        registry.add(user);
        stores.prepare(user);

        List<SyncEvent> events = router.route(nonce);
        assertEquals(List.of(
            new SyncEvent.UserUpdated(UserEventType.NONCE, "wallet-1"),
            new SyncEvent.NonceUpdated("wallet-1", 9)
        ), events);
        assertEquals(9, stores.userState("wallet-1").orElseThrow().nonce());
    }

    @Test
    void testUserSnapshot() {
        Subscription.User user = new Subscription.User("wallet-1");
        registry.add(user);
        stores.prepare(user);

        List<SyncEvent> events = router.route("""
            {"type":"user","data":{"event_type":"snapshot","orders":[
              {"order_hash":"h1","market_pubkey":"m1","orderbook_id":"ob-1","side":0,
               "maker_amount":"10","taker_amount":"5","remaining":"10","filled":"0","price":"0.5"}],
             "balances":{"ob-1":{"market_pubkey":"m1","deposit_mint":"d","outcomes":[
               {"outcome_index":0,"mint":"x","idle":"100","on_book":"5"}]}},
             "nonce":3}}
            """);

        assertEquals(List.of(new SyncEvent.UserUpdated(UserEventType.SNAPSHOT, "wallet-1")), events);
        assertEquals(1, stores.userState("wallet-1").orElseThrow().orderCount());
        assertEquals(0, new BigDecimal("100").compareTo(
            stores.userState("wallet-1").orElseThrow().idleBalance("ob-1", 0).orElseThrow()));
    }

    @Test
    void testPriceHistoryFlow() {
        String update = "{\"type\":\"price_history\",\"data\":{\"event_type\":\"update\",\"orderbook_id\":\"ob-1\","
            + "\"resolution\":\"1m\",\"t\":180,\"m\":\"0.45\"}}";
        assertTrue(router.route(update).isEmpty());

        List<SyncEvent> events = router.route("{\"type\":\"price_history\",\"data\":{\"event_type\":\"snapshot\","
            + "\"orderbook_id\":\"ob-1\",\"resolution\":\"1m\",\"prices\":[{\"t\":60,\"m\":\"0.4\"},{\"t\":120,\"m\":\"0.41\"}]}}");
        assertEquals(List.of(new SyncEvent.PriceUpdated("ob-1", Resolution.ONE_MINUTE)), events);

        assertEquals(1, router.route(update).size());
        assertTrue(router.route("{\"type\":\"price_history\",\"data\":{\"event_type\":\"heartbeat\",\"server_time\":500}}").isEmpty());

        var history = stores.priceHistory("ob-1", Resolution.ONE_MINUTE).orElseThrow();
        assertEquals(3, history.candleCount());
        assertEquals(500L, history.serverTime().orElseThrow());
    }

    @Test
    void testTradeTickerMarketAndAuth() {
        assertEquals(EventType.TRADE, router.route("{\"type\":\"trades\",\"data\":{\"orderbook_id\":\"ob-1\","
            + "\"price\":\"0.5\",\"size\":\"1\",\"side\":\"buy\",\"trade_id\":\"t1\",\"sequence\":4}}").get(0).type());
        assertEquals(EventType.TICKER, router.route("{\"type\":\"ticker\",\"data\":{\"orderbook_id\":\"ob-1\","
            + "\"best_bid\":\"0.5\",\"best_ask\":\"0.51\",\"mid\":\"0.505\"}}").get(0).type());
        assertEquals(EventType.MARKET, router.route("{\"type\":\"market\",\"data\":{\"event_type\":\"settled\","
            + "\"market_pubkey\":\"m1\"}}").get(0).type());

        SyncEvent auth = router.route("{\"type\":\"auth\",\"data\":{\"status\":\"authenticated\",\"wallet\":\"w\"}}").get(0);
        assertEquals(AuthStatus.AUTHENTICATED, ((SyncEvent.AuthUpdated) auth).auth().status());
    }
}
