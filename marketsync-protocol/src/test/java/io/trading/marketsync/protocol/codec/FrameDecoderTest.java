package io.trading.marketsync.protocol.codec;

import io.trading.marketsync.protocol.api.Channel;
import io.trading.marketsync.protocol.api.Resolution;
import io.trading.marketsync.protocol.model.AuthData;
import io.trading.marketsync.protocol.model.AuthStatus;
import io.trading.marketsync.protocol.model.BookUpdate;
import io.trading.marketsync.protocol.model.MarketEventData;
import io.trading.marketsync.protocol.model.MarketEventType;
import io.trading.marketsync.protocol.model.PriceHistoryEvent;
import io.trading.marketsync.protocol.model.ServerErrorData;
import io.trading.marketsync.protocol.model.Side;
import io.trading.marketsync.protocol.model.TickerData;
import io.trading.marketsync.protocol.model.TradeData;
import io.trading.marketsync.protocol.model.UserEvent;
import io.trading.marketsync.protocol.model.UserEventType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FrameDecoder.
 */
class FrameDecoderTest {

    private final FrameDecoder decoder = new FrameDecoder();

    @Test
    void testDecodeEnvelopeKnownChannel() {
        Envelope envelope = decoder.decodeEnvelope("{\"type\":\"pong\",\"data\":{}}");

        assertEquals("pong", envelope.type());
        assertEquals(Channel.PONG, envelope.channel().orElseThrow());
    }

    @Test
    void testDecodeEnvelopeUnknownChannel() {
        Envelope envelope = decoder.decodeEnvelope("{\"type\":\"funding_rate\",\"data\":{}}");

        assertEquals("funding_rate", envelope.type());
        assertTrue(envelope.channel().isEmpty());
    }

    @Test
    void testDecodeEnvelopeRejectsInvalidJson() {
        assertThrows(FrameParseException.class, () -> decoder.decodeEnvelope("not json"));
        assertThrows(FrameParseException.class, () -> decoder.decodeEnvelope("[1,2,3]"));
        assertThrows(FrameParseException.class, () -> decoder.decodeEnvelope("{\"data\":{}}"));
    }

    @Test
    void testParseBookSnapshot() {
        String message = """
            {
                "type": "book_update",
                "data": {
                    "orderbook_id": "ob1",
                    "timestamp": "2024-01-01T00:00:00.000Z",
                    "seq": 0,
                    "bids": [{"side": "bid", "price": "0.500000", "size": "0.001000"}],
                    "asks": [{"side": "ask", "price": "0.510000", "size": "0.000500"}],
                    "is_snapshot": true
                }
            }
            """;

        Envelope envelope = decoder.decodeEnvelope(message);
        BookUpdate update = decoder.parseBookUpdate(envelope.data());

        assertEquals("ob1", update.orderbookId());
        assertEquals(0L, update.seq());
        assertTrue(update.snapshot());
        assertFalse(update.resync());
        assertEquals(1, update.bids().size());
        assertEquals(new BigDecimal("0.500000"), update.bids().get(0).price());
        assertEquals(new BigDecimal("0.001000"), update.bids().get(0).size());
        assertEquals(new BigDecimal("0.510000"), update.asks().get(0).price());
    }

    @Test
    void testParseBookDeltaWithNumericValuesAndSequenceAlias() {
        String message = """
            {"type":"book_update","data":{"orderbook_id":"ob1","sequence":7,
             "bids":[{"price":0.5,"size":0}],"asks":[]}}
            """;

        BookUpdate update = decoder.parseBookUpdate(decoder.decodeEnvelope(message).data());

        assertEquals(7L, update.seq());
        assertFalse(update.snapshot());
        assertEquals(0, new BigDecimal("0.5").compareTo(update.bids().get(0).price()));
        assertTrue(update.bids().get(0).isEmpty());
        assertTrue(update.asks().isEmpty());
    }

    @Test
    void testParseBookResync() {
        String message = """
            {"type":"book_update","data":{"orderbook_id":"ob1","resync":true,"message":"book rebuilt"}}
            """;

        BookUpdate update = decoder.parseBookUpdate(decoder.decodeEnvelope(message).data());

        assertTrue(update.resync());
        assertEquals("book rebuilt", update.message());
    }

    @Test
    void testParseBookRejectsMissingId() {
        String message = "{\"type\":\"book_update\",\"data\":{\"seq\":1}}";

        assertThrows(FrameParseException.class,
            () -> decoder.parseBookUpdate(decoder.decodeEnvelope(message).data()));
    }

    @Test
    void testParseBookRejectsMalformedLevel() {
        String message = "{\"type\":\"book_update\",\"data\":{\"orderbook_id\":\"ob1\",\"bids\":[{\"price\":\"abc\",\"size\":\"1\"}]}}";

        assertThrows(FrameParseException.class,
            () -> decoder.parseBookUpdate(decoder.decodeEnvelope(message).data()));
    }

    @Test
    void testParseTrade() {
        String message = """
            {"type":"trades","data":{"orderbook_id":"ob1","price":"0.505","size":"0.25",
             "side":"buy","timestamp":"1704067200000","trade_id":"t-1","sequence":42}}
            """;

        TradeData trade = decoder.parseTrade(decoder.decodeEnvelope(message).data());

        assertEquals("ob1", trade.orderbookId());
        assertEquals(new BigDecimal("0.505"), trade.price());
        assertEquals(Side.BUY, trade.side());
        assertEquals("t-1", trade.tradeId());
        assertEquals(42L, trade.sequence());
    }

    @Test
    void testParseUserSnapshot() {
        String message = """
            {
                "type": "user",
                "data": {
                    "event_type": "snapshot",
                    "orders": [{
                        "order_hash": "h1",
                        "market_pubkey": "m1",
                        "orderbook_id": "ob1",
                        "side": 0,
                        "maker_amount": "10",
                        "taker_amount": "5",
                        "remaining": "8",
                        "filled": "2",
                        "price": "0.5",
                        "created_at": 1704067200000,
                        "expiration": 0
                    }],
                    "balances": {
                        "ob1": {
                            "market_pubkey": "m1",
                            "deposit_mint": "usdc",
                            "outcomes": [{"outcome_index": 0, "mint": "yes", "idle": "3", "on_book": "1"}]
                        }
                    },
                    "nonce": 4
                }
            }
            """;

        UserEvent event = decoder.parseUserEvent(decoder.decodeEnvelope(message).data());

        assertEquals(UserEventType.SNAPSHOT, event.type());
        UserEvent.Snapshot snapshot = (UserEvent.Snapshot) event;
        assertEquals(1, snapshot.orders().size());
        assertEquals(Side.BUY, snapshot.orders().get(0).side());
        assertEquals(new BigDecimal("8"), snapshot.orders().get(0).remaining());
        assertEquals(new BigDecimal("3"), snapshot.balances().get("ob1").outcomes().get(0).idle());
        assertEquals(4L, snapshot.nonce());
    }

    @Test
    void testParseUserOrderEvent() {
        String message = """
            {"type":"user","data":{"event_type":"order","market_pubkey":"m1","orderbook_id":"ob1",
             "order":{"order_hash":"h1","price":"0.5","fill_amount":"1","remaining":"0","filled":"10",
                      "side":1,"is_maker":true,"created_at":1,
                      "balance":{"outcomes":[{"outcome_index":1,"mint":"no","idle":"2","on_book":"0"}]}}}}
            """;

        UserEvent.OrderEvent event = (UserEvent.OrderEvent) decoder.parseUserEvent(decoder.decodeEnvelope(message).data());

        assertEquals("h1", event.order().orderHash());
        assertEquals(Side.SELL, event.order().side());
        assertTrue(event.order().maker());
        assertEquals(0, event.order().remaining().signum());
        assertEquals(1, event.order().balance().size());
        assertEquals("ob1", event.orderbookId());
    }

    @Test
    void testParseUserNonce() {
        String message = """
            {"type":"user","data":{"event_type":"nonce","user_pubkey":"wallet1","new_nonce":5}}
            """;

        UserEvent.NonceUpdate event = (UserEvent.NonceUpdate) decoder.parseUserEvent(decoder.decodeEnvelope(message).data());

        assertEquals("wallet1", event.userPubkey());
        assertEquals(5L, event.newNonce());
    }

    @Test
    void testParseUserRejectsUnknownEventType() {
        String message = "{\"type\":\"user\",\"data\":{\"event_type\":\"margin_call\"}}";

        assertThrows(FrameParseException.class,
            () -> decoder.parseUserEvent(decoder.decodeEnvelope(message).data()));
    }

    @Test
    void testParsePriceHistorySnapshot() {
        String message = """
            {"type":"price_history","data":{"event_type":"snapshot","orderbook_id":"ob1","resolution":"5m",
             "include_ohlcv":true,"prices":[{"t":1000,"m":"0.50"},{"t":2000,"m":"0.51","o":"0.5","c":"0.52"}],
             "last_timestamp":2000,"server_time":2500}}
            """;

        PriceHistoryEvent.Snapshot snapshot =
            (PriceHistoryEvent.Snapshot) decoder.parsePriceHistory(decoder.decodeEnvelope(message).data());

        assertEquals(Resolution.FIVE_MINUTES, snapshot.resolution());
        assertEquals(Boolean.TRUE, snapshot.includeOhlcv());
        assertEquals(2, snapshot.prices().size());
        assertEquals(1000L, snapshot.prices().get(0).t());
        assertNull(snapshot.prices().get(0).o());
        assertEquals(new BigDecimal("0.52"), snapshot.prices().get(1).c());
        assertEquals(2500L, snapshot.serverTime());
    }

    @Test
    void testParsePriceHistoryUpdateDefaultsResolution() {
        String message = """
            {"type":"price_history","data":{"event_type":"update","orderbook_id":"ob1","t":3000,"m":"0.53","bb":"0.52","ba":"0.54"}}
            """;

        PriceHistoryEvent.Update update =
            (PriceHistoryEvent.Update) decoder.parsePriceHistory(decoder.decodeEnvelope(message).data());

        assertEquals(Resolution.ONE_MINUTE, update.resolution());
        assertEquals(3000L, update.candle().t());
        assertEquals(new BigDecimal("0.54"), update.candle().ba());
    }

    @Test
    void testParsePriceHistoryHeartbeat() {
        String message = "{\"type\":\"price_history\",\"data\":{\"event_type\":\"heartbeat\",\"server_time\":99}}";

        PriceHistoryEvent event = decoder.parsePriceHistory(decoder.decodeEnvelope(message).data());

        assertEquals(new PriceHistoryEvent.Heartbeat(99L), event);
    }

    @Test
    void testParsePriceHistoryRejectsUnknownResolution() {
        String message = "{\"type\":\"price_history\",\"data\":{\"event_type\":\"update\",\"orderbook_id\":\"ob1\",\"resolution\":\"2m\",\"t\":1}}";

        assertThrows(FrameParseException.class,
            () -> decoder.parsePriceHistory(decoder.decodeEnvelope(message).data()));
    }

    @Test
    void testParseMarketEvent() {
        String message = "{\"type\":\"market\",\"data\":{\"event_type\":\"settled\",\"market_pubkey\":\"m1\",\"timestamp\":\"t\"}}";

        MarketEventData event = decoder.parseMarketEvent(decoder.decodeEnvelope(message).data());

        assertEquals(MarketEventType.SETTLED, event.eventType());
        assertEquals("m1", event.marketPubkey());
        assertNull(event.orderbookId());
    }

    @Test
    void testParseServerError() {
        String message = "{\"type\":\"error\",\"data\":{\"error\":\"Too many requests\",\"code\":\"RATE_LIMITED\"}}";

        ServerErrorData error = decoder.parseServerError(decoder.decodeEnvelope(message).data());

        assertEquals("RATE_LIMITED", error.code());
        assertEquals("Too many requests", error.message());
    }

    @Test
    void testParseTickerWithEmptySide() {
        String message = "{\"type\":\"ticker\",\"data\":{\"orderbook_id\":\"ob1\",\"best_bid\":\"0.50\",\"best_ask\":null,\"mid\":null}}";

        TickerData ticker = decoder.parseTicker(decoder.decodeEnvelope(message).data());

        assertEquals(new BigDecimal("0.50"), ticker.bestBid());
        assertNull(ticker.bestAsk());
        assertNull(ticker.mid());
    }

    @Test
    void testParseAuth() {
        String message = "{\"type\":\"auth\",\"data\":{\"status\":\"authenticated\",\"wallet\":\"wallet1\"}}";

        AuthData auth = decoder.parseAuth(decoder.decodeEnvelope(message).data());

        assertEquals(AuthStatus.AUTHENTICATED, auth.status());
        assertEquals("wallet1", auth.wallet());
    }
}
