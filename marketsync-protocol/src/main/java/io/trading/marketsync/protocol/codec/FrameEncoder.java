package io.trading.marketsync.protocol.codec;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import io.trading.marketsync.protocol.api.Subscription;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Builds outbound control frames:
 * {@code {"type":"subscribe","params":{"type":"book_update","orderbook_ids":["ob1"]}}}.
 */
public class FrameEncoder {

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    private static final String PING_FRAME = "{\"type\":\"ping\"}";

    public String subscribe(Subscription subscription) {
        return encode("subscribe", subscription);
    }

    public String unsubscribe(Subscription subscription) {
        return encode("unsubscribe", subscription);
    }

    public String ping() {
        return PING_FRAME;
    }

    private String encode(String action, Subscription subscription) {
        StringWriter writer = new StringWriter(128);
        try (JsonGenerator generator = JSON_FACTORY.createGenerator(writer)) {
            generator.writeStartObject();
            generator.writeStringField("type", action);
            generator.writeObjectFieldStart("params");
            generator.writeStringField("type", subscription.type().tag());
            writeParams(generator, subscription);
            generator.writeEndObject();
            generator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode " + action + " frame", e);
        }
        return writer.toString();
    }

    private void writeParams(JsonGenerator generator, Subscription subscription) throws IOException {
        if (subscription instanceof Subscription.Books books) {
            writeIds(generator, books.orderbookIds());
        } else if (subscription instanceof Subscription.Trades trades) {
            writeIds(generator, trades.orderbookIds());
        } else if (subscription instanceof Subscription.Ticker ticker) {
            writeIds(generator, ticker.orderbookIds());
        } else if (subscription instanceof Subscription.User user) {
            generator.writeStringField("wallet_address", user.wallet());
        } else if (subscription instanceof Subscription.PriceHistory history) {
            generator.writeStringField("orderbook_id", history.orderbookId());
            generator.writeStringField("resolution", history.resolution().tag());
            generator.writeBooleanField("include_ohlcv", history.includeOhlcv());
        } else if (subscription instanceof Subscription.Market market) {
            generator.writeStringField("market_pubkey", market.marketPubkey());
        } else {
            throw new IllegalArgumentException("Unsupported subscription: " + subscription);
        }
    }

    private static void writeIds(JsonGenerator generator, List<String> ids) throws IOException {
        generator.writeArrayFieldStart("orderbook_ids");
        for (String id : ids) {
            generator.writeString(id);
        }
        generator.writeEndArray();
    }
}
