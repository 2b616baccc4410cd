package io.trading.marketsync.protocol.codec;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.marketsync.protocol.api.Resolution;
import io.trading.marketsync.protocol.model.AuthData;
import io.trading.marketsync.protocol.model.AuthStatus;
import io.trading.marketsync.protocol.model.BalanceEntry;
import io.trading.marketsync.protocol.model.BookUpdate;
import io.trading.marketsync.protocol.model.Candle;
import io.trading.marketsync.protocol.model.MarketEventData;
import io.trading.marketsync.protocol.model.MarketEventType;
import io.trading.marketsync.protocol.model.OrderData;
import io.trading.marketsync.protocol.model.OrderUpdate;
import io.trading.marketsync.protocol.model.OutcomeBalance;
import io.trading.marketsync.protocol.model.PriceHistoryEvent;
import io.trading.marketsync.protocol.model.PriceLevel;
import io.trading.marketsync.protocol.model.ServerErrorData;
import io.trading.marketsync.protocol.model.Side;
import io.trading.marketsync.protocol.model.TickerData;
import io.trading.marketsync.protocol.model.TradeData;
import io.trading.marketsync.protocol.model.UserEvent;
import io.trading.marketsync.protocol.model.UserEventType;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes inbound frames into typed payloads.
 *
 * The envelope and most payloads go through Jackson's tree model. Order book level arrays,
 * the bulk of the traffic, are walked token by token with a streaming {@link JsonParser}.
 * Decimal values are accepted both as JSON strings and as JSON numbers and are never routed
 * through {@code double}.
 *
 * Thread-safe and reusable.
 */
public class FrameDecoder {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private static final String DEFAULT_RESOLUTION = "1m";

    private static final String FIELD_TYPE = "type";
    private static final String FIELD_DATA = "data";
    private static final String FIELD_ORDERBOOK_ID = "orderbook_id";
    private static final String FIELD_TIMESTAMP = "timestamp";
    private static final String FIELD_SEQ = "seq";
    private static final String FIELD_SEQUENCE = "sequence";
    private static final String FIELD_BIDS = "bids";
    private static final String FIELD_ASKS = "asks";
    private static final String FIELD_PRICE = "price";
    private static final String FIELD_SIZE = "size";
    private static final String FIELD_SIDE = "side";
    private static final String FIELD_EVENT_TYPE = "event_type";
    private static final String FIELD_MARKET_PUBKEY = "market_pubkey";
    private static final String FIELD_DEPOSIT_MINT = "deposit_mint";
    private static final String FIELD_OUTCOMES = "outcomes";

    /**
     * Reads the outer envelope of a frame.
     *
     * @throws FrameParseException if the text is not a JSON object with a string {@code type}
     */
    public Envelope decodeEnvelope(String text) {
        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new FrameParseException("Invalid JSON frame: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new FrameParseException("Frame is not a JSON object");
        }
        JsonNode type = root.get(FIELD_TYPE);
        if (type == null || !type.isTextual()) {
            throw new FrameParseException("Frame has no type tag");
        }
        return new Envelope(type.asText(), root.path(FIELD_DATA));
    }

    public BookUpdate parseBookUpdate(JsonNode data) {
        return guard("book_update", () -> {
            long seq = data.has(FIELD_SEQ)
                ? longValue(data, FIELD_SEQ, 0)
                : longValue(data, FIELD_SEQUENCE, 0);
            return new BookUpdate(
                requiredText(data, FIELD_ORDERBOOK_ID),
                optionalText(data, FIELD_TIMESTAMP, ""),
                seq,
                parseLevels(data.get(FIELD_BIDS)),
                parseLevels(data.get(FIELD_ASKS)),
                data.path("is_snapshot").asBoolean(false),
                data.path("resync").asBoolean(false),
                optionalText(data, "message", null)
            );
        });
    }

    public TradeData parseTrade(JsonNode data) {
        return guard("trades", () -> new TradeData(
            requiredText(data, FIELD_ORDERBOOK_ID),
            requiredDecimal(data, FIELD_PRICE),
            requiredDecimal(data, FIELD_SIZE),
            side(data.get(FIELD_SIDE)),
            optionalText(data, FIELD_TIMESTAMP, ""),
            optionalText(data, "trade_id", ""),
            longValue(data, FIELD_SEQUENCE, 0)
        ));
    }

    public UserEvent parseUserEvent(JsonNode data) {
        return guard("user", () -> {
            String rawType = optionalText(data, FIELD_EVENT_TYPE, null);
            UserEventType type = UserEventType.fromString(rawType)
                .orElseThrow(() -> new FrameParseException("Unknown user event_type: " + rawType));
            String timestamp = optionalText(data, FIELD_TIMESTAMP, null);

            return switch (type) {
                case SNAPSHOT -> parseUserSnapshot(data, timestamp);
                case ORDER -> parseOrderEvent(data, timestamp);
                case BALANCE_UPDATE -> new UserEvent.BalanceUpdate(
                    requiredText(data, FIELD_ORDERBOOK_ID),
                    new BalanceEntry(
                        optionalText(data, FIELD_MARKET_PUBKEY, null),
                        optionalText(data, FIELD_DEPOSIT_MINT, null),
                        parseOutcomes(data.path("balance").get(FIELD_OUTCOMES))
                    ),
                    timestamp
                );
                case NONCE -> new UserEvent.NonceUpdate(
                    optionalText(data, "user_pubkey", null),
                    requiredLong(data, "new_nonce"),
                    timestamp
                );
            };
        });
    }

    public PriceHistoryEvent parsePriceHistory(JsonNode data) {
        return guard("price_history", () -> {
            String eventType = optionalText(data, FIELD_EVENT_TYPE, null);
            if ("heartbeat".equals(eventType)) {
                return new PriceHistoryEvent.Heartbeat(requiredLong(data, "server_time"));
            }

            String orderbookId = requiredText(data, FIELD_ORDERBOOK_ID);
            String rawResolution = optionalText(data, "resolution", DEFAULT_RESOLUTION);
            Resolution resolution = Resolution.fromTag(rawResolution)
                .orElseThrow(() -> new FrameParseException("Unknown resolution: " + rawResolution));

            if ("snapshot".equals(eventType)) {
                List<Candle> candles = new ArrayList<>();
                for (JsonNode candle : data.path("prices")) {
                    candles.add(parseCandle(candle));
                }
                JsonNode includeOhlcv = data.get("include_ohlcv");
                return new PriceHistoryEvent.Snapshot(
                    orderbookId,
                    resolution,
                    includeOhlcv == null || includeOhlcv.isNull() ? null : includeOhlcv.asBoolean(),
                    candles,
                    optionalLong(data, "last_timestamp"),
                    optionalLong(data, "server_time")
                );
            }
            if ("update".equals(eventType)) {
                return new PriceHistoryEvent.Update(orderbookId, resolution, parseCandle(data));
            }
            throw new FrameParseException("Unknown price_history event_type: " + eventType);
        });
    }

    public MarketEventData parseMarketEvent(JsonNode data) {
        return guard("market", () -> new MarketEventData(
            MarketEventType.fromString(optionalText(data, FIELD_EVENT_TYPE, null)),
            requiredText(data, FIELD_MARKET_PUBKEY),
            optionalText(data, FIELD_ORDERBOOK_ID, null),
            optionalText(data, FIELD_TIMESTAMP, "")
        ));
    }

    public ServerErrorData parseServerError(JsonNode data) {
        return guard("error", () -> new ServerErrorData(
            optionalText(data, "code", "UNKNOWN"),
            optionalText(data, "error", ""),
            optionalText(data, FIELD_ORDERBOOK_ID, null)
        ));
    }

    public TickerData parseTicker(JsonNode data) {
        return guard("ticker", () -> new TickerData(
            requiredText(data, FIELD_ORDERBOOK_ID),
            decimal(data, "best_bid"),
            decimal(data, "best_ask"),
            decimal(data, "mid"),
            optionalText(data, FIELD_TIMESTAMP, "")
        ));
    }

    public AuthData parseAuth(JsonNode data) {
        return guard("auth", () -> new AuthData(
            AuthStatus.fromString(optionalText(data, "status", null)),
            optionalText(data, "wallet", null),
            optionalText(data, "message", null)
        ));
    }

    private UserEvent.Snapshot parseUserSnapshot(JsonNode data, String timestamp) {
        List<OrderData> orders = new ArrayList<>();
        for (JsonNode order : data.path("orders")) {
            orders.add(new OrderData(
                requiredText(order, "order_hash"),
                optionalText(order, FIELD_MARKET_PUBKEY, null),
                optionalText(order, FIELD_ORDERBOOK_ID, null),
                side(order.get(FIELD_SIDE)),
                decimalOrZero(order, "maker_amount"),
                decimalOrZero(order, "taker_amount"),
                requiredDecimal(order, "remaining"),
                decimalOrZero(order, "filled"),
                requiredDecimal(order, FIELD_PRICE),
                longValue(order, "created_at", 0),
                longValue(order, "expiration", 0)
            ));
        }

        Map<String, BalanceEntry> balances = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = data.path("balances").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode balance = entry.getValue();
            balances.put(entry.getKey(), new BalanceEntry(
                optionalText(balance, FIELD_MARKET_PUBKEY, null),
                optionalText(balance, FIELD_DEPOSIT_MINT, null),
                parseOutcomes(balance.get(FIELD_OUTCOMES))
            ));
        }

        return new UserEvent.Snapshot(orders, balances, optionalLong(data, "nonce"), timestamp);
    }

    private UserEvent.OrderEvent parseOrderEvent(JsonNode data, String timestamp) {
        JsonNode order = data.get("order");
        if (order == null || !order.isObject()) {
            throw new FrameParseException("Order event has no order object");
        }
        JsonNode balance = order.get("balance");
        List<OutcomeBalance> outcomes = balance == null || balance.isNull()
            ? null
            : parseOutcomes(balance.get(FIELD_OUTCOMES));

        OrderUpdate update = new OrderUpdate(
            requiredText(order, "order_hash"),
            requiredDecimal(order, FIELD_PRICE),
            decimalOrZero(order, "fill_amount"),
            requiredDecimal(order, "remaining"),
            decimalOrZero(order, "filled"),
            side(order.get(FIELD_SIDE)),
            order.path("is_maker").asBoolean(false),
            longValue(order, "created_at", 0),
            optionalText(order, "status", null),
            outcomes
        );
        return new UserEvent.OrderEvent(
            update,
            optionalText(data, FIELD_MARKET_PUBKEY, null),
            optionalText(data, FIELD_ORDERBOOK_ID, null),
            optionalText(data, FIELD_DEPOSIT_MINT, null),
            timestamp
        );
    }

    private List<OutcomeBalance> parseOutcomes(JsonNode outcomes) {
        List<OutcomeBalance> result = new ArrayList<>();
        if (outcomes == null || outcomes.isNull()) {
            return result;
        }
        for (JsonNode outcome : outcomes) {
            result.add(new OutcomeBalance(
                outcome.path("outcome_index").asInt(0),
                optionalText(outcome, "mint", null),
                decimalOrZero(outcome, "idle"),
                decimalOrZero(outcome, "on_book")
            ));
        }
        return result;
    }

    private Candle parseCandle(JsonNode node) {
        return new Candle(
            requiredLong(node, "t"),
            decimal(node, "o"),
            decimal(node, "h"),
            decimal(node, "l"),
            decimal(node, "c"),
            decimal(node, "v"),
            decimal(node, "m"),
            decimal(node, "bb"),
            decimal(node, "ba")
        );
    }

    /**
     * Walks a level array such as {@code [{"side":"bid","price":"0.50","size":"0.001"}]}.
     */
    private List<PriceLevel> parseLevels(JsonNode levels) throws IOException {
        if (levels == null || levels.isNull()) {
            return List.of();
        }
        if (!levels.isArray()) {
            throw new FrameParseException("Price levels must be an array");
        }

        List<PriceLevel> result = new ArrayList<>(levels.size());
        try (JsonParser parser = levels.traverse()) {
            String fieldName = null;
            BigDecimal price = null;
            BigDecimal size = null;

            while (parser.nextToken() != null) {
                JsonToken token = parser.currentToken();

                switch (token) {
                    case START_OBJECT:
                        price = null;
                        size = null;
                        break;
                    case FIELD_NAME:
                        fieldName = parser.currentName();
                        break;
                    case VALUE_STRING:
                        if (FIELD_PRICE.equals(fieldName)) {
                            price = new BigDecimal(parser.getText());
                        } else if (FIELD_SIZE.equals(fieldName)) {
                            size = new BigDecimal(parser.getText());
                        }
                        break;
                    case VALUE_NUMBER_INT:
                    case VALUE_NUMBER_FLOAT:
                        if (FIELD_PRICE.equals(fieldName)) {
                            price = parser.getDecimalValue();
                        } else if (FIELD_SIZE.equals(fieldName)) {
                            size = parser.getDecimalValue();
                        }
                        break;
                    case END_OBJECT:
                        if (price == null || size == null) {
                            throw new FrameParseException("Price level is missing price or size");
                        }
                        result.add(new PriceLevel(price, size));
                        break;
                    default:
                        break;
                }
            }
        }
        return result;
    }

    private static Side side(JsonNode node) {
        if (node == null || node.isNull()) {
            return Side.UNKNOWN;
        }
        if (node.isIntegralNumber()) {
            return Side.fromCode(node.asInt());
        }
        return Side.fromString(node.asText());
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            throw new FrameParseException("Missing field: " + field);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return value.asText();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        String text = value.asText();
        return text.isEmpty() ? null : new BigDecimal(text);
    }

    private static BigDecimal requiredDecimal(JsonNode node, String field) {
        BigDecimal value = decimal(node, field);
        if (value == null) {
            throw new FrameParseException("Missing field: " + field);
        }
        return value;
    }

    private static BigDecimal decimalOrZero(JsonNode node, String field) {
        BigDecimal value = decimal(node, field);
        return value == null ? BigDecimal.ZERO : value;
    }

    private static Long optionalLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.asLong();
        }
        return Long.parseLong(value.asText());
    }

    private static long requiredLong(JsonNode node, String field) {
        Long value = optionalLong(node, field);
        if (value == null) {
            throw new FrameParseException("Missing field: " + field);
        }
        return value;
    }

    private static long longValue(JsonNode node, String field, long defaultValue) {
        Long value = optionalLong(node, field);
        return value == null ? defaultValue : value;
    }

    private static <T> T guard(String channel, ParseStep<T> step) {
        try {
            return step.parse();
        } catch (FrameParseException e) {
            throw e;
        } catch (IOException e) {
            throw new FrameParseException("Failed to parse " + channel + " payload", e);
        } catch (RuntimeException e) {
            throw new FrameParseException("Invalid " + channel + " payload: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface ParseStep<T> {
        T parse() throws IOException;
    }
}
