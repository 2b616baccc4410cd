package io.trading.marketsync.router;

import com.fasterxml.jackson.databind.JsonNode;
import io.trading.marketsync.error.SyncError;
import io.trading.marketsync.event.SyncEvent;
import io.trading.marketsync.metrics.SyncMetrics;
import io.trading.marketsync.protocol.api.Channel;
import io.trading.marketsync.protocol.codec.Envelope;
import io.trading.marketsync.protocol.codec.FrameDecoder;
import io.trading.marketsync.protocol.codec.FrameParseException;
import io.trading.marketsync.protocol.model.AuthData;
import io.trading.marketsync.protocol.model.BookUpdate;
import io.trading.marketsync.protocol.model.PriceHistoryEvent;
import io.trading.marketsync.protocol.model.ServerErrorData;
import io.trading.marketsync.protocol.model.UserEvent;
import io.trading.marketsync.state.SequenceGap;
import io.trading.marketsync.state.StateStores;
import io.trading.marketsync.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Turns inbound frames into state changes and events.
 *
 * A frame is decoded, dispatched on its channel tag, applied to the matching store and
 * translated into zero or more {@link SyncEvent}s. Malformed frames become a parse error
 * event and never propagate an exception, unknown channels are ignored.
 *
 * Must only be called from the connection loop.
 */
public class MessageRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageRouter.class);

    private final FrameDecoder decoder = new FrameDecoder();
    private final StateStores stores;
    private final SubscriptionRegistry registry;
    private final SyncMetrics metrics;

    public MessageRouter(StateStores stores, SubscriptionRegistry registry, SyncMetrics metrics) {
        this.stores = stores;
        this.registry = registry;
        this.metrics = metrics;
    }

    public List<SyncEvent> route(String text) {
        long start = System.nanoTime();
        try {
            Envelope envelope = decoder.decodeEnvelope(text);
            Optional<Channel> channel = envelope.channel();
            if (channel.isEmpty()) {
                LOGGER.warn("Ignoring frame with unknown channel: {}", envelope.type());
                metrics.recordUnknownChannel();
                return List.of();
            }
            metrics.recordFrame(channel.get().tag(), text.length());
            return dispatch(channel.get(), envelope.data());
        } catch (FrameParseException e) {
            LOGGER.warn("Failed to parse frame: {}", e.getMessage());
            metrics.recordParseError();
            return List.of(new SyncEvent.ErrorRaised(SyncError.parseError(e.getMessage())));
        } finally {
            metrics.recordRouteLatency((System.nanoTime() - start) / 1000.0);
        }
    }

    private List<SyncEvent> dispatch(Channel channel, JsonNode data) {
        return switch (channel) {
            case BOOK_UPDATE -> applyBookUpdate(decoder.parseBookUpdate(data));
            case TRADES -> List.of(new SyncEvent.TradeReceived(decoder.parseTrade(data)));
            case USER -> onUserEvent(decoder.parseUserEvent(data));
            case PRICE_HISTORY -> onPriceHistory(decoder.parsePriceHistory(data));
            case MARKET -> List.of(new SyncEvent.MarketEvent(decoder.parseMarketEvent(data)));
            case ERROR -> onServerError(decoder.parseServerError(data));
            case PONG -> List.of(new SyncEvent.Pong());
            case TICKER -> List.of(new SyncEvent.TickerUpdated(decoder.parseTicker(data)));
            case AUTH -> onAuth(decoder.parseAuth(data));
        };
    }

    /**
     * Applies a book update, from the stream or from a bootstrap fetch.
     */
    public List<SyncEvent> applyBookUpdate(BookUpdate update) {
        String id = update.orderbookId();

        if (update.resync()) {
            LOGGER.info("Server requested resync for {}: {}", id, update.message());
            stores.clearBook(id);
            return List.of(new SyncEvent.ResyncRequired(id));
        }

        Optional<SequenceGap> gap = stores.applyBook(update);
        if (gap.isPresent()) {
            SequenceGap g = gap.get();
            LOGGER.warn("Sequence gap on {}: expected {}, received {}, clearing book", id, g.expected(), g.received());
            metrics.recordSequenceGap(id);
            stores.clearBook(id);
            return List.of(
                new SyncEvent.ErrorRaised(SyncError.sequenceGap(id, g.expected(), g.received())),
                new SyncEvent.ResyncRequired(id)
            );
        }
        return List.of(new SyncEvent.BookUpdated(id, update.snapshot()));
    }

    private List<SyncEvent> onUserEvent(UserEvent event) {
        Optional<String> user = registry.subscribedUser();
        if (user.isEmpty()) {
            LOGGER.warn("Dropping {} user event, no user channel is subscribed", event.type());
            return List.of();
        }
        if (!stores.applyUser(user.get(), event)) {
            LOGGER.warn("No user state for {}, dropping {} event. Call subscribeUser() first", user.get(), event.type());
            return List.of();
        }

        if (event instanceof UserEvent.NonceUpdate nonce) {
            return List.of(
                new SyncEvent.UserUpdated(event.type(), user.get()),
                new SyncEvent.NonceUpdated(user.get(), nonce.newNonce())
            );
        }
        return List.of(new SyncEvent.UserUpdated(event.type(), user.get()));
    }

    private List<SyncEvent> onPriceHistory(PriceHistoryEvent event) {
        if (event instanceof PriceHistoryEvent.Heartbeat heartbeat) {
            stores.applyHeartbeat(heartbeat.serverTime());
            return List.of();
        }
        if (event instanceof PriceHistoryEvent.Snapshot snapshot) {
            stores.applyPriceSnapshot(snapshot);
            return List.of(new SyncEvent.PriceUpdated(snapshot.orderbookId(), snapshot.resolution()));
        }
        if (event instanceof PriceHistoryEvent.Update update) {
            if (!stores.applyPriceUpdate(update)) {
                LOGGER.warn("Dropping price update for {}:{}, no snapshot received yet",
                    update.orderbookId(), update.resolution());
                return List.of();
            }
            return List.of(new SyncEvent.PriceUpdated(update.orderbookId(), update.resolution()));
        }
        throw new IllegalStateException("Unsupported price history event: " + event);
    }

    private List<SyncEvent> onServerError(ServerErrorData error) {
        LOGGER.error("Server error {}: {}", error.code(), error.message());
        metrics.recordServerError(error.code());
        return List.of(new SyncEvent.ErrorRaised(SyncError.serverError(error.code(), error.message())));
    }

    private List<SyncEvent> onAuth(AuthData auth) {
        LOGGER.info("Authentication status: {} (wallet: {})", auth.status(), auth.wallet());
        return List.of(new SyncEvent.AuthUpdated(auth));
    }
}
