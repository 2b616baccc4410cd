package io.trading.marketsync.client;

import io.trading.marketsync.bootstrap.SnapshotSource;
import io.trading.marketsync.config.SyncConfig;
import io.trading.marketsync.connection.ConnectionManager;
import io.trading.marketsync.connection.ConnectionState;
import io.trading.marketsync.error.ErrorKind;
import io.trading.marketsync.error.SyncError;
import io.trading.marketsync.error.SyncException;
import io.trading.marketsync.event.EventChannel;
import io.trading.marketsync.event.SyncEvent;
import io.trading.marketsync.metrics.SyncMetrics;
import io.trading.marketsync.netty.NettyTransport;
import io.trading.marketsync.protocol.api.Resolution;
import io.trading.marketsync.protocol.api.Subscription;
import io.trading.marketsync.protocol.model.BookUpdate;
import io.trading.marketsync.state.OrderBookState;
import io.trading.marketsync.state.PriceHistoryState;
import io.trading.marketsync.state.StateStores;
import io.trading.marketsync.state.UserState;
import io.trading.marketsync.subscription.SubscriptionRegistry;
import io.trading.marketsync.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for applications: keeps a local mirror of order books, user orders and
 * balances, and price history in sync with the venue's streaming API.
 *
 * <pre>{@code
 * try (MarketSyncClient client = new MarketSyncClient(SyncConfig.defaults())) {
 *     client.connect();
 *     client.subscribeBookUpdates(List.of("ob-1"));
 *     SyncEvent event = client.events().take();
 *     client.orderBook("ob-1").flatMap(OrderBookState::midpoint).ifPresent(System.out::println);
 * }
 * }</pre>
 *
 * State accessors return copies and are safe to call from any thread.
 */
public class MarketSyncClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarketSyncClient.class);

    private final SyncConfig config;
    private final Transport transport;
    private final SyncMetrics metrics;
    private final SnapshotSource snapshotSource;
    private final StateStores stores = new StateStores();
    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final EventChannel<SyncEvent> events;
    private final ConnectionManager connection;

    private volatile String authToken;

    public MarketSyncClient(SyncConfig config) {
        this(config, new NettyTransport((int) config.connectTimeoutMs()), new SyncMetrics(), null);
    }

    /**
     * @param snapshotSource used by {@link #bootstrapOrderBook(String)}, may be null
     */
    public MarketSyncClient(SyncConfig config, Transport transport, SyncMetrics metrics, SnapshotSource snapshotSource) {
        this.config = config;
        this.transport = transport;
        this.metrics = metrics;
        this.snapshotSource = snapshotSource;
        this.events = new EventChannel<>(config.eventChannelCapacity());
        this.connection = new ConnectionManager(config, transport, stores, registry, events, metrics);
        this.authToken = config.authToken();
    }

    // Connection

    public void connect() {
        connection.connect(authToken);
    }

    /**
     * Connects with an auth token sent as the {@code auth_token} cookie. The token is kept
     * for later reconnects.
     *
     * @throws SyncException INVALID_AUTH_TOKEN when the token is blank
     */
    public void connectWithAuth(String token) {
        String trimmed = token == null ? "" : token.trim();
        if (trimmed.isEmpty()) {
            throw new SyncException(ErrorKind.INVALID_AUTH_TOKEN, "Auth token cannot be empty");
        }
        authToken = trimmed;
        connection.connect(trimmed);
    }

    public void disconnect() {
        connection.disconnect();
    }

    @Override
    public void close() {
        connection.close();
        transport.close();
    }

    // Subscriptions

    public void subscribeBookUpdates(List<String> orderbookIds) {
        subscribe(new Subscription.Books(orderbookIds));
    }

    public void unsubscribeBookUpdates(List<String> orderbookIds) {
        connection.unsubscribe(new Subscription.Books(orderbookIds));
    }

    public void subscribeTrades(List<String> orderbookIds) {
        subscribe(new Subscription.Trades(orderbookIds));
    }

    public void unsubscribeTrades(List<String> orderbookIds) {
        connection.unsubscribe(new Subscription.Trades(orderbookIds));
    }

    /**
     * Subscribes to a wallet's orders, balances and nonce. One wallet per connection.
     *
     * @throws SyncException SUBSCRIPTION_FAILED when another wallet is already subscribed
     */
    public void subscribeUser(String wallet) {
        subscribe(new Subscription.User(wallet));
    }

    public void unsubscribeUser(String wallet) {
        connection.unsubscribe(new Subscription.User(wallet));
    }

    public void subscribePriceHistory(String orderbookId, Resolution resolution, boolean includeOhlcv) {
        subscribe(new Subscription.PriceHistory(orderbookId, resolution, includeOhlcv));
    }

    public void unsubscribePriceHistory(String orderbookId, Resolution resolution) {
        connection.unsubscribe(new Subscription.PriceHistory(orderbookId, resolution, false));
    }

    public void subscribeMarket(String marketPubkey) {
        subscribe(new Subscription.Market(marketPubkey));
    }

    public void unsubscribeMarket(String marketPubkey) {
        connection.unsubscribe(new Subscription.Market(marketPubkey));
    }

    public void subscribeTicker(List<String> orderbookIds) {
        subscribe(new Subscription.Ticker(orderbookIds));
    }

    public void unsubscribeTicker(List<String> orderbookIds) {
        connection.unsubscribe(new Subscription.Ticker(orderbookIds));
    }

    private void subscribe(Subscription subscription) {
        try {
            connection.subscribe(subscription);
        } catch (IllegalStateException e) {
            throw new SyncException(SyncError.of(ErrorKind.SUBSCRIPTION_FAILED, e.getMessage()), e);
        }
    }

    // Commands

    public void send(String text) {
        connection.send(text);
    }

    public void ping() {
        connection.ping();
    }

    /**
     * Fetches a book snapshot over the request/response channel and applies it. Use for
     * books whose stream does not deliver an initial snapshot.
     *
     * @throws IOException when the fetch fails
     * @throws IllegalStateException when no snapshot source was configured
     */
    public void bootstrapOrderBook(String orderbookId) throws IOException {
        if (snapshotSource == null) {
            throw new IllegalStateException("No snapshot source configured");
        }
        BookUpdate snapshot = snapshotSource.fetchOrderBook(orderbookId);
        LOGGER.debug("Fetched bootstrap snapshot for {} at seq {}", orderbookId, snapshot.seq());
        connection.applyBookSnapshot(snapshot);
    }

    // Accessors

    public EventChannel<SyncEvent> events() {
        return events;
    }

    public Optional<OrderBookState> orderBook(String orderbookId) {
        return stores.orderBook(orderbookId);
    }

    public Optional<UserState> userState(String wallet) {
        return stores.userState(wallet);
    }

    public Optional<PriceHistoryState> priceHistory(String orderbookId, Resolution resolution) {
        return stores.priceHistory(orderbookId, resolution);
    }

    public ConnectionState connectionState() {
        return connection.getState();
    }

    public boolean isConnected() {
        return connection.isConnected();
    }

    /**
     * True when an auth token is configured for this client.
     */
    public boolean isAuthenticated() {
        return authToken != null;
    }

    public List<Subscription> subscriptions() {
        return registry.all();
    }

    public SyncMetrics metrics() {
        return metrics;
    }

    public SyncConfig config() {
        return config;
    }

    public String url() {
        return config.url();
    }
}
