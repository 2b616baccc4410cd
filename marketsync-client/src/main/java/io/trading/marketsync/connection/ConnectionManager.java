package io.trading.marketsync.connection;

import io.trading.marketsync.config.GapPolicy;
import io.trading.marketsync.config.SyncConfig;
import io.trading.marketsync.error.ErrorKind;
import io.trading.marketsync.error.SyncError;
import io.trading.marketsync.error.SyncException;
import io.trading.marketsync.event.EventChannel;
import io.trading.marketsync.event.SyncEvent;
import io.trading.marketsync.metrics.SyncMetrics;
import io.trading.marketsync.protocol.api.CloseCodes;
import io.trading.marketsync.protocol.api.Subscription;
import io.trading.marketsync.protocol.codec.FrameEncoder;
import io.trading.marketsync.protocol.model.BookUpdate;
import io.trading.marketsync.router.MessageRouter;
import io.trading.marketsync.state.StateStores;
import io.trading.marketsync.subscription.SubscriptionRegistry;
import io.trading.marketsync.transport.Transport;
import io.trading.marketsync.transport.TransportListener;
import io.trading.marketsync.transport.TransportSession;
import org.agrona.BitUtil;
import org.agrona.concurrent.ManyToOneConcurrentArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the connection lifecycle: connect, liveness pings, reconnect with backoff and
 * subscription replay, and explicit disconnect.
 *
 * <p>All mutable connection state lives on a single loop thread. Transport callbacks are
 * hopped onto it, public API calls reach it through a bounded command queue, and the ping
 * tick and backoff delays are scheduled on it. The loop is therefore the only writer of the
 * state stores and of {@link ConnectionState}. Callbacks from a socket that has since been
 * replaced carry an older generation number and are dropped.
 */
public class ConnectionManager implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionManager.class);

    private static final String CLIENT_DISCONNECT = "Client disconnect";
    private static final String PING_TIMEOUT = "Ping timeout";

    private final SyncConfig config;
    private final Transport transport;
    private final StateStores stores;
    private final SubscriptionRegistry registry;
    private final EventChannel<SyncEvent> events;
    private final SyncMetrics metrics;
    private final MessageRouter router;
    private final ReconnectBackoff backoff;
    private final FrameEncoder encoder = new FrameEncoder();
    private final PingTracker pingTracker = new PingTracker();
    private final ManyToOneConcurrentArrayQueue<Command> commands;
    private final int commandCapacity;
    private final AtomicLong generation = new AtomicLong();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean closeRequested;
    private volatile ScheduledThreadPoolExecutor loop;
    private volatile CompletableFuture<Void> terminated = CompletableFuture.completedFuture(null);
    private volatile URI uri;
    private volatile Map<String, String> headers = Map.of();

    // Loop confined
    private TransportSession session;
    private ScheduledFuture<?> pingTask;
    private int reconnectAttempt;

    public ConnectionManager(
        SyncConfig config,
        Transport transport,
        StateStores stores,
        SubscriptionRegistry registry,
        EventChannel<SyncEvent> events,
        SyncMetrics metrics
    ) {
        this(config, transport, stores, registry, events, metrics,
            new ReconnectBackoff(config.baseDelayMs(), config.maxDelayMs()));
    }

    public ConnectionManager(
        SyncConfig config,
        Transport transport,
        StateStores stores,
        SubscriptionRegistry registry,
        EventChannel<SyncEvent> events,
        SyncMetrics metrics,
        ReconnectBackoff backoff
    ) {
        this.config = config;
        this.transport = transport;
        this.stores = stores;
        this.registry = registry;
        this.events = events;
        this.metrics = metrics;
        this.backoff = backoff;
        this.router = new MessageRouter(stores, registry, metrics);
        this.commandCapacity = config.commandChannelCapacity();
        // one slot of headroom beyond the limit for the disconnect command
        this.commands = new ManyToOneConcurrentArrayQueue<>(
            BitUtil.findNextPositivePowerOfTwo(Math.max(2, commandCapacity + 1)));
    }

    // Public API

    /**
     * Opens the connection and starts the loop. Blocks until the WebSocket handshake has
     * completed or the connect deadline has passed.
     *
     * @param authToken token sent as the {@code auth_token} cookie, or null
     * @throws SyncException ALREADY_CONNECTED, INVALID_URL, TIMEOUT or CONNECTION_FAILED
     */
    public synchronized void connect(String authToken) {
        if (state != ConnectionState.DISCONNECTED) {
            throw new SyncException(ErrorKind.ALREADY_CONNECTED, "Already connected or connecting (state: " + state + ")");
        }
        URI target = parseUrl(config.url());

        uri = target;
        headers = authToken == null ? Map.of() : Map.of("Cookie", "auth_token=" + authToken);
        closeRequested = false;
        commands.clear();
        setState(ConnectionState.CONNECTING);

        ScheduledThreadPoolExecutor newLoop = createLoop();
        loop = newLoop;
        terminated = new CompletableFuture<>();
        long gen = generation.incrementAndGet();

        LOGGER.info("Connecting to {}", target);
        CompletableFuture<TransportSession> opening = transport.open(target, headers, new SessionListener(gen));
        TransportSession opened;
        try {
            opened = opening.get(config.connectTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            opening.completeExceptionally(e);
            abortConnect();
            throw new SyncException(
                SyncError.of(ErrorKind.TIMEOUT, "Connection timed out after " + config.connectTimeoutMs() + " ms"), e);
        } catch (ExecutionException e) {
            abortConnect();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SyncException(
                SyncError.of(ErrorKind.CONNECTION_FAILED, "Failed to connect to " + target + ": " + cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            opening.completeExceptionally(e);
            abortConnect();
            throw new SyncException(SyncError.of(ErrorKind.CONNECTION_FAILED, "Interrupted while connecting"), e);
        }

        try {
            newLoop.submit(() -> activate(gen, opened)).get();
        } catch (ExecutionException | RejectedExecutionException e) {
            opened.close(CloseCodes.NORMAL, CLIENT_DISCONNECT);
            abortConnect();
            throw new SyncException(SyncError.of(ErrorKind.CONNECTION_FAILED, "Failed to start connection loop"), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException(SyncError.of(ErrorKind.CONNECTION_FAILED, "Interrupted while connecting"), e);
        }
    }

    /**
     * Closes the connection gracefully, clears the subscriptions and waits for the loop to
     * stop. Never reconnects afterwards. A no-op when already disconnected.
     */
    public void disconnect() {
        CompletableFuture<Void> done = terminated;
        if (state == ConnectionState.DISCONNECTED || done.isDone()) {
            LOGGER.debug("Disconnect requested while already disconnected");
            return;
        }
        closeRequested = true;

        boolean queued = commands.offer(new Command.Disconnect());
        boolean scheduled = queued
            ? executeOnLoop(this::drainCommands)
            : executeOnLoop(this::doDisconnect);
        if (!scheduled) {
            return;
        }

        try {
            done.get(config.connectTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOGGER.warn("Connection loop did not stop within {} ms", config.connectTimeoutMs());
        } catch (ExecutionException e) {
            LOGGER.warn("Connection loop terminated abnormally", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for the connection loop to stop");
        }
    }

    /**
     * Registers the subscription and sends it. While reconnecting the frame is deferred to
     * the subscription replay.
     *
     * @throws SyncException NOT_CONNECTED, SEND_FAILED or CHANNEL_CLOSED
     * @throws IllegalStateException when a different user channel is already subscribed
     */
    public void subscribe(Subscription subscription) {
        requireLoop();
        Optional<Subscription> added = registry.add(subscription);
        try {
            enqueue(new Command.Subscribe(subscription));
        } catch (SyncException e) {
            added.ifPresent(registry::remove);
            throw e;
        }
        metrics.setActiveSubscriptions(registry.size());
    }

    public void unsubscribe(Subscription subscription) {
        requireLoop();
        registry.remove(subscription);
        metrics.setActiveSubscriptions(registry.size());
        enqueue(new Command.Unsubscribe(subscription));
    }

    /**
     * Sends a raw text frame.
     */
    public void send(String text) {
        requireConnected();
        enqueue(new Command.Send(text));
    }

    /**
     * Sends a liveness ping outside the regular interval.
     */
    public void ping() {
        requireConnected();
        enqueue(new Command.Ping());
    }

    /**
     * Applies a book snapshot fetched over the request/response channel.
     */
    public void applyBookSnapshot(BookUpdate snapshot) {
        if (!snapshot.snapshot()) {
            throw new IllegalArgumentException("Bootstrap update for " + snapshot.orderbookId() + " is not a snapshot");
        }
        requireLoop();
        enqueue(new Command.ApplyBookSnapshot(snapshot));
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    /**
     * Completes when the loop has stopped for good.
     */
    public CompletableFuture<Void> terminationFuture() {
        return terminated;
    }

    @Override
    public void close() {
        disconnect();
    }

    private void requireLoop() {
        if (state == ConnectionState.DISCONNECTED || loop == null) {
            throw new SyncException(SyncError.notConnected());
        }
    }

    private void requireConnected() {
        if (state != ConnectionState.CONNECTED) {
            throw new SyncException(SyncError.notConnected());
        }
    }

    private void enqueue(Command command) {
        // the queue rounds its capacity up to a power of two, so the configured limit is checked here
        if (commands.size() >= commandCapacity || !commands.offer(command)) {
            throw new SyncException(ErrorKind.SEND_FAILED,
                "Command channel is full (capacity " + commandCapacity + ")");
        }
        if (!executeOnLoop(this::drainCommands)) {
            throw new SyncException(ErrorKind.CHANNEL_CLOSED, "Connection loop has stopped");
        }
    }

    // Loop

    private ScheduledThreadPoolExecutor createLoop() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r, "marketsync-loop");
            thread.setDaemon(true);
            return thread;
        });
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    private boolean executeOnLoop(Runnable task) {
        ScheduledThreadPoolExecutor current = loop;
        if (current == null) {
            return false;
        }
        try {
            current.execute(() -> {
                if (loop == current) {
                    runSafely(task);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Connection loop stopped, dropping task");
            return false;
        }
    }

    private void schedule(Runnable task, long delayMs) {
        ScheduledThreadPoolExecutor current = loop;
        if (current == null) {
            return;
        }
        try {
            current.schedule(() -> runSafely(task), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Connection loop stopped, dropping scheduled task");
        }
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error on connection loop", e);
        }
    }

    private void abortConnect() {
        generation.incrementAndGet();
        ScheduledThreadPoolExecutor current = loop;
        loop = null;
        if (current != null) {
            current.shutdownNow();
        }
        setState(ConnectionState.DISCONNECTED);
        terminated.complete(null);
    }

    private void activate(long gen, TransportSession opened) {
        if (gen != generation.get()) {
            LOGGER.warn("Session to {} closed before it could be activated", uri);
            return;
        }
        session = opened;
        reconnectAttempt = 0;
        pingTracker.reset(now());
        setState(ConnectionState.CONNECTED);
        LOGGER.info("Connected to {}", uri);
        publish(new SyncEvent.Connected());
        startPing();
        dropIfClosed(opened);
    }

    // A close that raced the activation was ignored by onSessionClosed
    private void dropIfClosed(TransportSession opened) {
        if (session == opened && !opened.isOpen()) {
            handleConnectionLost(CloseCodes.ABNORMAL, "Connection lost");
        }
    }

    private void drainCommands() {
        commands.drain(this::handleCommand);
    }

    private void handleCommand(Command command) {
        if (command instanceof Command.Send send) {
            sendFrame(send.text());
        } else if (command instanceof Command.Subscribe subscribe) {
            stores.prepare(subscribe.subscription());
            sendFrame(encoder.subscribe(subscribe.subscription()));
        } else if (command instanceof Command.Unsubscribe unsubscribe) {
            sendFrame(encoder.unsubscribe(unsubscribe.subscription()));
        } else if (command instanceof Command.Ping) {
            sendPing();
        } else if (command instanceof Command.Disconnect) {
            doDisconnect();
        } else if (command instanceof Command.ApplyBookSnapshot apply) {
            LOGGER.info("Applying bootstrap snapshot for {}", apply.snapshot().orderbookId());
            publishRouted(router.applyBookUpdate(apply.snapshot()));
        } else {
            LOGGER.warn("Ignoring unknown command {}", command);
        }
    }

    private boolean sendFrame(String text) {
        if (session == null || !session.isOpen()) {
            LOGGER.debug("No open session, not sending frame: {}", text);
            return false;
        }
        try {
            session.send(text);
            return true;
        } catch (IllegalStateException e) {
            LOGGER.warn("Failed to send frame: {}", e.getMessage());
            return false;
        }
    }

    private void onText(String text) {
        publishRouted(router.route(text));
    }

    private void publishRouted(List<SyncEvent> routed) {
        for (SyncEvent event : routed) {
            if (event instanceof SyncEvent.Pong) {
                pingTracker.recordPong(now());
            }
            publish(event);
            if (event instanceof SyncEvent.ResyncRequired resync) {
                applyGapPolicy(resync.orderbookId());
            }
        }
    }

    private void applyGapPolicy(String orderbookId) {
        if (config.gapPolicy() != GapPolicy.RESUBSCRIBE || !registry.isBookSubscribed(orderbookId)) {
            return;
        }
        LOGGER.info("Resubscribing to {} to obtain a fresh snapshot", orderbookId);
        Subscription.Books books = new Subscription.Books(List.of(orderbookId));
        sendFrame(encoder.unsubscribe(books));
        sendFrame(encoder.subscribe(books));
    }

    private void startPing() {
        cancelPing();
        ScheduledThreadPoolExecutor current = loop;
        if (current == null) {
            return;
        }
        long interval = config.pingIntervalMs();
        pingTask = current.scheduleAtFixedRate(() -> runSafely(this::onPingTick), interval, interval, TimeUnit.MILLISECONDS);
    }

    private void cancelPing() {
        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
    }

    private void onPingTick() {
        if (session == null) {
            return;
        }
        long now = now();
        if (pingTracker.isTimedOut(now, config.pongTimeoutMs())) {
            LOGGER.warn("No pong received for {} ms, dropping connection", now - pingTracker.getLastPongMs());
            metrics.recordPingTimeout();
            publish(new SyncEvent.ErrorRaised(SyncError.pingTimeout()));
            TransportSession dead = session;
            dead.close(CloseCodes.NORMAL, PING_TIMEOUT);
            handleConnectionLost(CloseCodes.ABNORMAL, PING_TIMEOUT);
            return;
        }
        sendPing();
    }

    private void sendPing() {
        if (sendFrame(encoder.ping())) {
            pingTracker.recordPing(now());
        }
    }

    private void onSessionClosed(long gen, int code, String reason) {
        if (gen != generation.get()) {
            LOGGER.debug("Ignoring close {} from superseded session", code);
            return;
        }
        if (closeRequested) {
            return;
        }
        if (session == null) {
            LOGGER.debug("Ignoring close {} for a session that is not active", code);
            return;
        }
        handleConnectionLost(code, reason);
    }

    private void onTransportError(long gen, Throwable cause) {
        if (gen != generation.get()) {
            return;
        }
        LOGGER.warn("Transport error: {}", cause.toString());
        publish(new SyncEvent.ErrorRaised(
            SyncError.of(ErrorKind.CONNECTION_CLOSED, "Transport error: " + cause.getMessage())));
    }

    private void handleConnectionLost(int code, String reason) {
        LOGGER.warn("Connection lost: code {}, reason: {}", code, reason);
        generation.incrementAndGet();
        cancelPing();
        session = null;

        if (code == CloseCodes.RATE_LIMITED) {
            LOGGER.warn("Rate limited by server, consider reducing subscriptions");
            metrics.recordRateLimited();
            publish(new SyncEvent.ErrorRaised(SyncError.rateLimited()));
        }
        publish(new SyncEvent.Disconnected(code, reason));
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (closeRequested) {
            terminate();
            return;
        }
        if (!config.autoReconnect()) {
            LOGGER.info("Auto-reconnect disabled, staying disconnected");
            terminate();
            return;
        }
        if (reconnectAttempt >= config.reconnectAttempts()) {
            LOGGER.error("Max reconnect attempts ({}) reached, giving up", config.reconnectAttempts());
            if (reconnectAttempt > 0) {
                publish(new SyncEvent.Disconnected(CloseCodes.ABNORMAL, "Reconnect attempts exhausted"));
            }
            terminate();
            return;
        }

        reconnectAttempt++;
        long delay = backoff.delayMillis(reconnectAttempt);
        setState(ConnectionState.RECONNECTING);
        metrics.recordReconnectAttempt();
        publish(new SyncEvent.Reconnecting(reconnectAttempt));
        LOGGER.info("Scheduling reconnect attempt {}/{} in {} ms", reconnectAttempt, config.reconnectAttempts(), delay);
        schedule(this::attemptReconnect, delay);
    }

    private void attemptReconnect() {
        if (closeRequested) {
            return;
        }
        long gen = generation.incrementAndGet();
        LOGGER.info("Reconnect attempt {} to {}", reconnectAttempt, uri);

        CompletableFuture<TransportSession> opening;
        try {
            opening = transport.open(uri, headers, new SessionListener(gen));
        } catch (RuntimeException e) {
            onReconnectResult(gen, null, e);
            return;
        }
        opening.orTimeout(config.connectTimeoutMs(), TimeUnit.MILLISECONDS)
            .whenComplete((opened, failure) -> {
                boolean scheduled = executeOnLoop(() -> onReconnectResult(gen, opened, failure));
                if (!scheduled && opened != null) {
                    opened.close(CloseCodes.NORMAL, CLIENT_DISCONNECT);
                }
            });
    }

    private void onReconnectResult(long gen, TransportSession opened, Throwable failure) {
        if (gen != generation.get() || closeRequested) {
            if (opened != null) {
                opened.close(CloseCodes.NORMAL, CLIENT_DISCONNECT);
            }
            return;
        }
        if (failure != null) {
            Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
            LOGGER.warn("Reconnect attempt {} failed: {}", reconnectAttempt, cause.toString());
            generation.incrementAndGet();
            publish(new SyncEvent.ErrorRaised(SyncError.of(ErrorKind.CONNECTION_FAILED,
                "Reconnect attempt " + reconnectAttempt + " failed: " + cause.getMessage())));
            scheduleReconnect();
            return;
        }

        stores.clearAll();
        session = opened;
        if (config.autoResubscribe()) {
            resubscribeAll();
        }
        LOGGER.info("Reconnected to {} after {} attempt(s)", uri, reconnectAttempt);
        reconnectAttempt = 0;
        pingTracker.reset(now());
        setState(ConnectionState.CONNECTED);
        publish(new SyncEvent.Connected());
        startPing();
        dropIfClosed(opened);
    }

    private void resubscribeAll() {
        List<Subscription> all = registry.all();
        for (Subscription subscription : all) {
            stores.prepare(subscription);
            sendFrame(encoder.subscribe(subscription));
        }
        LOGGER.info("Resubscribed {} subscription(s)", all.size());
    }

    private void doDisconnect() {
        if (state == ConnectionState.DISCONNECTED) {
            return;
        }
        LOGGER.info("Disconnecting from {}", uri);
        setState(ConnectionState.DISCONNECTING);
        generation.incrementAndGet();
        cancelPing();
        if (session != null) {
            session.close(CloseCodes.NORMAL, CLIENT_DISCONNECT);
            session = null;
        }
        registry.clear();
        metrics.setActiveSubscriptions(0);
        publish(new SyncEvent.Disconnected(CloseCodes.NORMAL, CLIENT_DISCONNECT));
        terminate();
    }

    private void terminate() {
        cancelPing();
        session = null;
        setState(ConnectionState.DISCONNECTED);
        ScheduledThreadPoolExecutor current = loop;
        loop = null;
        commands.clear();
        if (current != null) {
            current.shutdown();
        }
        terminated.complete(null);
        LOGGER.info("Connection loop stopped");
    }

    private void publish(SyncEvent event) {
        if (events.publish(event)) {
            metrics.recordEventDropped();
        }
    }

    private void setState(ConnectionState newState) {
        state = newState;
        metrics.setConnectionState(newState);
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    static URI parseUrl(String url) {
        URI parsed;
        try {
            parsed = new URI(url);
        } catch (URISyntaxException e) {
            throw new SyncException(SyncError.of(ErrorKind.INVALID_URL, "Invalid WebSocket URL: " + url), e);
        }
        String scheme = parsed.getScheme();
        if (scheme == null
            || !("ws".equalsIgnoreCase(scheme) || "wss".equalsIgnoreCase(scheme))
            || parsed.getHost() == null) {
            throw new SyncException(ErrorKind.INVALID_URL, "Invalid WebSocket URL: " + url);
        }
        return parsed;
    }

    /**
     * Hops transport callbacks for one session onto the loop.
     */
    private final class SessionListener implements TransportListener {

        private final long gen;

        SessionListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onText(String text) {
            executeOnLoop(() -> {
                if (gen == generation.get()) {
                    ConnectionManager.this.onText(text);
                }
            });
        }

        @Override
        public void onPong() {
            executeOnLoop(() -> {
                if (gen == generation.get()) {
                    pingTracker.recordPong(now());
                }
            });
        }

        @Override
        public void onClose(int code, String reason) {
            executeOnLoop(() -> onSessionClosed(gen, code, reason));
        }

        @Override
        public void onError(Throwable cause) {
            executeOnLoop(() -> onTransportError(gen, cause));
        }
    }
}
