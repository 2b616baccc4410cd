package io.trading.marketsync;

import io.prometheus.client.hotspot.DefaultExports;
import io.trading.marketsync.client.MarketSyncClient;
import io.trading.marketsync.config.SyncConfig;
import io.trading.marketsync.event.SyncEvent;
import io.trading.marketsync.metrics.MetricsServer;
import io.trading.marketsync.state.OrderBookState;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Example application: mirrors the configured books, trades and user channel and logs every
 * event until terminated.
 *
 * Environment variables, in addition to the {@code MARKETSYNC_*} client settings:
 * <ul>
 *   <li>{@code MARKETSYNC_BOOKS} comma separated orderbook ids for depth</li>
 *   <li>{@code MARKETSYNC_TRADES} comma separated orderbook ids for trades</li>
 *   <li>{@code MARKETSYNC_TICKERS} comma separated orderbook ids for tickers</li>
 *   <li>{@code MARKETSYNC_USER} wallet address for the user channel</li>
 *   <li>{@code METRICS_PORT} HTTP port for metrics and status (default 9090)</li>
 * </ul>
 */
public class MarketSyncApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarketSyncApp.class);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Market Sync Starting...");
        LOGGER.info("========================================");

        MarketSyncClient client = null;
        MetricsServer metricsServer = null;
        try {
            SyncConfig config = SyncConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  URL: {}", config.url());
            LOGGER.info("  Reconnect attempts: {}", config.reconnectAttempts());
            LOGGER.info("  Gap policy: {}", config.gapPolicy());

            client = new MarketSyncClient(config);
            DefaultExports.register(client.metrics().getRegistry());

            int metricsPort = Integer.parseInt(System.getenv().getOrDefault("METRICS_PORT", "9090"));
            metricsServer = new MetricsServer(metricsPort, client);
            metricsServer.start();

            ShutdownSignalBarrier shutdownBarrier = new ShutdownSignalBarrier();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));

            client.connect();
            subscribeFromEnv(client);
            startEventLogger(client);

            LOGGER.info("Market sync running. Press Ctrl+C to shutdown.");
            shutdownBarrier.await();
        } catch (Exception e) {
            LOGGER.error("Fatal error in Market Sync", e);
            CloseHelper.closeAll(metricsServer, client);
            System.exit(1);
        }

        CloseHelper.closeAll(metricsServer, client);
        LOGGER.info("Market Sync exited");
    }

    private static void subscribeFromEnv(MarketSyncClient client) {
        List<String> books = idsFromEnv("MARKETSYNC_BOOKS");
        if (!books.isEmpty()) {
            client.subscribeBookUpdates(books);
        }
        List<String> trades = idsFromEnv("MARKETSYNC_TRADES");
        if (!trades.isEmpty()) {
            client.subscribeTrades(trades);
        }
        List<String> tickers = idsFromEnv("MARKETSYNC_TICKERS");
        if (!tickers.isEmpty()) {
            client.subscribeTicker(tickers);
        }
        String user = System.getenv("MARKETSYNC_USER");
        if (user != null && !user.isBlank()) {
            client.subscribeUser(user.trim());
        }
        LOGGER.info("Subscribed: {}", client.subscriptions());
    }

    private static List<String> idsFromEnv(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static void startEventLogger(MarketSyncClient client) {
        Thread thread = new Thread(() -> {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    SyncEvent event = client.events().poll(1, TimeUnit.SECONDS);
                    if (event != null) {
                        logEvent(client, event);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }, "marketsync-events");
        thread.setDaemon(true);
        thread.start();
    }

    private static void logEvent(MarketSyncClient client, SyncEvent event) {
        if (event instanceof SyncEvent.BookUpdated updated) {
            client.orderBook(updated.orderbookId()).ifPresent(MarketSyncApp::logBook);
        } else if (event instanceof SyncEvent.ErrorRaised error) {
            LOGGER.warn("Error: {} {}", error.error().kind(), error.error().message());
        } else {
            LOGGER.info("Event: {}", event);
        }
    }

    private static void logBook(OrderBookState book) {
        LOGGER.info("{} seq={} bid={} ask={} mid={}",
            book.orderbookId(),
            book.expectedSequence() - 1,
            book.bestBid().map(Object::toString).orElse("-"),
            book.bestAsk().map(Object::toString).orElse("-"),
            book.midpoint().map(Object::toString).orElse("-"));
    }
}
