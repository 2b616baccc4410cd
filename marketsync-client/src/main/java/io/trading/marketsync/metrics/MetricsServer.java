package io.trading.marketsync.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.trading.marketsync.client.MarketSyncClient;
import io.trading.marketsync.protocol.api.Subscription;
import io.trading.marketsync.protocol.model.PriceLevel;
import io.trading.marketsync.state.OrderBookState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * HTTP server for exposing Prometheus metrics and client status.
 * Serves metrics, health and status endpoints.
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final MarketSyncClient client;
    private final CollectorRegistry registry;
    private final ObjectMapper objectMapper;
    private final long startTime;
    private HttpServer server;

    public MetricsServer(int port, MarketSyncClient client) {
        this.port = port;
        this.client = client;
        this.registry = client.metrics().getRegistry();
        this.objectMapper = new ObjectMapper();
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/metrics", handleMetrics());
        server.createContext("/health", handleHealth());
        server.createContext("/api/status", handleStatus());

        server.setExecutor(null);
        server.start();

        LOGGER.info("HTTP server started on port {}", port);
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", port);
        LOGGER.info("  Health:     http://localhost:{}/health", port);
        LOGGER.info("  API Status: http://localhost:{}/api/status", port);
    }

    /**
     * Port the server is bound to, useful when started on port 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                sendResponse(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (IOException | RuntimeException e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                boolean healthy = client.isConnected();
                String response = healthy ? "OK" : "DISCONNECTED (" + client.connectionState() + ")";
                sendResponse(exchange, healthy ? 200 : 503, "text/plain", response);
            } catch (IOException | RuntimeException e) {
                LOGGER.error("Error serving health", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                StatusResponse status = new StatusResponse(
                    client.url(),
                    client.connectionState().name(),
                    client.isAuthenticated(),
                    System.currentTimeMillis() - startTime,
                    client.subscriptions().stream().map(Object::toString).toList(),
                    client.events().droppedCount(),
                    bookSummaries()
                );
                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(status);
                sendResponse(exchange, 200, "application/json", response);
            } catch (IOException | RuntimeException e) {
                LOGGER.error("Error handling status request", e);
                sendResponse(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private List<BookSummary> bookSummaries() {
        return client.subscriptions().stream()
            .filter(s -> s instanceof Subscription.Books)
            .flatMap(s -> ((Subscription.Books) s).orderbookIds().stream())
            .map(id -> client.orderBook(id).map(this::summarize).orElse(new BookSummary(id, false, 0, null, null, null)))
            .toList();
    }

    private BookSummary summarize(OrderBookState book) {
        return new BookSummary(
            book.orderbookId(),
            book.hasSnapshot(),
            book.expectedSequence(),
            book.bestBid().map(PriceLevel::price).orElse(null),
            book.bestAsk().map(PriceLevel::price).orElse(null),
            book.midpoint().orElse(null)
        );
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String contentType, String response) throws IOException {
        byte[] body = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            LOGGER.info("HTTP server stopped");
        }
    }

    private record StatusResponse(String url, String state, boolean authenticated, long uptimeMs,
                                  List<String> subscriptions, long eventsDropped, List<BookSummary> books) {}
    private record BookSummary(String orderbookId, boolean hasSnapshot, long expectedSequence,
                               BigDecimal bestBid, BigDecimal bestAsk, BigDecimal midpoint) {}
}
