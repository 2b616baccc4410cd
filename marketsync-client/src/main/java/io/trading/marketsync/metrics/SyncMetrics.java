package io.trading.marketsync.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.Summary;
import io.trading.marketsync.connection.ConnectionState;

/**
 * Prometheus metrics of a market sync client.
 *
 * Every instance registers into its own {@link CollectorRegistry} unless one is supplied,
 * so several clients can live in one JVM.
 */
public class SyncMetrics {

    // Counters
    private final Counter framesReceived;
    private final Counter parseErrors;
    private final Counter unknownChannels;
    private final Counter sequenceGaps;
    private final Counter serverErrors;
    private final Counter reconnectAttempts;
    private final Counter rateLimited;
    private final Counter pingTimeouts;
    private final Counter eventsDropped;

    // Gauges
    private final Gauge connectionState;
    private final Gauge activeSubscriptions;

    // Summary (routing latency)
    private final Summary routeLatency;

    // Histogram (frame size distribution)
    private final Histogram frameSize;

    private final CollectorRegistry registry;

    public SyncMetrics() {
        this(new CollectorRegistry(true));
    }

    public SyncMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.framesReceived = Counter.build()
            .name("marketsync_frames_received_total")
            .help("Total number of frames received, by channel")
            .labelNames("channel")
            .register(registry);

        this.parseErrors = Counter.build()
            .name("marketsync_parse_errors_total")
            .help("Total number of frames that could not be parsed")
            .register(registry);

        this.unknownChannels = Counter.build()
            .name("marketsync_unknown_channel_frames_total")
            .help("Total number of frames with an unrecognized channel tag")
            .register(registry);

        this.sequenceGaps = Counter.build()
            .name("marketsync_sequence_gaps_total")
            .help("Total number of order book sequence gaps")
            .labelNames("orderbook_id")
            .register(registry);

        this.serverErrors = Counter.build()
            .name("marketsync_server_errors_total")
            .help("Total number of in-band server errors, by code")
            .labelNames("code")
            .register(registry);

        this.reconnectAttempts = Counter.build()
            .name("marketsync_reconnect_attempts_total")
            .help("Total number of reconnection attempts")
            .register(registry);

        this.rateLimited = Counter.build()
            .name("marketsync_rate_limited_total")
            .help("Total number of rate limit closes")
            .register(registry);

        this.pingTimeouts = Counter.build()
            .name("marketsync_ping_timeouts_total")
            .help("Total number of pong timeouts")
            .register(registry);

        this.eventsDropped = Counter.build()
            .name("marketsync_events_dropped_total")
            .help("Total number of events dropped because the event channel was full")
            .register(registry);

        this.connectionState = Gauge.build()
            .name("marketsync_connection_state")
            .help("Connection state (0 = disconnected, 1 = connecting, 2 = connected, 3 = reconnecting, 4 = disconnecting)")
            .register(registry);

        this.activeSubscriptions = Gauge.build()
            .name("marketsync_active_subscriptions")
            .help("Number of active subscriptions")
            .register(registry);

        this.routeLatency = Summary.build()
            .name("marketsync_route_latency_microseconds")
            .help("Time to decode and apply one frame, in microseconds")
            .quantile(0.5, 0.05)
            .quantile(0.99, 0.001)
            .register(registry);

        this.frameSize = Histogram.build()
            .name("marketsync_frame_size_bytes")
            .help("Inbound frame size distribution in characters")
            .buckets(100, 500, 1000, 5000, 10000, 50000)
            .register(registry);
    }

    public void recordFrame(String channel, int size) {
        framesReceived.labels(channel).inc();
        frameSize.observe(size);
    }

    public void recordParseError() {
        parseErrors.inc();
    }

    public void recordUnknownChannel() {
        unknownChannels.inc();
    }

    public void recordSequenceGap(String orderbookId) {
        sequenceGaps.labels(orderbookId).inc();
    }

    public void recordServerError(String code) {
        serverErrors.labels(code).inc();
    }

    public void recordReconnectAttempt() {
        reconnectAttempts.inc();
    }

    public void recordRateLimited() {
        rateLimited.inc();
    }

    public void recordPingTimeout() {
        pingTimeouts.inc();
    }

    public void recordEventDropped() {
        eventsDropped.inc();
    }

    public void recordRouteLatency(double micros) {
        routeLatency.observe(micros);
    }

    public void setConnectionState(ConnectionState state) {
        connectionState.set(state.ordinal());
    }

    public void setActiveSubscriptions(int count) {
        activeSubscriptions.set(count);
    }

    public double getFramesReceived(String channel) {
        return framesReceived.labels(channel).get();
    }

    public double getParseErrors() {
        return parseErrors.get();
    }

    public double getSequenceGaps(String orderbookId) {
        return sequenceGaps.labels(orderbookId).get();
    }

    public double getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    public double getRateLimited() {
        return rateLimited.get();
    }

    public double getEventsDropped() {
        return eventsDropped.get();
    }

    /**
     * Returns the CollectorRegistry for the HTTP server.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
