package io.trading.marketsync.config;

/**
 * Configuration for a market sync client.
 *
 * @param url                    WebSocket endpoint, {@code ws://} or {@code wss://}
 * @param reconnectAttempts      Reconnect attempts before giving up
 * @param baseDelayMs            Backoff cap for the first reconnect attempt
 * @param maxDelayMs             Upper bound of the backoff cap
 * @param pingIntervalMs         Interval between liveness pings
 * @param pongTimeoutMs          Time without a pong after which the connection is considered dead
 * @param connectTimeoutMs       Deadline for establishing a connection
 * @param autoReconnect          Whether to reconnect after an unexpected close
 * @param autoResubscribe        Whether to replay subscriptions after a reconnect
 * @param eventChannelCapacity   Pending events kept before the oldest is dropped
 * @param commandChannelCapacity Pending commands accepted before callers are rejected, enforced exactly
 * @param authToken              Token sent as {@code auth_token} cookie, may be null
 * @param gapPolicy              Reaction to sequence gaps
 */
public record SyncConfig(
    String url,
    int reconnectAttempts,
    long baseDelayMs,
    long maxDelayMs,
    long pingIntervalMs,
    long pongTimeoutMs,
    long connectTimeoutMs,
    boolean autoReconnect,
    boolean autoResubscribe,
    int eventChannelCapacity,
    int commandChannelCapacity,
    String authToken,
    GapPolicy gapPolicy
) {
    public static final String DEFAULT_URL = "wss://tws.lightcone.xyz/ws";

    private static final int DEFAULT_RECONNECT_ATTEMPTS = 10;
    private static final long DEFAULT_BASE_DELAY_MS = 1000;
    private static final long DEFAULT_MAX_DELAY_MS = 30000;
    private static final long DEFAULT_PING_INTERVAL_MS = 30000;
    private static final long DEFAULT_PONG_TIMEOUT_MS = 60000;
    private static final long DEFAULT_CONNECT_TIMEOUT_MS = 30000;
    private static final int DEFAULT_EVENT_CHANNEL_CAPACITY = 1000;
    private static final int DEFAULT_COMMAND_CHANNEL_CAPACITY = 100;

    public SyncConfig {
        if (url == null || url.isEmpty()) {
            throw new IllegalArgumentException("url cannot be null or empty");
        }
        if (reconnectAttempts < 0) {
            throw new IllegalArgumentException("reconnectAttempts cannot be negative");
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs cannot be smaller than baseDelayMs");
        }
        if (pingIntervalMs <= 0) {
            throw new IllegalArgumentException("pingIntervalMs must be positive");
        }
        if (pongTimeoutMs <= 0) {
            throw new IllegalArgumentException("pongTimeoutMs must be positive");
        }
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("connectTimeoutMs must be positive");
        }
        if (eventChannelCapacity <= 0) {
            throw new IllegalArgumentException("eventChannelCapacity must be positive");
        }
        if (commandChannelCapacity <= 0) {
            throw new IllegalArgumentException("commandChannelCapacity must be positive");
        }
        if (gapPolicy == null) {
            gapPolicy = GapPolicy.NOTIFY;
        }
    }

    /**
     * Returns a copy of this configuration carrying the given auth token.
     */
    public SyncConfig withAuthToken(String token) {
        return new SyncConfig(
            url,
            reconnectAttempts,
            baseDelayMs,
            maxDelayMs,
            pingIntervalMs,
            pongTimeoutMs,
            connectTimeoutMs,
            autoReconnect,
            autoResubscribe,
            eventChannelCapacity,
            commandChannelCapacity,
            token,
            gapPolicy
        );
    }

    public static SyncConfig defaults() {
        return builder().build();
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - MARKETSYNC_URL: WebSocket endpoint (default: wss://tws.lightcone.xyz/ws)
     * - MARKETSYNC_RECONNECT_ATTEMPTS: Reconnect attempts (default: 10)
     * - MARKETSYNC_BASE_DELAY_MS / MARKETSYNC_MAX_DELAY_MS: Backoff bounds (default: 1000 / 30000)
     * - MARKETSYNC_PING_INTERVAL_MS / MARKETSYNC_PONG_TIMEOUT_MS: Liveness (default: 30000 / 60000)
     * - MARKETSYNC_CONNECT_TIMEOUT_MS: Connect deadline (default: 30000)
     * - MARKETSYNC_AUTO_RECONNECT / MARKETSYNC_AUTO_RESUBSCRIBE: true or false (default: true)
     * - MARKETSYNC_EVENT_CAPACITY / MARKETSYNC_COMMAND_CAPACITY: Channel sizes (default: 1000 / 100)
     * - MARKETSYNC_AUTH_TOKEN: Optional auth token
     * - MARKETSYNC_GAP_POLICY: notify or resubscribe (default: notify)
     */
    public static SyncConfig fromEnv() {
        String url = System.getenv("MARKETSYNC_URL");
        if (url == null || url.isEmpty()) {
            url = DEFAULT_URL;
        }

        String authToken = System.getenv("MARKETSYNC_AUTH_TOKEN");
        if (authToken != null && authToken.isBlank()) {
            authToken = null;
        }

        return new SyncConfig(
            url,
            parseIntEnv("MARKETSYNC_RECONNECT_ATTEMPTS", DEFAULT_RECONNECT_ATTEMPTS),
            parseLongEnv("MARKETSYNC_BASE_DELAY_MS", DEFAULT_BASE_DELAY_MS),
            parseLongEnv("MARKETSYNC_MAX_DELAY_MS", DEFAULT_MAX_DELAY_MS),
            parseLongEnv("MARKETSYNC_PING_INTERVAL_MS", DEFAULT_PING_INTERVAL_MS),
            parseLongEnv("MARKETSYNC_PONG_TIMEOUT_MS", DEFAULT_PONG_TIMEOUT_MS),
            parseLongEnv("MARKETSYNC_CONNECT_TIMEOUT_MS", DEFAULT_CONNECT_TIMEOUT_MS),
            parseBooleanEnv("MARKETSYNC_AUTO_RECONNECT", true),
            parseBooleanEnv("MARKETSYNC_AUTO_RESUBSCRIBE", true),
            parseIntEnv("MARKETSYNC_EVENT_CAPACITY", DEFAULT_EVENT_CHANNEL_CAPACITY),
            parseIntEnv("MARKETSYNC_COMMAND_CAPACITY", DEFAULT_COMMAND_CHANNEL_CAPACITY),
            authToken,
            GapPolicy.fromString(System.getenv("MARKETSYNC_GAP_POLICY"))
        );
    }

    private static int parseIntEnv(String key, int defaultValue) {
        return (int) parseLongEnv(key, defaultValue);
    }

    private static long parseLongEnv(String key, long defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + " value: " + value, e);
        }
    }

    private static boolean parseBooleanEnv(String key, boolean defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Creates a new builder for SyncConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for SyncConfig.
     */
    public static class Builder {
        private String url = DEFAULT_URL;
        private int reconnectAttempts = DEFAULT_RECONNECT_ATTEMPTS;
        private long baseDelayMs = DEFAULT_BASE_DELAY_MS;
        private long maxDelayMs = DEFAULT_MAX_DELAY_MS;
        private long pingIntervalMs = DEFAULT_PING_INTERVAL_MS;
        private long pongTimeoutMs = DEFAULT_PONG_TIMEOUT_MS;
        private long connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
        private boolean autoReconnect = true;
        private boolean autoResubscribe = true;
        private int eventChannelCapacity = DEFAULT_EVENT_CHANNEL_CAPACITY;
        private int commandChannelCapacity = DEFAULT_COMMAND_CHANNEL_CAPACITY;
        private String authToken;
        private GapPolicy gapPolicy = GapPolicy.NOTIFY;

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder reconnectAttempts(int reconnectAttempts) {
            this.reconnectAttempts = reconnectAttempts;
            return this;
        }

        public Builder baseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
            return this;
        }

        public Builder maxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
            return this;
        }

        public Builder pingIntervalMs(long pingIntervalMs) {
            this.pingIntervalMs = pingIntervalMs;
            return this;
        }

        public Builder pongTimeoutMs(long pongTimeoutMs) {
            this.pongTimeoutMs = pongTimeoutMs;
            return this;
        }

        public Builder connectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder autoReconnect(boolean autoReconnect) {
            this.autoReconnect = autoReconnect;
            return this;
        }

        public Builder autoResubscribe(boolean autoResubscribe) {
            this.autoResubscribe = autoResubscribe;
            return this;
        }

        public Builder eventChannelCapacity(int eventChannelCapacity) {
            this.eventChannelCapacity = eventChannelCapacity;
            return this;
        }

        public Builder commandChannelCapacity(int commandChannelCapacity) {
            this.commandChannelCapacity = commandChannelCapacity;
            return this;
        }

        public Builder authToken(String authToken) {
            this.authToken = authToken;
            return this;
        }

        public Builder gapPolicy(GapPolicy gapPolicy) {
            this.gapPolicy = gapPolicy;
            return this;
        }

        public SyncConfig build() {
            return new SyncConfig(
                url,
                reconnectAttempts,
                baseDelayMs,
                maxDelayMs,
                pingIntervalMs,
                pongTimeoutMs,
                connectTimeoutMs,
                autoReconnect,
                autoResubscribe,
                eventChannelCapacity,
                commandChannelCapacity,
                authToken,
                gapPolicy
            );
        }
    }
}
