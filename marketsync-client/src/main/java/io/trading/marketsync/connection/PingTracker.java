package io.trading.marketsync.connection;

/**
 * Tracks outstanding liveness pings. Confined to the connection loop.
 */
public class PingTracker {

    private boolean awaitingPong;
    private long lastPongMs;
    private long lastPingMs;

    public void reset(long nowMs) {
        awaitingPong = false;
        lastPongMs = nowMs;
        lastPingMs = 0;
    }

    public void recordPing(long nowMs) {
        awaitingPong = true;
        lastPingMs = nowMs;
    }

    public void recordPong(long nowMs) {
        awaitingPong = false;
        lastPongMs = nowMs;
    }

    /**
     * True when a ping is outstanding and no pong has arrived for longer than the timeout.
     */
    public boolean isTimedOut(long nowMs, long pongTimeoutMs) {
        return awaitingPong && nowMs - lastPongMs > pongTimeoutMs;
    }

    public boolean isAwaitingPong() {
        return awaitingPong;
    }

    public long getLastPongMs() {
        return lastPongMs;
    }

    public long getLastPingMs() {
        return lastPingMs;
    }
}
