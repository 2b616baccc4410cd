package io.trading.marketsync.connection;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Full-jitter exponential backoff: the delay for attempt {@code n} is drawn uniformly from
 * {@code [0, min(base * 2^(n-1), max)]}.
 */
public class ReconnectBackoff {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final LongUnaryOperator jitter;

    public ReconnectBackoff(long baseDelayMs, long maxDelayMs) {
        this(baseDelayMs, maxDelayMs, cap -> ThreadLocalRandom.current().nextLong(cap + 1));
    }

    /**
     * @param jitter maps the cap to a delay in {@code [0, cap]}
     */
    public ReconnectBackoff(long baseDelayMs, long maxDelayMs, LongUnaryOperator jitter) {
        if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "Invalid backoff bounds: base=" + baseDelayMs + ", max=" + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
    }

    /**
     * Upper bound of the delay for the given 1-based attempt.
     */
    public long cap(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1: " + attempt);
        }
        int shift = attempt - 1;
        // base * 2^shift overflows long well before the shift reaches 63
        if (shift >= Long.numberOfLeadingZeros(baseDelayMs) - 1) {
            return maxDelayMs;
        }
        return Math.min(baseDelayMs << shift, maxDelayMs);
    }

    public long delayMillis(int attempt) {
        long cap = cap(attempt);
        long delay = jitter.applyAsLong(cap);
        return Math.max(0, Math.min(delay, cap));
    }
}
