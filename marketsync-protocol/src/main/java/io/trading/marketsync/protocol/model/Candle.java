package io.trading.marketsync.protocol.model;

import java.math.BigDecimal;

/**
 * OHLCV candle. Price fields are null when the interval had no trades; {@code m}, {@code bb}
 * and {@code ba} track the book rather than trades.
 *
 * @param t  Open time in Unix milliseconds
 * @param o  Open price
 * @param h  High price
 * @param l  Low price
 * @param c  Close price
 * @param v  Volume
 * @param m  Midpoint of best bid and best ask
 * @param bb Best bid
 * @param ba Best ask
 */
public record Candle(
    long t,
    BigDecimal o,
    BigDecimal h,
    BigDecimal l,
    BigDecimal c,
    BigDecimal v,
    BigDecimal m,
    BigDecimal bb,
    BigDecimal ba
) {
    public static Candle ofMidpoint(long t, BigDecimal m) {
        return new Candle(t, null, null, null, null, null, m, null, null);
    }
}
