package io.trading.marketsync.protocol.model;

import java.math.BigDecimal;

/**
 * Single price level in an order book update. A zero size means "remove this level".
 *
 * @param price Price level
 * @param size  Total size at this price level
 */
public record PriceLevel(
    BigDecimal price,
    BigDecimal size
) {
    public PriceLevel {
        if (price == null) {
            throw new IllegalArgumentException("price cannot be null");
        }
        if (size == null) {
            throw new IllegalArgumentException("size cannot be null");
        }
        if (price.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("price cannot be negative");
        }
        if (size.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("size cannot be negative");
        }
    }

    public static PriceLevel of(String price, String size) {
        return new PriceLevel(new BigDecimal(price), new BigDecimal(size));
    }

    public boolean isEmpty() {
        return size.compareTo(BigDecimal.ZERO) == 0;
    }
}
