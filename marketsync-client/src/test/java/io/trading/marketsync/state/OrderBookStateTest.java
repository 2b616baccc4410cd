package io.trading.marketsync.state;

import io.trading.marketsync.protocol.model.BookUpdate;
import io.trading.marketsync.protocol.model.PriceLevel;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OrderBookState.
 */
class OrderBookStateTest {

    private static final String BOOK = "ob-1";

    private static BigDecimal dec(String value) {
        return new BigDecimal(value);
    }

    private static void assertDecimal(String expected, BigDecimal actual) {
        assertEquals(0, dec(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }

    private static OrderBookState seededBook() {
        OrderBookState book = new OrderBookState(BOOK);
        book.apply(BookUpdate.snapshot(BOOK, 0,
            List.of(PriceLevel.of("0.50", "0.0010"), PriceLevel.of("0.49", "0.0020")),
            List.of(PriceLevel.of("0.51", "0.0005"))));
        return book;
    }

    @Test
    void testSnapshotSetsLevelsAndSequence() {
        OrderBookState book = seededBook();

        assertTrue(book.hasSnapshot());
        assertEquals(1, book.expectedSequence());
        assertDecimal("0.50", book.bestBid().orElseThrow().price());
        assertDecimal("0.51", book.bestAsk().orElseThrow().price());
        assertDecimal("0.01", book.spread().orElseThrow());
        assertDecimal("0.505", book.midpoint().orElseThrow());
        assertEquals(2, book.bidCount());
        assertEquals(1, book.askCount());
    }

    @Test
    void testDeltaRemovingLastAskEmptiesSide() {
        OrderBookState book = seededBook();

        Optional<SequenceGap> gap = book.apply(BookUpdate.delta(BOOK, 1,
            List.of(), List.of(PriceLevel.of("0.51", "0"))));

        assertTrue(gap.isEmpty());
        assertTrue(book.bestAsk().isEmpty());
        assertTrue(book.spread().isEmpty());
        assertTrue(book.midpoint().isEmpty());
        assertEquals(2, book.expectedSequence());
    }

    @Test
    void testDeltaUpsertsLevels() {
        OrderBookState book = seededBook();

        book.apply(BookUpdate.delta(BOOK, 1,
            List.of(PriceLevel.of("0.50", "0.0030"), PriceLevel.of("0.495", "0.0001")),
            List.of(PriceLevel.of("0.52", "0.0100"))));

        assertEquals(3, book.bidCount());
        assertDecimal("0.0030", book.bestBid().orElseThrow().size());
        assertEquals(List.of(dec("0.50"), dec("0.495"), dec("0.49")), List.copyOf(book.bids().keySet()));
        assertDecimal("0.51", book.bestAsk().orElseThrow().price());
        assertDecimal("0.0105", book.totalAskDepth());
    }

    @Test
    void testSequenceGapLeavesBookUntouched() {
        OrderBookState book = seededBook();
        OrderBookState before = book.copy();

        Optional<SequenceGap> gap = book.apply(BookUpdate.delta(BOOK, 5,
            List.of(PriceLevel.of("0.40", "1")), List.of()));

        assertTrue(gap.isPresent());
        assertEquals(1, gap.get().expected());
        assertEquals(5, gap.get().received());
        assertEquals(before.bids(), book.bids());
        assertEquals(before.asks(), book.asks());
        assertEquals(1, book.expectedSequence());
    }

    @Test
    void testSnapshotSkipsZeroSizeLevels() {
        OrderBookState book = new OrderBookState(BOOK);
        book.apply(BookUpdate.snapshot(BOOK, 10,
            List.of(PriceLevel.of("0.30", "0"), PriceLevel.of("0.29", "2")),
            List.of(PriceLevel.of("0.31", "0.000"))));

        assertEquals(1, book.bidCount());
        assertEquals(0, book.askCount());
        assertEquals(11, book.expectedSequence());
    }

    @Test
    void testSnapshotReplacesPreviousLevels() {
        OrderBookState book = seededBook();

        book.apply(BookUpdate.snapshot(BOOK, 40,
            List.of(PriceLevel.of("0.10", "1")), List.of(PriceLevel.of("0.90", "1"))));

        assertEquals(1, book.bidCount());
        assertEquals(1, book.askCount());
        assertDecimal("0.10", book.bestBid().orElseThrow().price());
        assertEquals(41, book.expectedSequence());
    }

    @Test
    void testClearRequiresNewSnapshot() {
        OrderBookState book = seededBook();

        book.clear();

        assertTrue(book.isEmpty());
        assertFalse(book.hasSnapshot());
        assertEquals(0, book.expectedSequence());
    }

    @Test
    void testCopyIsIndependent() {
        OrderBookState book = seededBook();
        OrderBookState copy = book.copy();

        book.apply(BookUpdate.delta(BOOK, 1, List.of(PriceLevel.of("0.50", "0")), List.of()));

        assertEquals(2, copy.bidCount());
        assertEquals(1, book.bidCount());
    }

    @Test
    void testTopLevels() {
        OrderBookState book = seededBook();

        List<PriceLevel> topBids = book.topBids(1);
        assertEquals(1, topBids.size());
        assertDecimal("0.50", topBids.get(0).price());
        assertEquals(2, book.topBids(10).size());
        assertDecimal("0.0030", book.totalBidDepth());
    }

    @Test
    void testRandomDeltasMatchReplayedMaps() {
        Random random = new Random(42);
        OrderBookState book = new OrderBookState(BOOK);
        TreeMap<BigDecimal, BigDecimal> bids = new TreeMap<>();
        TreeMap<BigDecimal, BigDecimal> asks = new TreeMap<>();

        book.apply(BookUpdate.snapshot(BOOK, 0, List.of(), List.of()));
        for (long seq = 1; seq <= 500; seq++) {
            PriceLevel bid = randomLevel(random, 0);
            PriceLevel ask = randomLevel(random, 50);
            book.apply(BookUpdate.delta(BOOK, seq, List.of(bid), List.of(ask)));
            replay(bids, bid);
            replay(asks, ask);
        }

        assertEquals(bids, new TreeMap<>(book.bids()));
        assertEquals(asks, new TreeMap<>(book.asks()));
        assertEquals(501, book.expectedSequence());
    }

    private static PriceLevel randomLevel(Random random, int offset) {
        BigDecimal price = BigDecimal.valueOf(offset + random.nextInt(20), 2);
        BigDecimal size = random.nextInt(3) == 0 ? BigDecimal.ZERO : BigDecimal.valueOf(1 + random.nextInt(100), 3);
        return new PriceLevel(price, size);
    }

    private static void replay(TreeMap<BigDecimal, BigDecimal> side, PriceLevel level) {
        if (level.size().signum() == 0) {
            side.remove(level.price());
        } else {
            side.put(level.price(), level.size());
        }
    }
}
