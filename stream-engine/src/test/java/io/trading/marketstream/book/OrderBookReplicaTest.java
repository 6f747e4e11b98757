package io.trading.marketstream.book;

import io.trading.marketstream.parser.model.DepthDiff;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.OrderBook;
import io.trading.marketstream.parser.model.OrderBookLevel;
import io.trading.marketstream.parser.model.Symbol;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OrderBookReplica.
 */
class OrderBookReplicaTest {

    private static final Symbol BTCUSDT = Symbol.of("BTCUSDT");

    private static OrderBook snapshot(long lastUpdateId, List<OrderBookLevel> bids, List<OrderBookLevel> asks) {
        return new OrderBook(Exchange.BINANCE, BTCUSDT, 1L, bids, asks, lastUpdateId, 0L);
    }

    private static DepthDiff diff(long first, long last, List<OrderBookLevel> bids, List<OrderBookLevel> asks) {
        return new DepthDiff(Exchange.BINANCE, BTCUSDT, 2L, first, last, bids, asks);
    }

    @Test
    void testDiffRemovesAndUpdatesLevels() {
        OrderBookReplica replica = OrderBookReplica.fromSnapshot(snapshot(100,
            List.of(OrderBookLevel.of("100", "1")),
            List.of(OrderBookLevel.of("101", "1"))));

        OrderBookReplica updated = replica.apply(diff(101, 102,
            List.of(OrderBookLevel.of("100", "0")),
            List.of(OrderBookLevel.of("101", "2"))));

        assertTrue(updated.getBids().isEmpty());
        assertEquals(List.of(OrderBookLevel.of("101", "2")), updated.getAsks());
        assertEquals(102L, updated.getLastUpdateId());
        assertEquals(2L, updated.getSequence());
        // the previous replica is untouched
        assertEquals(1, replica.getBids().size());
        assertEquals(100L, replica.getLastUpdateId());
    }

    @Test
    void testSnapshotIsSortedAndDropsZeroLevels() {
        OrderBookReplica replica = OrderBookReplica.fromSnapshot(snapshot(5,
            List.of(OrderBookLevel.of("98", "1"), OrderBookLevel.of("100", "1"), OrderBookLevel.of("99", "0")),
            List.of(OrderBookLevel.of("103", "1"), OrderBookLevel.of("101", "1"))));

        assertEquals(List.of(OrderBookLevel.of("100", "1"), OrderBookLevel.of("98", "1")), replica.getBids());
        assertEquals(List.of(OrderBookLevel.of("101", "1"), OrderBookLevel.of("103", "1")), replica.getAsks());
        assertEquals(1L, replica.getSequence());
    }

    @Test
    void testLastLevelInDiffWins() {
        OrderBookReplica replica = OrderBookReplica.fromSnapshot(snapshot(1, List.of(), List.of()));

        OrderBookReplica updated = replica.apply(diff(2, 2,
            List.of(OrderBookLevel.of("50", "1"), OrderBookLevel.of("50", "3")),
            List.of()));

        assertEquals(List.of(OrderBookLevel.of("50", "3")), updated.getBids());
    }

    @Test
    void testPriceScaleDoesNotSplitLevels() {
        OrderBookReplica replica = OrderBookReplica.fromSnapshot(snapshot(1,
            List.of(OrderBookLevel.of("100.00", "1")), List.of()));

        OrderBookReplica updated = replica.apply(diff(2, 2, List.of(OrderBookLevel.of("100", "0")), List.of()));

        assertTrue(updated.getBids().isEmpty());
    }

    @Test
    void testToOrderBookCarriesWatermark() {
        OrderBookReplica replica = OrderBookReplica.fromSnapshot(snapshot(10,
            List.of(OrderBookLevel.of("1", "1")), List.of(OrderBookLevel.of("2", "1"))));

        OrderBook book = replica.toOrderBook();

        assertEquals(10L, book.lastUpdateId());
        assertEquals(1L, book.sequence());
        assertEquals(BTCUSDT, book.symbol());
        assertEquals(new BigDecimal("1"), book.spread().orElseThrow());
    }

    @Test
    void testRandomDiffsKeepSidesSortedAndPositive() {
        Random random = new Random(42);
        OrderBookReplica replica = OrderBookReplica.fromSnapshot(snapshot(0, List.of(), List.of()));

        for (long id = 1; id <= 500; id++) {
            replica = replica.apply(diff(id, id, randomLevels(random, 90, 100), randomLevels(random, 101, 111)));

            assertSorted(replica.getBids(), true);
            assertSorted(replica.getAsks(), false);
            assertEquals(id, replica.getLastUpdateId());
        }
    }

    private static List<OrderBookLevel> randomLevels(Random random, int minPrice, int maxPrice) {
        List<OrderBookLevel> levels = new ArrayList<>();
        int count = random.nextInt(5);
        for (int i = 0; i < count; i++) {
            int price = minPrice + random.nextInt(maxPrice - minPrice);
            int quantity = random.nextInt(3);
            levels.add(new OrderBookLevel(BigDecimal.valueOf(price), BigDecimal.valueOf(quantity)));
        }
        return levels;
    }

    private static void assertSorted(List<OrderBookLevel> levels, boolean descending) {
        for (int i = 0; i < levels.size(); i++) {
            assertTrue(levels.get(i).quantity().signum() > 0, "zero quantity level left in book");
            if (i > 0) {
                int cmp = levels.get(i - 1).price().compareTo(levels.get(i).price());
                assertTrue(descending ? cmp > 0 : cmp < 0, "levels out of order at " + i);
            }
        }
    }
}
