package io.trading.marketstream.book;

import io.trading.marketstream.parser.model.DepthDiff;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.OrderBook;
import io.trading.marketstream.parser.model.OrderBookLevel;
import io.trading.marketstream.parser.model.Symbol;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OrderBookEngine.
 */
class OrderBookEngineTest {

    private static final Symbol BTCUSDT = Symbol.of("BTCUSDT");

    private OrderBookEngine engine;

    @BeforeEach
    void setUp() {
        engine = new OrderBookEngine("Binance/BTCUSDT", 4);
    }

    private static OrderBook snapshot(long lastUpdateId) {
        return new OrderBook(Exchange.BINANCE, BTCUSDT, 1L,
            List.of(OrderBookLevel.of("100", "1")), List.of(OrderBookLevel.of("101", "1")), lastUpdateId, 0L);
    }

    private static DepthDiff diff(long first, long last) {
        return new DepthDiff(Exchange.BINANCE, BTCUSDT, 2L, first, last,
            List.of(OrderBookLevel.of("99", String.valueOf(last))), List.of());
    }

    @Test
    void testDiffsBufferUntilSnapshot() {
        assertEquals(DiffOutcome.BUFFERED, engine.onDiff(diff(95, 99)));
        assertEquals(DiffOutcome.BUFFERED, engine.onDiff(diff(100, 102)));
        assertEquals(DiffOutcome.BUFFERED, engine.onDiff(diff(103, 104)));
        assertNull(engine.current());

        assertEquals(DiffOutcome.APPLIED, engine.onSnapshot(snapshot(100)));

        assertTrue(engine.isSynced());
        assertEquals(0, engine.bufferedCount());
        assertEquals(104L, engine.current().getLastUpdateId());
    }

    @Test
    void testStaleDiffIsNoOp() {
        engine.onSnapshot(snapshot(100));
        OrderBookReplica before = engine.current();

        assertEquals(DiffOutcome.STALE, engine.onDiff(diff(90, 100)));

        assertSame(before, engine.current());
    }

    @Test
    void testOverlappingDiffApplies() {
        engine.onSnapshot(snapshot(100));

        assertEquals(DiffOutcome.APPLIED, engine.onDiff(diff(99, 101)));
        assertEquals(DiffOutcome.APPLIED, engine.onDiff(diff(102, 102)));

        assertEquals(102L, engine.current().getLastUpdateId());
    }

    @Test
    void testGapInvalidatesOnce() {
        engine.onSnapshot(snapshot(100));
        engine.onDiff(diff(101, 104));

        assertEquals(DiffOutcome.GAP, engine.onDiff(diff(106, 107)));
        assertEquals(DiffOutcome.IGNORED, engine.onDiff(diff(108, 109)));
        assertEquals(DiffOutcome.IGNORED, engine.onDiff(diff(110, 111)));

        assertEquals(OrderBookEngine.State.INVALIDATED, engine.getState());
        assertEquals(1L, engine.getGapCount());
        assertNull(engine.current());
    }

    @Test
    void testGapWhileReplayingBuffer() {
        engine.onDiff(diff(105, 106));

        assertEquals(DiffOutcome.GAP, engine.onSnapshot(snapshot(100)));

        assertEquals(OrderBookEngine.State.INVALIDATED, engine.getState());
        assertNull(engine.current());
    }

    @Test
    void testBufferDropsOldestAtCapacity() {
        for (long id = 1; id <= 6; id++) {
            engine.onDiff(diff(id, id));
        }

        assertEquals(4, engine.bufferedCount());
    }

    @Test
    void testResetStartsNewRound() {
        engine.onSnapshot(snapshot(100));
        engine.onDiff(diff(200, 201));

        engine.reset();

        assertEquals(OrderBookEngine.State.AWAITING_SNAPSHOT, engine.getState());
        assertEquals(DiffOutcome.BUFFERED, engine.onDiff(diff(300, 301)));
        assertEquals(DiffOutcome.APPLIED, engine.onSnapshot(snapshot(300)));
        assertEquals(301L, engine.current().getLastUpdateId());
    }

    @Test
    void testSnapshotRequestedOncePerRound() {
        assertTrue(engine.markSnapshotRequested());
        assertFalse(engine.markSnapshotRequested());

        engine.onSnapshot(snapshot(1));
        assertFalse(engine.markSnapshotRequested());

        engine.reset();
        assertTrue(engine.markSnapshotRequested());
    }

    @Test
    void testSnapshotReplacesSyncedBook() {
        engine.onSnapshot(snapshot(100));
        engine.onDiff(diff(101, 101));

        assertEquals(DiffOutcome.APPLIED, engine.onSnapshot(snapshot(500)));

        assertEquals(500L, engine.current().getLastUpdateId());
        assertEquals(1L, engine.current().getSequence());
    }
}
