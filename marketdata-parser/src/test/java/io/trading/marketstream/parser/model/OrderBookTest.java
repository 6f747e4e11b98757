package io.trading.marketstream.parser.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OrderBook.
 */
class OrderBookTest {

    private static OrderBook book(List<OrderBookLevel> bids, List<OrderBookLevel> asks) {
        return new OrderBook(Exchange.BINANCE, Symbol.of("BTCUSDT"), 1L, bids, asks, 100L, 1L);
    }

    @Test
    void testBestLevelsAndSpread() {
        OrderBook book = book(
            List.of(OrderBookLevel.of("100", "1"), OrderBookLevel.of("99", "2")),
            List.of(OrderBookLevel.of("101", "1"), OrderBookLevel.of("102", "3"))
        );

        assertEquals(new BigDecimal("100"), book.bestBid().orElseThrow().price());
        assertEquals(new BigDecimal("101"), book.bestAsk().orElseThrow().price());
        assertEquals(new BigDecimal("1"), book.spread().orElseThrow());
        assertEquals(FeedKind.ORDER_BOOK, book.feedKind());
    }

    @Test
    void testEmptySideHasNoSpread() {
        OrderBook book = book(List.of(), List.of(OrderBookLevel.of("101", "1")));

        assertTrue(book.bestBid().isEmpty());
        assertTrue(book.spread().isEmpty());
        assertEquals(0, book.bidDepth());
    }

    @Test
    void testTruncate() {
        OrderBook book = book(
            List.of(OrderBookLevel.of("100", "1"), OrderBookLevel.of("99", "2"), OrderBookLevel.of("98", "2")),
            List.of(OrderBookLevel.of("101", "1"))
        );

        OrderBook top = book.truncate(2);

        assertEquals(2, top.bidDepth());
        assertEquals(1, top.askDepth());
        assertEquals(new BigDecimal("99"), top.bids().get(1).price());
        assertEquals(book.lastUpdateId(), top.lastUpdateId());
        assertSame(book, book.truncate(0));
        assertSame(book, book.truncate(5));
        assertThrows(IllegalArgumentException.class, () -> book.truncate(-1));
    }

    @Test
    void testLevelsAreCopied() {
        ArrayList<OrderBookLevel> bids = new ArrayList<>();
        bids.add(OrderBookLevel.of("100", "1"));
        OrderBook book = book(bids, List.of());

        bids.clear();

        assertEquals(1, book.bidDepth());
        assertThrows(UnsupportedOperationException.class, () -> book.bids().clear());
    }
}
