package io.trading.marketstream.client;

import io.prometheus.client.CollectorRegistry;
import io.trading.marketstream.channel.ReceiveChannel;
import io.trading.marketstream.config.ClientConfig;
import io.trading.marketstream.config.StreamConfig;
import io.trading.marketstream.exchange.ExchangeRegistry;
import io.trading.marketstream.metrics.StreamMetrics;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.KlineInterval;
import io.trading.marketstream.parser.model.OrderBook;
import io.trading.marketstream.parser.model.Symbol;
import io.trading.marketstream.parser.model.Trade;
import io.trading.marketstream.stream.MarketStream;
import io.trading.marketstream.stream.StreamContext;
import io.trading.marketstream.stream.StreamState;
import io.trading.marketstream.stream.StreamSubscription;
import io.trading.marketstream.support.FakeConnection;
import io.trading.marketstream.support.FakeTransport;
import io.trading.marketstream.support.TestAwait;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarketDataClient on a fake transport.
 */
class MarketDataClientTest {

    private static final Symbol BTCUSDT = Symbol.of("BTCUSDT");

    private FakeTransport transport;
    private MarketDataClient client;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        ClientConfig config = ClientConfig.builder()
            .exchange(Exchange.BYBIT)
            .stream(StreamConfig.builder().baseDelay(Duration.ofMillis(20)).maxDelay(Duration.ofMillis(100)).build())
            .build();
        client = new MarketDataClient(config, ExchangeRegistry.withDefaults(), transport,
            new StreamMetrics(new CollectorRegistry()));
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    @Test
    void testTradeAndBookStreamsShareTheClient() throws Exception {
        MarketStream<Trade> trades = client.tradeStream(BTCUSDT);
        MarketStream<OrderBook> books = client.orderBookStream(BTCUSDT, 1);

        ReceiveChannel<Trade> tradeData = trades.subscribe(StreamContext.background());
        ReceiveChannel<OrderBook> bookData = books.subscribe(StreamContext.background());
        TestAwait.until(() -> transport.connections().size() == 2, "market and depth connections");
        TestAwait.until(() -> trades.state() == StreamState.ACTIVE, "trades active");

        FakeConnection depth = transport.connections().stream()
            .filter(c -> c.getName().contains("depth"))
            .findFirst()
            .orElseThrow();
        TestAwait.until(() -> depth.sentContaining("orderbook.1.BTCUSDT") == 1, "book subscribed");
        depth.push("""
            {"topic":"orderbook.1.BTCUSDT","type":"snapshot","ts":1,"data":{"s":"BTCUSDT","b":[["100","1"]],"a":[["101","1"]],"u":3}}
            """);

        OrderBook book = bookData.poll(Duration.ofSeconds(5));
        assertNotNull(book);
        assertEquals(3L, book.lastUpdateId());
        assertEquals(3L, client.currentBook(BTCUSDT, 1).orElseThrow().lastUpdateId());

        FakeConnection market = transport.connections().stream()
            .filter(c -> c.getName().contains("market"))
            .findFirst()
            .orElseThrow();
        market.push("""
            {"topic":"publicTrade.BTCUSDT","ts":1,"data":[{"T":1,"s":"BTCUSDT","S":"Buy","v":"0.5","p":"100.5","i":"t-1"}]}
            """);
        Trade trade = tradeData.poll(Duration.ofSeconds(5));
        assertNotNull(trade);
        assertEquals("t-1", trade.tradeId());

        Map<StreamState, Long> counts = client.stateCounts();
        assertEquals(2L, counts.get(StreamState.ACTIVE));
        assertEquals(2, client.streams().size());
        assertEquals(2, client.connectionSlotCount());
    }

    @Test
    void testCreatingAStreamDoesNotConnect() {
        client.tickerStream(BTCUSDT);

        assertEquals(0, transport.openAttempts());
        assertEquals(StreamState.IDLE, client.streams().get(0).state());
    }

    @Test
    void testInvalidParametersFailFast() {
        // Bybit publishes no 8h klines
        assertThrows(IllegalArgumentException.class, () -> client.klineStream(BTCUSDT, KlineInterval.EIGHT_HOURS));
        assertThrows(IllegalArgumentException.class, () -> client.klineStream(BTCUSDT, null));
        assertThrows(IllegalArgumentException.class, () -> client.orderBookStream(BTCUSDT, -1));
        assertThrows(IllegalArgumentException.class, () -> client.tickerStream(null));
        assertNotNull(client.klineStream(BTCUSDT, KlineInterval.FIFTEEN_MINUTES));
    }

    @Test
    void testCloseEndsStreamsAndKeepsBorrowedTransport() throws Exception {
        MarketStream<Trade> trades = client.tradeStream(BTCUSDT);
        MarketStream<Trade> idle = client.tradeStream(Symbol.of("ETHUSDT"));
        trades.subscribe(StreamContext.background());
        TestAwait.until(() -> trades.state() == StreamState.ACTIVE, "active");

        client.close();

        assertEquals(StreamState.CLOSED, trades.state());
        assertEquals(StreamState.CLOSED, idle.state());
        assertTrue(client.streams().isEmpty());
        assertFalse(transport.isClosed());
        assertThrows(IllegalStateException.class, () -> client.tickerStream(BTCUSDT));
        TestAwait.until(() -> transport.openConnectionCount() == 0, "connections closed");
    }

    @Test
    void testFinishedStreamsAreForgotten() throws Exception {
        MarketStream<Trade> trades = client.tradeStream(BTCUSDT);
        MarketStream<Trade> idle = client.tradeStream(Symbol.of("ETHUSDT"));
        trades.subscribe(StreamContext.background());
        TestAwait.until(() -> trades.state() == StreamState.ACTIVE, "active");

        trades.unsubscribe(StreamContext.background());
        ((StreamSubscription<?>) idle).closeAsync();

        TestAwait.until(() -> client.streams().isEmpty(), "streams forgotten");
        assertFalse(client.stateCounts().containsKey(StreamState.CLOSED));
        assertTrue(client.stateCounts().isEmpty());
    }

    @Test
    void testCurrentBookEmptyWithoutStream() {
        assertTrue(client.currentBook(BTCUSDT).isEmpty());
    }
}
