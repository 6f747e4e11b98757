package io.trading.marketstream.exchange.binance;

import com.sun.net.httpserver.HttpServer;
import io.trading.marketstream.parser.api.DecodeException;
import io.trading.marketstream.parser.impl.binance.BinanceMarketDataDecoder;
import io.trading.marketstream.parser.model.OrderBook;
import io.trading.marketstream.parser.model.Symbol;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BinanceDepthSnapshotSource against a local HTTP server.
 */
class BinanceDepthSnapshotSourceTest {

    private HttpServer server;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String body = "";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/v3/depth", exchange -> {
            lastQuery.set(exchange.getRequestURI().getQuery());
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            if (bytes.length > 0) {
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(bytes);
                }
            }
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private BinanceDepthSnapshotSource source() {
        URI base = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
        return new BinanceDepthSnapshotSource(base, new BinanceMarketDataDecoder());
    }

    @Test
    void testFetchesAndDecodesSnapshot() throws Exception {
        body = """
            {"lastUpdateId":160,"bids":[["100.0","1.0"]],"asks":[["101.0","2.0"]]}
            """;

        OrderBook book = source().fetchSnapshot(Symbol.of("BTCUSDT"), 100).get(5, TimeUnit.SECONDS);

        assertEquals("symbol=BTCUSDT&limit=100", lastQuery.get());
        assertEquals(160L, book.lastUpdateId());
        assertEquals(1, book.bidDepth());
    }

    @Test
    void testHttpErrorFailsFuture() {
        status = 429;
        body = "{\"code\":-1003,\"msg\":\"Too many requests\"}";

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> source().fetchSnapshot(Symbol.of("BTCUSDT"), 10).get(5, TimeUnit.SECONDS));

        assertInstanceOf(IOException.class, e.getCause());
        assertTrue(e.getCause().getMessage().contains("429"));
    }

    @Test
    void testUndecodableBodyFailsFuture() {
        body = "{\"bids\":[]}";

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> source().fetchSnapshot(Symbol.of("BTCUSDT"), 10).get(5, TimeUnit.SECONDS));

        assertInstanceOf(DecodeException.class, e.getCause());
    }
}
