package io.trading.marketstream;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.hotspot.DefaultExports;
import io.trading.marketstream.channel.ReceiveChannel;
import io.trading.marketstream.client.MarketDataClient;
import io.trading.marketstream.config.ClientConfig;
import io.trading.marketstream.exchange.ExchangeRegistry;
import io.trading.marketstream.metrics.MetricsServer;
import io.trading.marketstream.metrics.StreamMetrics;
import io.trading.marketstream.parser.model.OrderBook;
import io.trading.marketstream.parser.model.Symbol;
import io.trading.marketstream.parser.model.Ticker;
import io.trading.marketstream.stream.MarketStream;
import io.trading.marketstream.stream.StreamContext;
import io.trading.marketstream.stream.StreamException;
import io.trading.marketstream.stream.StreamState;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Console application: streams tickers and order books for the configured symbols and logs them.
 */
public class MarketStreamApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarketStreamApp.class);
    private static final int BOOK_DEPTH = 10;

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Market Stream Starting...");
        LOGGER.info("========================================");

        MetricsServer metricsServer = null;
        MarketDataClient client = null;
        try {
            ClientConfig config = ClientConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Exchange: {} (testnet={})", config.exchange().getDisplayName(), config.testnet());
            LOGGER.info("  Symbols: {}", config.symbols());
            LOGGER.info("  Stream: {}", config.stream());

            CollectorRegistry registry = CollectorRegistry.defaultRegistry;
            DefaultExports.register(registry);
            client = new MarketDataClient(config, ExchangeRegistry.withDefaults(), new StreamMetrics(registry));

            if (config.metricsPort() > 0) {
                MarketDataClient observed = client;
                metricsServer = new MetricsServer(config.metricsPort(), registry, () -> health(observed));
                metricsServer.start();
            }

            StreamContext ctx = StreamContext.background().withCancel();
            List<Thread> readers = new ArrayList<>();
            for (Symbol symbol : config.symbols()) {
                MarketStream<Ticker> tickers = client.tickerStream(symbol);
                readers.add(startReader(tickers, ctx, ticker -> LOGGER.info("{} last={} bid={} ask={} spread={}",
                    ticker.symbol(), ticker.lastPrice(), ticker.bidPrice(), ticker.askPrice(), ticker.spread())));

                MarketStream<OrderBook> books = client.orderBookStream(symbol, BOOK_DEPTH);
                readers.add(startReader(books, ctx, book -> LOGGER.debug("{} book #{} bestBid={} bestAsk={}",
                    book.symbol(), book.lastUpdateId(), book.bestBid().orElse(null), book.bestAsk().orElse(null))));
            }

            ShutdownSignalBarrier shutdownBarrier = new ShutdownSignalBarrier();
            LOGGER.info("Market Stream running, press Ctrl+C to stop");
            shutdownBarrier.await();

            LOGGER.info("Shutdown signal received");
            ctx.cancel();
            for (Thread reader : readers) {
                reader.join(1000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted");
        } catch (Exception e) {
            LOGGER.error("Fatal error in Market Stream", e);
            CloseHelper.quietCloseAll(metricsServer, client);
            System.exit(1);
        }

        CloseHelper.closeAll(metricsServer, client);
        LOGGER.info("Market Stream exited");
    }

    private static <T> Thread startReader(MarketStream<T> stream, StreamContext ctx, Consumer<T> onItem) {
        ReceiveChannel<T> data = stream.subscribe(ctx);
        String name = stream.handle().name();
        Thread reader = new Thread(() -> {
            try {
                T item;
                while ((item = data.receive()) != null) {
                    onItem.accept(item);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            StreamException error;
            while ((error = stream.errors().tryReceive()) != null) {
                LOGGER.warn("{}: {}", name, error.getMessage());
            }
            LOGGER.info("{}: Stream ended", name);
        }, "reader-" + name);
        reader.setDaemon(true);
        reader.start();
        return reader;
    }

    private static MetricsServer.HealthStatus health(MarketDataClient client) {
        Map<String, Long> streams = new LinkedHashMap<>();
        client.stateCounts().forEach((state, count) -> streams.put(state.name(), count));
        long total = streams.values().stream().mapToLong(Long::longValue).sum();
        long active = streams.getOrDefault(StreamState.ACTIVE.name(), 0L);
        boolean healthy = total > 0 && active == total;
        String message = healthy ? "All streams active" : active + " of " + total + " streams active";
        return new MetricsServer.HealthStatus(healthy, message, streams);
    }
}
