package io.trading.marketstream.client;

import io.trading.marketstream.config.ClientConfig;
import io.trading.marketstream.exchange.ExchangeAdapter;
import io.trading.marketstream.exchange.ExchangeAdapterFactory;
import io.trading.marketstream.exchange.ExchangeRegistry;
import io.trading.marketstream.metrics.StreamMetrics;
import io.trading.marketstream.mux.Multiplexer;
import io.trading.marketstream.netty.NettyWebSocketTransport;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.FeedKind;
import io.trading.marketstream.parser.model.Kline;
import io.trading.marketstream.parser.model.KlineInterval;
import io.trading.marketstream.parser.model.OrderBook;
import io.trading.marketstream.parser.model.Symbol;
import io.trading.marketstream.parser.model.Ticker;
import io.trading.marketstream.parser.model.Trade;
import io.trading.marketstream.stream.MarketStream;
import io.trading.marketstream.stream.StreamState;
import io.trading.marketstream.stream.StreamSubscription;
import io.trading.marketstream.stream.SubscriptionHandle;
import io.trading.marketstream.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for market data streams of one exchange.
 *
 * <p>Streams created here share the client's connections, timers and metrics. Creating a stream
 * does not connect; {@link MarketStream#subscribe} does.
 */
public class MarketDataClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarketDataClient.class);
    private static final long CLOSE_TIMEOUT_MS = 5000;

    private final ClientConfig config;
    private final ExchangeAdapter adapter;
    private final Transport transport;
    private final boolean ownsTransport;
    private final StreamMetrics metrics;
    private final Multiplexer multiplexer;
    private final ScheduledExecutorService timers;
    private final List<StreamSubscription<?>> streams = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a client with the built-in exchanges, a Netty transport and metrics in the
     * default Prometheus registry.
     */
    public MarketDataClient(ClientConfig config) {
        this(config, ExchangeRegistry.withDefaults(), new StreamMetrics());
    }

    public MarketDataClient(ClientConfig config, ExchangeRegistry registry, StreamMetrics metrics) {
        this(config, registry, newTransport(config, registry.factory(config.exchange())), true, metrics);
    }

    /**
     * Creates a client on a caller-provided transport, which the client does not close.
     */
    public MarketDataClient(ClientConfig config, ExchangeRegistry registry, Transport transport, StreamMetrics metrics) {
        this(config, registry, transport, false, metrics);
    }

    private MarketDataClient(
        ClientConfig config,
        ExchangeRegistry registry,
        Transport transport,
        boolean ownsTransport,
        StreamMetrics metrics
    ) {
        this.config = config;
        this.transport = transport;
        this.ownsTransport = ownsTransport;
        this.metrics = metrics;
        this.adapter = registry.create(config.exchange(), transport, config.testnet());
        this.multiplexer = new Multiplexer(adapter, config.stream(), metrics);
        AtomicInteger timerThreads = new AtomicInteger();
        this.timers = Executors.newScheduledThreadPool(2, r -> {
            Thread thread = new Thread(r, "stream-timer-" + timerThreads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        LOGGER.info("[{}] Market data client created (testnet={})", config.exchange().getDisplayName(), config.testnet());
    }

    private static Transport newTransport(ClientConfig config, ExchangeAdapterFactory factory) {
        return new NettyWebSocketTransport(
            config.transportThreads(),
            config.stream().connectTimeout(),
            factory.supportsCompression()
        );
    }

    public MarketStream<Ticker> tickerStream(Symbol symbol) {
        return newStream(FeedKind.TICKER, symbol, null, Ticker.class);
    }

    public MarketStream<Trade> tradeStream(Symbol symbol) {
        return newStream(FeedKind.TRADE, symbol, null, Trade.class);
    }

    public MarketStream<Kline> klineStream(Symbol symbol, KlineInterval interval) {
        if (interval == null) {
            throw new IllegalArgumentException("interval cannot be null");
        }
        return newStream(FeedKind.KLINE, symbol, interval.code(), Kline.class);
    }

    /**
     * Creates an order book stream delivering a consistent book after every applied update.
     *
     * @param depth levels per side to deliver, 0 for the full book
     */
    public MarketStream<OrderBook> orderBookStream(Symbol symbol, int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be non-negative, got " + depth);
        }
        return newStream(FeedKind.ORDER_BOOK, symbol, depthParameter(depth), OrderBook.class);
    }

    /**
     * Returns the latest consistent full book of a symbol while an order book stream for it is live.
     */
    public Optional<OrderBook> currentBook(Symbol symbol) {
        return currentBook(symbol, 0);
    }

    /**
     * Returns the latest consistent book of a symbol, truncated to {@code depth} levels.
     */
    public Optional<OrderBook> currentBook(Symbol symbol, int depth) {
        return multiplexer.currentBook(symbol, depthParameter(depth))
            .map(replica -> replica.toOrderBook().truncate(depth));
    }

    private static String depthParameter(int depth) {
        return depth > 0 ? String.valueOf(depth) : null;
    }

    private <T> MarketStream<T> newStream(FeedKind feedKind, Symbol symbol, String parameter, Class<T> eventType) {
        if (closed.get()) {
            throw new IllegalStateException("client is closed");
        }
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        // fails fast on parameters the exchange has no topic for
        adapter.protocol().topic(feedKind, symbol, parameter);

        SubscriptionHandle handle = SubscriptionHandle.create(config.exchange(), feedKind, symbol, parameter);
        StreamSubscription<T> stream = new StreamSubscription<>(
            handle, eventType, multiplexer, config.stream(), metrics, timers);
        streams.add(stream);
        stream.done().thenRun(() -> streams.remove(stream));
        return stream;
    }

    /**
     * Returns every stream created by this client that is not closed yet.
     */
    public List<MarketStream<?>> streams() {
        List<MarketStream<?>> open = new ArrayList<>();
        for (StreamSubscription<?> stream : streams) {
            if (stream.state() != StreamState.CLOSED) {
                open.add(stream);
            }
        }
        return open;
    }

    /**
     * Counts streams per lifecycle state.
     */
    public Map<StreamState, Long> stateCounts() {
        Map<StreamState, Long> counts = new EnumMap<>(StreamState.class);
        for (StreamSubscription<?> stream : streams) {
            counts.merge(stream.state(), 1L, Long::sum);
        }
        return counts;
    }

    public Exchange getExchange() {
        return config.exchange();
    }

    public StreamMetrics getMetrics() {
        return metrics;
    }

    public int connectionSlotCount() {
        return multiplexer.slotCount();
    }

    /**
     * Closes every stream, then releases connections, timers and the transport if owned.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (StreamSubscription<?> stream : streams) {
            stream.closeAsync();
            pending.add(stream.done());
        }
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .get(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while closing streams");
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("Streams did not close within {} ms", CLOSE_TIMEOUT_MS);
        }
        multiplexer.close();
        timers.shutdownNow();
        if (ownsTransport) {
            transport.close();
        }
        LOGGER.info("[{}] Market data client closed", config.exchange().getDisplayName());
    }
}
