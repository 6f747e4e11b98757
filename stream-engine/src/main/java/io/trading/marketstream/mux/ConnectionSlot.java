package io.trading.marketstream.mux;

import io.trading.marketstream.book.DiffOutcome;
import io.trading.marketstream.book.OrderBookEngine;
import io.trading.marketstream.book.OrderBookReplica;
import io.trading.marketstream.book.SnapshotSource;
import io.trading.marketstream.config.StreamConfig;
import io.trading.marketstream.exchange.ExchangeAdapter;
import io.trading.marketstream.metrics.StreamMetrics;
import io.trading.marketstream.parser.api.DecodeException;
import io.trading.marketstream.parser.api.DecodedMessage;
import io.trading.marketstream.parser.model.DepthDiff;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.FeedKind;
import io.trading.marketstream.parser.model.MarketEvent;
import io.trading.marketstream.parser.model.OrderBook;
import io.trading.marketstream.parser.model.Symbol;
import io.trading.marketstream.stream.ErrorCode;
import io.trading.marketstream.stream.StreamException;
import io.trading.marketstream.transport.TransportConnection;
import io.trading.marketstream.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * One shared physical connection and the topics subscribed on it.
 *
 * <p>All connection state lives on a single worker thread, which is the only writer to the
 * transport connection. Subscribers never send anything themselves; they attach and detach,
 * and the slot turns that into incremental subscribe and unsubscribe requests. The connection
 * opens on the first attachment and is closed when the multiplexer retires the slot.
 *
 * <p>The slot also owns the order book engines of its depth topics.
 */
public final class ConnectionSlot {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionSlot.class);

    private enum ConnectionState {
        IDLE,
        OPENING,
        OPEN,
        CLOSED
    }

    private final String name;
    private final SlotKey key;
    private final ExchangeAdapter adapter;
    private final StreamConfig config;
    private final StreamMetrics metrics;
    private final ExecutorService worker;

    // guarded by the owning multiplexer's lock
    private final Map<String, Set<Long>> reservations = new HashMap<>();
    private boolean retired = false;

    // worker thread only
    private final Map<String, List<Attachment>> routes = new LinkedHashMap<>();
    private final Set<String> subscribed = new HashSet<>();
    private ConnectionState state = ConnectionState.IDLE;
    private TransportConnection connection;
    private long generation = 0;
    private long nextRequestId = 1;

    // read by any thread
    private final Map<String, OrderBookEngine> engines = new ConcurrentHashMap<>();
    private volatile boolean open = false;
    private volatile Set<String> subscribedView = Set.of();

    ConnectionSlot(String name, SlotKey key, ExchangeAdapter adapter, StreamConfig config, StreamMetrics metrics) {
        this.name = name;
        this.key = key;
        this.adapter = adapter;
        this.config = config;
        this.metrics = metrics;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "slot-" + name);
            thread.setDaemon(true);
            return thread;
        });
    }

    // ---- bookkeeping, called under the multiplexer lock ----

    boolean hosts(String topic) {
        return !retired && reservations.containsKey(topic);
    }

    boolean hasRoomFor(String topic) {
        return !retired && (reservations.containsKey(topic) || reservations.size() < config.maxStreamsPerConnection());
    }

    void reserve(String topic, long attachmentId) {
        reservations.computeIfAbsent(topic, t -> new HashSet<>()).add(attachmentId);
    }

    /**
     * @return true if the slot has no attachment left and is now retired
     */
    boolean release(String topic, long attachmentId) {
        Set<Long> ids = reservations.get(topic);
        if (ids == null || !ids.remove(attachmentId)) {
            return false;
        }
        if (ids.isEmpty()) {
            reservations.remove(topic);
        }
        if (reservations.isEmpty()) {
            retired = true;
            return true;
        }
        return false;
    }

    int reservedTopicCount() {
        return reservations.size();
    }

    // ---- requests, executed on the worker ----

    void attach(Attachment attachment) {
        post(() -> doAttach(attachment));
    }

    void detach(Attachment attachment) {
        post(() -> doDetach(attachment));
    }

    void ping() {
        post(this::doPing);
    }

    void forceReconnect(String reason) {
        post(() -> {
            if (state == ConnectionState.OPEN) {
                LOGGER.warn("{}: Dropping connection: {}", name, reason);
                connection.close();
            }
        });
    }

    void shutdown() {
        post(this::doShutdown);
        worker.shutdown();
    }

    private void doAttach(Attachment attachment) {
        String topic = attachment.getTopic();
        List<Attachment> targets = routes.get(topic);
        boolean newTopic = targets == null;
        if (newTopic) {
            targets = new ArrayList<>();
            routes.put(topic, targets);
        }
        targets.add(attachment);
        LOGGER.debug("{}: Attached {}", name, attachment);

        switch (state) {
            case IDLE -> openConnection();
            case OPEN -> {
                if (newTopic) {
                    subscribe(List.of(topic));
                }
                attachment.getSink().onConnected(attachment);
                OrderBookEngine engine = engines.get(topic);
                if (engine != null) {
                    if (engine.isSynced()) {
                        attachment.getSink().onBook(attachment, engine.current());
                    } else if (engine.getState() == OrderBookEngine.State.INVALIDATED) {
                        resync(topic, engine);
                    }
                }
            }
            default -> {
                // OPENING: notified when the connection is up
            }
        }
    }

    private void doDetach(Attachment attachment) {
        String topic = attachment.getTopic();
        List<Attachment> targets = routes.get(topic);
        if (targets == null || !targets.remove(attachment)) {
            return;
        }
        LOGGER.debug("{}: Detached {}", name, attachment);
        if (targets.isEmpty()) {
            routes.remove(topic);
            engines.remove(topic);
            if (state == ConnectionState.OPEN && subscribed.remove(topic)) {
                send(adapter.protocol().unsubscribeMessage(List.of(topic), nextRequestId++));
                subscribedView = Set.copyOf(subscribed);
            }
        }
    }

    private void doPing() {
        if (state != ConnectionState.OPEN) {
            return;
        }
        adapter.protocol().pingMessage().ifPresentOrElse(this::send, connection::ping);
    }

    private void doShutdown() {
        ConnectionState previous = state;
        state = ConnectionState.CLOSED;
        if (previous == ConnectionState.OPEN) {
            markClosed();
            connection.close();
        }
        connection = null;
        routes.clear();
        engines.clear();
        subscribedView = Set.of();
        LOGGER.info("{}: Closed", name);
    }

    // ---- connection lifecycle ----

    private void openConnection() {
        state = ConnectionState.OPENING;
        long attempt = ++generation;
        LOGGER.info("{}: Opening connection to {}", name, key.endpoint());
        CompletableFuture<TransportConnection> opened;
        try {
            opened = adapter.transport().open(key.endpoint(), name, new SlotListener(attempt));
        } catch (RuntimeException e) {
            opened = CompletableFuture.failedFuture(e);
        }
        opened.whenComplete((conn, error) -> {
            if (!post(() -> onOpenResult(attempt, conn, error)) && conn != null) {
                // slot shut down while the open was in flight
                conn.close();
            }
        });
    }

    private void onOpenResult(long attempt, TransportConnection conn, Throwable error) {
        if (attempt != generation || state != ConnectionState.OPENING) {
            if (conn != null) {
                conn.close();
            }
            return;
        }
        if (error != null) {
            Throwable cause = unwrap(error);
            state = ConnectionState.IDLE;
            LOGGER.warn("{}: Connection failed: {}", name, cause.toString());
            forEachAttachment(a -> a.getSink().onConnectionLost(a, cause));
            return;
        }

        connection = conn;
        state = ConnectionState.OPEN;
        open = true;
        metrics.connectionOpened(adapter.exchange());
        if (!routes.isEmpty()) {
            subscribe(new ArrayList<>(routes.keySet()));
        }
        forEachAttachment(a -> a.getSink().onConnected(a));
    }

    private void onConnectionClosed(long attempt, Throwable cause) {
        if (attempt != generation || state != ConnectionState.OPEN) {
            return;
        }
        state = ConnectionState.IDLE;
        markClosed();
        connection = null;
        subscribed.clear();
        subscribedView = Set.of();
        engines.clear();
        LOGGER.warn("{}: Connection lost{}", name, cause == null ? "" : ": " + cause);
        forEachAttachment(a -> a.getSink().onConnectionLost(a, cause));
    }

    private void markClosed() {
        open = false;
        metrics.connectionClosed(adapter.exchange());
    }

    private void subscribe(List<String> topics) {
        for (String topic : topics) {
            subscribed.add(topic);
            List<Attachment> targets = routes.get(topic);
            Attachment first = targets.get(0);
            if (first.getHandle().feedKind() == FeedKind.ORDER_BOOK) {
                engines.put(topic, new OrderBookEngine(name + "/" + topic, config.maxBufferedDiffs()));
            }
        }
        subscribedView = Set.copyOf(subscribed);
        send(adapter.protocol().subscribeMessage(topics, nextRequestId++));
        LOGGER.info("{}: Subscribed {}", name, topics);
    }

    /**
     * Starts a new synchronization round for an invalidated book.
     * Without a snapshot source the topic is re-subscribed so the exchange pushes a fresh snapshot.
     */
    private void resync(String topic, OrderBookEngine engine) {
        engine.reset();
        if (adapter.snapshotSource().isEmpty()) {
            send(adapter.protocol().unsubscribeMessage(List.of(topic), nextRequestId++));
            send(adapter.protocol().subscribeMessage(List.of(topic), nextRequestId++));
        }
        LOGGER.info("{}: Resynchronizing {}", name, topic);
    }

    private void send(String text) {
        LOGGER.debug("{}: >> {}", name, text);
        connection.send(text);
    }

    // ---- inbound ----

    private void onMessage(long attempt, String text) {
        if (attempt != generation || state != ConnectionState.OPEN) {
            return;
        }
        DecodedMessage message;
        try {
            message = adapter.decoder().decode(text);
        } catch (DecodeException e) {
            metrics.recordDecodeError(adapter.exchange());
            LOGGER.debug("{}: Undecodable message: {}", name, e.getRawMessage());
            broadcastError(ErrorCode.DECODE_FAILED, e.getMessage(), e);
            return;
        }

        switch (message.kind()) {
            case PONG -> forEachAttachment(a -> a.getSink().onPong(a));
            case CONTROL -> LOGGER.debug("{}: Control message: {}", name, message.detail());
            case REJECTED -> {
                LOGGER.warn("{}: Request rejected: {}", name, message.detail());
                broadcastError(ErrorCode.REJECTED, message.detail(), null);
            }
            case EVENT -> route(message);
        }
    }

    private void route(DecodedMessage message) {
        String topic;
        try {
            topic = adapter.protocol().topicOf(message);
        } catch (IllegalArgumentException e) {
            LOGGER.debug("{}: No topic for {} {}: {}", name, message.feedKind(), message.symbol(), e.getMessage());
            return;
        }
        List<Attachment> targets = routes.get(topic);
        if (targets == null || targets.isEmpty()) {
            LOGGER.debug("{}: No subscriber for {}", name, topic);
            return;
        }

        if (message.feedKind() == FeedKind.ORDER_BOOK) {
            OrderBookEngine engine = engines.get(topic);
            if (engine != null) {
                for (MarketEvent event : message.events()) {
                    onBookEvent(topic, engine, event);
                }
            }
            return;
        }
        for (MarketEvent event : message.events()) {
            for (Attachment attachment : targets) {
                attachment.getSink().onEvent(attachment, event);
            }
        }
    }

    private void onBookEvent(String topic, OrderBookEngine engine, MarketEvent event) {
        DiffOutcome outcome;
        if (event instanceof OrderBook snapshot) {
            outcome = engine.onSnapshot(snapshot);
        } else if (event instanceof DepthDiff diff) {
            outcome = engine.onDiff(diff);
            if (outcome == DiffOutcome.BUFFERED) {
                requestSnapshot(topic, engine, diff.symbol());
            }
        } else {
            return;
        }
        publishOutcome(topic, engine, outcome);
    }

    private void publishOutcome(String topic, OrderBookEngine engine, DiffOutcome outcome) {
        if (outcome == DiffOutcome.APPLIED) {
            OrderBookReplica replica = engine.current();
            forEachAttachment(topic, a -> a.getSink().onBook(a, replica));
        } else if (outcome == DiffOutcome.GAP) {
            metrics.recordSequenceGap(adapter.exchange());
            invalidated(topic, (exchange, stream) -> new StreamException(
                ErrorCode.SEQUENCE_GAP, exchange, stream, "sequence gap on " + topic));
        }
    }

    private void requestSnapshot(String topic, OrderBookEngine engine, Symbol symbol) {
        SnapshotSource source = adapter.snapshotSource().orElse(null);
        if (source == null || !engine.markSnapshotRequested()) {
            return;
        }
        long started = System.nanoTime();
        CompletableFuture<OrderBook> fetch;
        try {
            fetch = source.fetchSnapshot(symbol, config.snapshotDepth());
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        fetch.whenComplete((book, error) -> post(() -> onSnapshotResult(topic, engine, book, error, started)));
    }

    private void onSnapshotResult(String topic, OrderBookEngine engine, OrderBook book, Throwable error, long started) {
        if (engines.get(topic) != engine) {
            return;
        }
        metrics.recordSnapshotLatency(adapter.exchange(), System.nanoTime() - started);
        if (error != null) {
            Throwable cause = unwrap(error);
            LOGGER.warn("{}: Snapshot for {} failed: {}", name, topic, cause.toString());
            engine.invalidate();
            invalidated(topic, (exchange, stream) -> new StreamException(
                ErrorCode.SNAPSHOT_FAILED, exchange, stream, "snapshot for " + topic + " failed", cause));
            return;
        }
        publishOutcome(topic, engine, engine.onSnapshot(book));
    }

    private void invalidated(String topic, BiFunction<Exchange, String, StreamException> reason) {
        forEachAttachment(topic, a -> a.getSink().onBookInvalidated(
            a, reason.apply(adapter.exchange(), a.getHandle().name())));
    }

    private void broadcastError(ErrorCode code, String message, Throwable cause) {
        forEachAttachment(a -> a.getSink().onProtocolError(
            a, new StreamException(code, adapter.exchange(), a.getHandle().name(), message, cause)));
    }

    private void forEachAttachment(Consumer<Attachment> action) {
        for (List<Attachment> targets : routes.values()) {
            for (Attachment attachment : targets) {
                action.accept(attachment);
            }
        }
    }

    private void forEachAttachment(String topic, Consumer<Attachment> action) {
        List<Attachment> targets = routes.get(topic);
        if (targets != null) {
            for (Attachment attachment : targets) {
                action.accept(attachment);
            }
        }
    }

    private boolean post(Runnable task) {
        try {
            worker.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    LOGGER.error("{}: Task failed", name, e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            LOGGER.debug("{}: Slot closed, dropping task", name);
            return false;
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    // ---- queries ----

    public String getName() {
        return name;
    }

    /**
     * Returns whether the physical connection is currently open.
     */
    public boolean isOpen() {
        return open;
    }

    /**
     * Returns the topics currently subscribed on the open connection.
     */
    public Set<String> getSubscribedTopics() {
        return subscribedView;
    }

    /**
     * Returns the last published book of a depth topic, or null when it is not synced.
     */
    public OrderBookReplica currentBook(String topic) {
        OrderBookEngine engine = engines.get(topic);
        return engine == null ? null : engine.current();
    }

    SlotKey getKey() {
        return key;
    }

    @Override
    public String toString() {
        return name;
    }

    private final class SlotListener implements TransportListener {

        private final long attempt;

        private SlotListener(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onMessage(String text) {
            post(() -> ConnectionSlot.this.onMessage(attempt, text));
        }

        @Override
        public void onPong() {
            post(() -> {
                if (attempt == generation && state == ConnectionState.OPEN) {
                    forEachAttachment(a -> a.getSink().onPong(a));
                }
            });
        }

        @Override
        public void onClosed(Throwable cause) {
            post(() -> onConnectionClosed(attempt, cause));
        }
    }
}
