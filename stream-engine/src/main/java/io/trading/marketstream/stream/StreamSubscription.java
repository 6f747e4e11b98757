package io.trading.marketstream.stream;

import io.trading.marketstream.backoff.BackoffPolicy;
import io.trading.marketstream.backoff.BackoffState;
import io.trading.marketstream.book.OrderBookReplica;
import io.trading.marketstream.channel.ChannelManager;
import io.trading.marketstream.channel.ReceiveChannel;
import io.trading.marketstream.config.StreamConfig;
import io.trading.marketstream.keepalive.KeepaliveWatchdog;
import io.trading.marketstream.metrics.StreamMetrics;
import io.trading.marketstream.mux.Attachment;
import io.trading.marketstream.mux.Multiplexer;
import io.trading.marketstream.mux.StreamSink;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.FeedKind;
import io.trading.marketstream.parser.model.MarketEvent;
import io.trading.marketstream.parser.model.OrderBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifecycle worker of one subscription.
 *
 * <p>Everything that changes the subscription happens on its own worker thread, which drains a
 * mailbox of signals from the connection slot, timers, the keepalive watchdog and the caller.
 * That thread is the only writer to the data and error channels, so once it closes them in
 * {@link StreamState#CLOSED} nothing can be sent again.
 *
 * <pre>
 * IDLE -> CONNECTING -> ACTIVE <-> RECONNECTING -> CONNECTING ...
 *                any -> CLOSING -> CLOSED
 * </pre>
 *
 * @param <T> event type delivered on the data channel
 */
public final class StreamSubscription<T> implements MarketStream<T>, StreamSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamSubscription.class);

    private interface Signal {
    }

    private record Start() implements Signal {}

    private record RegisterCancel(StreamContext ctx) implements Signal {}

    private record Close(String reason) implements Signal {}

    private record Connected(Attachment attachment) implements Signal {}

    private record ConnectionLost(Attachment attachment, Throwable cause) implements Signal {}

    private record Event(Attachment attachment, MarketEvent event) implements Signal {}

    private record Book(Attachment attachment, OrderBookReplica replica) implements Signal {}

    private record BookInvalidated(Attachment attachment, StreamException reason) implements Signal {}

    private record ProtocolError(Attachment attachment, StreamException error) implements Signal {}

    private record ConnectTimedOut(long token) implements Signal {}

    private record BackoffElapsed(long token) implements Signal {}

    private record PongTimedOut(long episode) implements Signal {}

    private final SubscriptionHandle handle;
    private final String name;
    private final Class<T> eventType;
    private final Multiplexer multiplexer;
    private final StreamConfig config;
    private final StreamMetrics metrics;
    private final ScheduledExecutorService timers;
    private final ChannelManager<T> channels;
    private final BackoffState backoff;
    private final KeepaliveWatchdog watchdog;
    private final int bookDepth;

    private final AtomicReference<StreamState> state = new AtomicReference<>(StreamState.IDLE);
    private final BlockingQueue<Signal> mailbox = new LinkedBlockingQueue<>();
    private final CompletableFuture<Void> done = new CompletableFuture<>();
    private volatile Attachment current;
    private volatile StreamException terminalCause;

    // worker thread only
    private Attachment attachment;
    private boolean slotUp = false;
    private boolean bookReady = false;
    private long connectToken = 0;
    private long backoffToken = 0;
    private ScheduledFuture<?> connectTimer;
    private ScheduledFuture<?> backoffTimer;
    private StreamContext.Registration cancelRegistration = () -> { };

    /**
     * @param handle      feed this stream delivers
     * @param eventType   class of the delivered events; {@link OrderBook} for order book streams
     * @param multiplexer exchange connections to attach to
     * @param config      buffer, reconnect and keepalive settings
     * @param metrics     metrics sink
     * @param timers      scheduler for backoff, connect and keepalive timers
     */
    public StreamSubscription(
        SubscriptionHandle handle,
        Class<T> eventType,
        Multiplexer multiplexer,
        StreamConfig config,
        StreamMetrics metrics,
        ScheduledExecutorService timers
    ) {
        this.handle = handle;
        this.name = handle.exchange().getDisplayName() + "/" + handle.name();
        this.eventType = eventType;
        this.multiplexer = multiplexer;
        this.config = config;
        this.metrics = metrics;
        this.timers = timers;
        this.channels = new ChannelManager<>(name, config.bufferSize(), config.overflowPolicy(),
            config.errorBufferSize());
        this.backoff = new BackoffState(BackoffPolicy.from(config));
        this.watchdog = config.keepaliveEnabled()
            ? new KeepaliveWatchdog(name, timers, config.pingInterval(), config.pongTimeout(),
                this::sendPing, episode -> post(new PongTimedOut(episode)))
            : null;
        this.bookDepth = handle.feedKind() == FeedKind.ORDER_BOOK ? parseDepth(handle.parameter()) : 0;
        metrics.recordTransition(handle.exchange(), null, StreamState.IDLE);
    }

    private static int parseDepth(String parameter) {
        if (parameter == null || parameter.isEmpty()) {
            return 0;
        }
        int depth = Integer.parseInt(parameter);
        if (depth < 0) {
            throw new IllegalArgumentException("order book depth must be non-negative, got " + depth);
        }
        return depth;
    }

    // ---- caller API ----

    @Override
    public ReceiveChannel<T> subscribe(StreamContext ctx) {
        if (!state.compareAndSet(StreamState.IDLE, StreamState.CONNECTING)) {
            StreamState now = state.get();
            ErrorCode code = now == StreamState.CLOSING || now == StreamState.CLOSED
                ? ErrorCode.STREAM_CLOSED : ErrorCode.ALREADY_SUBSCRIBED;
            throw new StreamException(code, handle.exchange(), handle.name(), null);
        }
        metrics.recordTransition(handle.exchange(), StreamState.IDLE, StreamState.CONNECTING);
        LOGGER.info("{}: Subscribing", name);

        Thread worker = new Thread(this::runWorker, "stream-" + handle.name());
        worker.setDaemon(true);
        mailbox.add(new Start());
        worker.start();
        // registered on the worker so a cancelled context is handled after Start
        post(new RegisterCancel(ctx));
        return channels.data();
    }

    @Override
    public void unsubscribe(StreamContext ctx) {
        StreamState now = state.get();
        if (now == StreamState.IDLE || now == StreamState.CLOSED) {
            throw new StreamException(ErrorCode.NOT_SUBSCRIBED, handle.exchange(), handle.name(), null);
        }
        post(new Close("unsubscribed"));
        try {
            CompletableFuture.anyOf(done, ctx.cancelled()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            LOGGER.warn("{}: Unexpected failure while closing", name, e.getCause());
        }
    }

    /**
     * Closes the stream without waiting. Used when the owning client shuts down.
     */
    public void closeAsync() {
        // never started: close the channels from here, no worker exists to do it
        if (state.compareAndSet(StreamState.IDLE, StreamState.CLOSED)) {
            channels.close();
            metrics.recordTransition(handle.exchange(), StreamState.IDLE, StreamState.CLOSED);
            done.complete(null);
            return;
        }
        // subscribe won the race or the worker already runs
        post(new Close("client closed"));
    }

    @Override
    public ReceiveChannel<StreamException> errors() {
        return channels.errors();
    }

    @Override
    public CompletableFuture<Void> done() {
        return done.copy();
    }

    @Override
    public StreamState state() {
        return state.get();
    }

    @Override
    public SubscriptionHandle handle() {
        return handle;
    }

    @Override
    public long droppedCount() {
        return channels.droppedData();
    }

    /**
     * Returns the error that ended the stream, or null while it runs or if it closed before subscribing.
     */
    public StreamException terminalCause() {
        return terminalCause;
    }

    /**
     * Returns the backoff attempt counter; reset on every transition into ACTIVE.
     */
    public int reconnectAttempt() {
        return backoff.getAttempt();
    }

    // ---- sink callbacks from the connection slot ----

    @Override
    public void onConnected(Attachment attachment) {
        post(new Connected(attachment));
    }

    @Override
    public void onConnectionLost(Attachment attachment, Throwable cause) {
        post(new ConnectionLost(attachment, cause));
    }

    @Override
    public void onEvent(Attachment attachment, MarketEvent event) {
        post(new Event(attachment, event));
    }

    @Override
    public void onBook(Attachment attachment, OrderBookReplica replica) {
        post(new Book(attachment, replica));
    }

    @Override
    public void onBookInvalidated(Attachment attachment, StreamException reason) {
        post(new BookInvalidated(attachment, reason));
    }

    @Override
    public void onProtocolError(Attachment attachment, StreamException error) {
        post(new ProtocolError(attachment, error));
    }

    @Override
    public void onPong(Attachment attachment) {
        if (watchdog != null && attachment == current) {
            watchdog.onPong();
        }
    }

    private void sendPing() {
        Attachment target = current;
        if (target != null) {
            multiplexer.ping(target);
        }
    }

    private void post(Signal signal) {
        mailbox.add(signal);
    }

    // ---- worker ----

    private void runWorker() {
        try {
            while (state.get() != StreamState.CLOSED) {
                handle(mailbox.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (state.get() != StreamState.CLOSED) {
                terminate(cancelled("worker interrupted"));
            }
        } catch (RuntimeException e) {
            LOGGER.error("{}: Worker failed", name, e);
            if (state.get() != StreamState.CLOSED) {
                terminate(new StreamException(ErrorCode.SUBSCRIPTION_CANCELLED, handle.exchange(),
                    handle.name(), "internal failure", e));
            }
        }
    }

    private void handle(Signal signal) {
        if (signal instanceof Start) {
            connect();
        } else if (signal instanceof RegisterCancel register) {
            cancelRegistration = register.ctx().onCancel(() -> post(new Close("context cancelled")));
        } else if (signal instanceof Close close) {
            if (!state.get().isTerminal()) {
                terminate(cancelled(close.reason()));
            }
        } else if (signal instanceof Connected connected) {
            if (connected.attachment() == attachment && state.get() == StreamState.CONNECTING) {
                slotUp = true;
                maybeActivate();
            }
        } else if (signal instanceof Book book) {
            onBookSignal(book);
        } else if (signal instanceof Event event) {
            onEventSignal(event);
        } else if (signal instanceof ConnectionLost lost) {
            if (lost.attachment() == attachment) {
                String reason = lost.cause() == null ? "connection closed" : lost.cause().toString();
                failure(new StreamException(ErrorCode.DISCONNECTED, handle.exchange(), handle.name(), reason));
            }
        } else if (signal instanceof BookInvalidated invalidated) {
            if (invalidated.attachment() == attachment) {
                failure(invalidated.reason());
            }
        } else if (signal instanceof ProtocolError protocolError) {
            if (protocolError.attachment() == attachment) {
                metrics.recordError(handle.exchange(), protocolError.error().getCategory());
                channels.emitError(protocolError.error());
            }
        } else if (signal instanceof ConnectTimedOut timedOut) {
            if (timedOut.token() == connectToken && state.get() == StreamState.CONNECTING) {
                failure(new StreamException(ErrorCode.CONNECT_TIMEOUT, handle.exchange(), handle.name(),
                    "not active after " + config.connectTimeout().toMillis() + " ms"));
            }
        } else if (signal instanceof BackoffElapsed elapsed) {
            if (elapsed.token() == backoffToken && state.get() == StreamState.RECONNECTING) {
                metrics.recordReconnect(handle.exchange());
                transition(StreamState.CONNECTING);
                connect();
            }
        } else if (signal instanceof PongTimedOut timedOut) {
            if (state.get() == StreamState.ACTIVE && watchdog != null && timedOut.episode() == watchdog.getEpisode()) {
                multiplexer.reportUnhealthy(attachment);
                failure(new StreamException(ErrorCode.PONG_TIMEOUT, handle.exchange(), handle.name(), null));
            }
        }
    }

    private void connect() {
        if (state.get() != StreamState.CONNECTING) {
            return;
        }
        slotUp = false;
        bookReady = false;
        try {
            attachment = multiplexer.attach(handle, this);
        } catch (IllegalStateException | IllegalArgumentException e) {
            LOGGER.error("{}: Cannot attach: {}", name, e.getMessage());
            terminate(new StreamException(ErrorCode.SUBSCRIPTION_CANCELLED, handle.exchange(), handle.name(),
                "cannot attach", e));
            return;
        }
        current = attachment;
        long token = ++connectToken;
        connectTimer = schedule(new ConnectTimedOut(token), config.connectTimeout());
    }

    private void maybeActivate() {
        if (state.get() != StreamState.CONNECTING || !slotUp) {
            return;
        }
        if (handle.feedKind() == FeedKind.ORDER_BOOK && !bookReady) {
            return;
        }
        cancel(connectTimer);
        connectTimer = null;
        transition(StreamState.ACTIVE);
        backoff.reset();
        if (watchdog != null) {
            watchdog.arm();
        }
        LOGGER.info("{}: Active", name);
    }

    private void onBookSignal(Book book) {
        if (book.attachment() != attachment || handle.feedKind() != FeedKind.ORDER_BOOK) {
            return;
        }
        bookReady = true;
        maybeActivate();
        if (state.get() == StreamState.ACTIVE) {
            emit(eventType.cast(book.replica().toOrderBook().truncate(bookDepth)));
        }
    }

    private void onEventSignal(Event event) {
        if (event.attachment() != attachment || state.get() != StreamState.ACTIVE) {
            return;
        }
        if (eventType.isInstance(event.event())) {
            emit(eventType.cast(event.event()));
        } else {
            LOGGER.debug("{}: Ignoring {}", name, event.event().getClass().getSimpleName());
        }
    }

    private void emit(T item) {
        if (channels.emit(item)) {
            metrics.recordEmitted(handle.exchange(), handle.feedKind());
        } else {
            metrics.recordDropped(handle.exchange(), handle.feedKind());
        }
    }

    /**
     * Moves to RECONNECTING and schedules the next attempt, or closes the stream when no
     * further attempt is allowed.
     */
    private void failure(StreamException reason) {
        StreamState from = state.get();
        if (from != StreamState.CONNECTING && from != StreamState.ACTIVE) {
            return;
        }
        metrics.recordError(handle.exchange(), reason.getCategory());
        LOGGER.warn("{}: {}", name, reason.getMessage());
        release();
        transition(StreamState.RECONNECTING);

        if (!config.reconnect()) {
            terminate(new StreamException(ErrorCode.RECONNECT_DISABLED, handle.exchange(), handle.name(),
                null, reason));
            return;
        }
        if (from == StreamState.CONNECTING) {
            backoff.recordFailure();
        }
        if (backoff.isExhausted()) {
            terminate(new StreamException(ErrorCode.RECONNECT_EXHAUSTED, handle.exchange(), handle.name(),
                "gave up after " + backoff.getAttempt() + " failed attempts", reason));
            return;
        }
        Duration delay = backoff.nextDelay();
        LOGGER.info("{}: Reconnecting in {} ms (attempt {})", name, delay.toMillis(), backoff.getAttempt() + 1);
        long token = ++backoffToken;
        backoffTimer = schedule(new BackoffElapsed(token), delay);
    }

    /**
     * Leaves the current connection: timers stop, the watchdog is disarmed and the attachment released.
     */
    private void release() {
        cancel(connectTimer);
        connectTimer = null;
        connectToken++;
        if (watchdog != null) {
            watchdog.disarm();
        }
        if (attachment != null) {
            multiplexer.detach(attachment);
            attachment = null;
            current = null;
        }
        slotUp = false;
        bookReady = false;
    }

    private void terminate(StreamException error) {
        transition(StreamState.CLOSING);
        release();
        cancel(backoffTimer);
        backoffTimer = null;
        backoffToken++;

        if (error != null) {
            terminalCause = error;
            metrics.recordError(handle.exchange(), ErrorCategory.TERMINAL);
            channels.emitTerminalError(error);
            if (error.getCode() == ErrorCode.SUBSCRIPTION_CANCELLED) {
                LOGGER.info("{}: {}", name, error.getMessage());
            } else {
                LOGGER.error("{}: {}", name, error.getMessage());
            }
        }
        if (!channels.isClosed()) {
            channels.close();
        }
        cancelRegistration.close();
        transition(StreamState.CLOSED);
        LOGGER.info("{}: Closed", name);
        done.complete(null);
    }

    private StreamException cancelled(String message) {
        return new StreamException(ErrorCode.SUBSCRIPTION_CANCELLED, handle.exchange(), handle.name(), message);
    }

    private void transition(StreamState to) {
        StreamState from = state.getAndSet(to);
        if (from != to) {
            metrics.recordTransition(handle.exchange(), from, to);
            LOGGER.debug("{}: {} -> {}", name, from, to);
        }
    }

    private ScheduledFuture<?> schedule(Signal signal, Duration delay) {
        try {
            return timers.schedule(() -> post(signal), delay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.warn("{}: Timer unavailable, signalling now", name);
            post(signal);
            return null;
        }
    }

    private static void cancel(ScheduledFuture<?> timer) {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    public Exchange getExchange() {
        return handle.exchange();
    }

    @Override
    public String toString() {
        return name + "[" + state.get() + "]";
    }
}
