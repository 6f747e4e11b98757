package io.trading.marketstream.mux;

import io.trading.marketstream.book.OrderBookReplica;
import io.trading.marketstream.config.StreamConfig;
import io.trading.marketstream.exchange.ExchangeAdapter;
import io.trading.marketstream.metrics.StreamMetrics;
import io.trading.marketstream.parser.model.FeedClass;
import io.trading.marketstream.parser.model.FeedKind;
import io.trading.marketstream.parser.model.Symbol;
import io.trading.marketstream.stream.SubscriptionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes subscriptions of one exchange onto shared connection slots.
 *
 * <p>Slots are keyed by endpoint and feed class. A subscription joins the slot already carrying
 * its topic, otherwise any slot of its key with room for another topic, otherwise a new slot.
 * A slot is retired and its connection closed when its last attachment leaves.
 */
public final class Multiplexer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Multiplexer.class);

    private final ExchangeAdapter adapter;
    private final StreamConfig config;
    private final StreamMetrics metrics;
    private final Map<SlotKey, List<ConnectionSlot>> slots = new HashMap<>();

    private int slotSequence = 0;
    private boolean closed = false;

    public Multiplexer(ExchangeAdapter adapter, StreamConfig config, StreamMetrics metrics) {
        this.adapter = adapter;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Routes a subscription onto a slot, opening a connection if needed.
     * Signals for the returned attachment are delivered to the sink.
     *
     * @throws IllegalStateException if the multiplexer is closed
     * @throws IllegalArgumentException if the exchange has no topic for the handle
     */
    public synchronized Attachment attach(SubscriptionHandle handle, StreamSink sink) {
        if (closed) {
            throw new IllegalStateException("multiplexer is closed");
        }
        String topic = adapter.protocol().topic(handle.feedKind(), handle.symbol(), handle.parameter());
        FeedClass feedClass = handle.feedKind().feedClass();
        SlotKey key = new SlotKey(adapter.endpoint(feedClass), feedClass);
        List<ConnectionSlot> candidates = slots.computeIfAbsent(key, k -> new ArrayList<>());

        ConnectionSlot slot = candidates.stream()
            .filter(s -> s.hosts(topic))
            .findFirst()
            .or(() -> candidates.stream().filter(s -> s.hasRoomFor(topic)).findFirst())
            .orElseGet(() -> newSlot(key, candidates));

        Attachment attachment = new Attachment(handle, topic, slot, sink);
        slot.reserve(topic, attachment.getId());
        slot.attach(attachment);
        return attachment;
    }

    private ConnectionSlot newSlot(SlotKey key, List<ConnectionSlot> candidates) {
        String name = adapter.exchange().getDisplayName() + "/" + key.feedClass().name().toLowerCase()
            + "#" + (++slotSequence);
        ConnectionSlot slot = new ConnectionSlot(name, key, adapter, config, metrics);
        candidates.add(slot);
        LOGGER.info("{}: Created slot for {}", name, key);
        return slot;
    }

    /**
     * Removes an attachment; the last one leaving a topic unsubscribes it and the last one
     * leaving a slot closes the connection. Detaching twice is a no-op.
     */
    public synchronized void detach(Attachment attachment) {
        ConnectionSlot slot = attachment.getSlot();
        slot.detach(attachment);
        if (slot.release(attachment.getTopic(), attachment.getId())) {
            List<ConnectionSlot> candidates = slots.get(slot.getKey());
            if (candidates != null) {
                candidates.remove(slot);
                if (candidates.isEmpty()) {
                    slots.remove(slot.getKey());
                }
            }
            slot.shutdown();
        }
    }

    /**
     * Sends a keepalive on the attachment's connection.
     */
    public void ping(Attachment attachment) {
        attachment.getSlot().ping();
    }

    /**
     * Drops the attachment's connection so that every subscriber on it reconnects.
     */
    public void reportUnhealthy(Attachment attachment) {
        attachment.getSlot().forceReconnect("pong timeout reported by " + attachment.getHandle().name());
    }

    /**
     * Returns the last published order book for a symbol at a requested depth.
     */
    public synchronized Optional<OrderBookReplica> currentBook(Symbol symbol, String depth) {
        String topic = adapter.protocol().topic(FeedKind.ORDER_BOOK, symbol, depth);
        SlotKey key = new SlotKey(adapter.endpoint(FeedClass.DEPTH), FeedClass.DEPTH);
        for (ConnectionSlot slot : slots.getOrDefault(key, List.of())) {
            if (slot.hosts(topic)) {
                return Optional.ofNullable(slot.currentBook(topic));
            }
        }
        return Optional.empty();
    }

    public synchronized int slotCount() {
        int count = 0;
        for (List<ConnectionSlot> candidates : slots.values()) {
            count += candidates.size();
        }
        return count;
    }

    public synchronized List<ConnectionSlot> getSlots() {
        List<ConnectionSlot> all = new ArrayList<>();
        slots.values().forEach(all::addAll);
        return all;
    }

    public ExchangeAdapter getAdapter() {
        return adapter;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        slots.values().forEach(candidates -> candidates.forEach(ConnectionSlot::shutdown));
        slots.clear();
        LOGGER.info("{}: Multiplexer closed", adapter.exchange().getDisplayName());
    }
}
