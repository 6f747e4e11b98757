package io.trading.marketstream.mux;

import io.trading.marketstream.stream.SubscriptionHandle;

import java.util.concurrent.atomic.AtomicLong;

/**
 * One subscription's membership in a connection slot. A subscription gets a new attachment
 * on every connect attempt, so signals for an old attachment can be told apart.
 */
public final class Attachment {

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long id;
    private final SubscriptionHandle handle;
    private final String topic;
    private final ConnectionSlot slot;
    private final StreamSink sink;

    Attachment(SubscriptionHandle handle, String topic, ConnectionSlot slot, StreamSink sink) {
        this.id = NEXT_ID.getAndIncrement();
        this.handle = handle;
        this.topic = topic;
        this.slot = slot;
        this.sink = sink;
    }

    public long getId() {
        return id;
    }

    public SubscriptionHandle getHandle() {
        return handle;
    }

    public String getTopic() {
        return topic;
    }

    public ConnectionSlot getSlot() {
        return slot;
    }

    StreamSink getSink() {
        return sink;
    }

    @Override
    public String toString() {
        return "Attachment{" + handle.name() + " -> " + topic + " on " + slot.getName() + ", id=" + id + '}';
    }
}
