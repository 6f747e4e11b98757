package io.trading.marketstream.channel;

import io.trading.marketstream.stream.StreamException;

/**
 * Owns the data and error channels of one subscription.
 *
 * Only the subscription's worker thread may call the emit and close methods. Both channels
 * are closed together, exactly once.
 *
 * @param <T> data item type
 */
public final class ChannelManager<T> {

    private final BoundedChannel<T> data;
    private final BoundedChannel<StreamException> errors;
    private final BoundedChannel<T>.Sender dataSender;
    private final BoundedChannel<StreamException>.Sender errorSender;

    private boolean closed = false;

    public ChannelManager(String name, int bufferSize, OverflowPolicy overflowPolicy, int errorBufferSize) {
        if (errorBufferSize < 1) {
            throw new IllegalArgumentException("errorBufferSize must be positive");
        }
        this.data = new BoundedChannel<>(name + "-data", bufferSize, overflowPolicy);
        this.errors = new BoundedChannel<>(name + "-errors", errorBufferSize, OverflowPolicy.DROP_NEWEST);
        this.dataSender = data.claimSender();
        this.errorSender = errors.claimSender();
    }

    public ReceiveChannel<T> data() {
        return data;
    }

    public ReceiveChannel<StreamException> errors() {
        return errors;
    }

    /**
     * Emits a data item without blocking.
     *
     * @return false if the overflow policy dropped the item
     */
    public boolean emit(T item) {
        return dataSender.offer(item);
    }

    /**
     * Emits a diagnostic error without blocking; dropped silently when the error channel is full.
     */
    public boolean emitError(StreamException error) {
        return errorSender.offer(error);
    }

    /**
     * Emits the final error of the stream, evicting the oldest pending error if needed.
     */
    public void emitTerminalError(StreamException error) {
        errorSender.offerEvicting(error);
    }

    /**
     * Closes both channels.
     *
     * @throws IllegalStateException if already closed
     */
    public void close() {
        if (closed) {
            throw new IllegalStateException("channels already closed");
        }
        closed = true;
        dataSender.close();
        errorSender.close();
    }

    public boolean isClosed() {
        return closed;
    }

    public long droppedData() {
        return data.droppedCount();
    }

    public long droppedErrors() {
        return errors.droppedCount();
    }
}
