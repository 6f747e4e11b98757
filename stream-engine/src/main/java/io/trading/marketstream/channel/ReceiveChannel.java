package io.trading.marketstream.channel;

import java.time.Duration;

/**
 * Consumer side of a stream channel.
 * Items arrive in send order. Once the channel is closed the remaining items can still be
 * received; after that every receive returns {@code null}.
 *
 * <pre>
 * ReceiveChannel&lt;Ticker&gt; tickers = stream.subscribe(ctx);
 * Ticker ticker;
 * while ((ticker = tickers.receive()) != null) {
 *     ...
 * }
 * </pre>
 *
 * @param <T> item type
 */
public interface ReceiveChannel<T> {

    /**
     * Waits for the next item.
     *
     * @return the next item, or null once the channel is closed and drained
     */
    T receive() throws InterruptedException;

    /**
     * Waits up to the given time for the next item.
     *
     * @return the next item, or null on timeout or once the channel is closed and drained
     */
    T poll(Duration timeout) throws InterruptedException;

    /**
     * Returns the next item if one is pending, without waiting.
     */
    T tryReceive();

    /**
     * Returns whether the sender has closed the channel.
     */
    boolean isClosed();

    /**
     * Returns whether the channel is closed and has no pending items.
     */
    boolean isDrained();

    /**
     * Returns the number of pending items.
     */
    int size();

    /**
     * Returns the configured capacity; 0 means items are only handed to a waiting receiver.
     */
    int capacity();

    /**
     * Returns how many items the overflow policy has discarded.
     */
    long droppedCount();
}
