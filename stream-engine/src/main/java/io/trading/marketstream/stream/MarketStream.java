package io.trading.marketstream.stream;

import io.trading.marketstream.channel.ReceiveChannel;

import java.util.concurrent.CompletableFuture;

/**
 * A subscription to one normalized market data feed.
 *
 * @param <T> event type delivered on the data channel
 */
public interface MarketStream<T> {

    /**
     * Starts the subscription and returns its data channel without waiting for the connection.
     * Data flows once the stream is {@link StreamState#ACTIVE}. Cancelling {@code ctx} closes the stream.
     *
     * @throws StreamException ALREADY_SUBSCRIBED if already started, STREAM_CLOSED if closed
     */
    ReceiveChannel<T> subscribe(StreamContext ctx);

    /**
     * Closes the stream. Returns once the data channel is closed and nothing more will be sent,
     * or earlier if {@code ctx} is cancelled first.
     *
     * @throws StreamException NOT_SUBSCRIBED if the stream was never started or is already closed
     */
    void unsubscribe(StreamContext ctx);

    /**
     * Returns the error channel. It carries protocol errors while the stream runs and one final
     * terminal error when the stream ends, SUBSCRIPTION_CANCELLED for an explicit unsubscribe.
     */
    ReceiveChannel<StreamException> errors();

    /**
     * Returns a future completed once the stream is closed and both channels are closed.
     */
    CompletableFuture<Void> done();

    StreamState state();

    SubscriptionHandle handle();

    /**
     * Returns how many data items were dropped because the channel was full.
     */
    long droppedCount();
}
