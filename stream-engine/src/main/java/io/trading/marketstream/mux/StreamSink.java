package io.trading.marketstream.mux;

import io.trading.marketstream.book.OrderBookReplica;
import io.trading.marketstream.parser.model.MarketEvent;
import io.trading.marketstream.stream.StreamException;

/**
 * Receives what a connection slot routes to one attachment.
 *
 * <p>Called on the slot's worker thread, in order. Implementations must not block: they hand
 * the signal to their own worker and return.
 */
public interface StreamSink {

    /**
     * The connection is open and the attachment's topic is subscribed.
     */
    void onConnected(Attachment attachment);

    /**
     * The connection failed to open or dropped; the attachment no longer receives data.
     */
    void onConnectionLost(Attachment attachment, Throwable cause);

    void onEvent(Attachment attachment, MarketEvent event);

    /**
     * A new consistent book version is published for the attachment's topic.
     */
    void onBook(Attachment attachment, OrderBookReplica replica);

    /**
     * The topic's book was invalidated by a sequence gap or a failed snapshot.
     */
    void onBookInvalidated(Attachment attachment, StreamException reason);

    /**
     * A non-fatal error: undecodable input or a rejected request.
     */
    void onProtocolError(Attachment attachment, StreamException error);

    /**
     * A liveness reply arrived on the connection.
     */
    void onPong(Attachment attachment);
}
