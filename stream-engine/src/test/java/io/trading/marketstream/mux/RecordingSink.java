package io.trading.marketstream.mux;

import io.trading.marketstream.book.OrderBookReplica;
import io.trading.marketstream.parser.model.MarketEvent;
import io.trading.marketstream.stream.StreamException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sink that records every signal it receives.
 */
class RecordingSink implements StreamSink {

    final AtomicInteger connected = new AtomicInteger();
    final List<Throwable> lost = new CopyOnWriteArrayList<>();
    final List<MarketEvent> events = new CopyOnWriteArrayList<>();
    final List<OrderBookReplica> books = new CopyOnWriteArrayList<>();
    final List<StreamException> invalidations = new CopyOnWriteArrayList<>();
    final List<StreamException> protocolErrors = new CopyOnWriteArrayList<>();
    final AtomicInteger pongs = new AtomicInteger();

    @Override
    public void onConnected(Attachment attachment) {
        connected.incrementAndGet();
    }

    @Override
    public void onConnectionLost(Attachment attachment, Throwable cause) {
        lost.add(cause == null ? new IllegalStateException("closed") : cause);
    }

    @Override
    public void onEvent(Attachment attachment, MarketEvent event) {
        events.add(event);
    }

    @Override
    public void onBook(Attachment attachment, OrderBookReplica replica) {
        books.add(replica);
    }

    @Override
    public void onBookInvalidated(Attachment attachment, StreamException reason) {
        invalidations.add(reason);
    }

    @Override
    public void onProtocolError(Attachment attachment, StreamException error) {
        protocolErrors.add(error);
    }

    @Override
    public void onPong(Attachment attachment) {
        pongs.incrementAndGet();
    }

    OrderBookReplica lastBook() {
        return books.get(books.size() - 1);
    }
}
