package io.trading.marketstream.support;

import io.trading.marketstream.book.SnapshotSource;
import io.trading.marketstream.parser.model.OrderBook;
import io.trading.marketstream.parser.model.Symbol;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot source whose fetches are completed by the test.
 */
public final class StubSnapshotSource implements SnapshotSource {

    private final ConcurrentLinkedQueue<CompletableFuture<OrderBook>> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requests = new AtomicInteger();

    @Override
    public CompletableFuture<OrderBook> fetchSnapshot(Symbol symbol, int depth) {
        requests.incrementAndGet();
        CompletableFuture<OrderBook> future = new CompletableFuture<>();
        pending.add(future);
        return future;
    }

    public int requests() {
        return requests.get();
    }

    /**
     * Completes the oldest outstanding fetch.
     */
    public void complete(OrderBook book) {
        next().complete(book);
    }

    public void fail(Throwable cause) {
        next().completeExceptionally(cause);
    }

    private CompletableFuture<OrderBook> next() {
        CompletableFuture<OrderBook> future = pending.poll();
        if (future == null) {
            throw new IllegalStateException("no snapshot request outstanding");
        }
        return future;
    }
}
