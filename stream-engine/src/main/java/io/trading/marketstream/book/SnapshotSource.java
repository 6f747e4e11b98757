package io.trading.marketstream.book;

import io.trading.marketstream.parser.model.OrderBook;
import io.trading.marketstream.parser.model.Symbol;

import java.util.concurrent.CompletableFuture;

/**
 * Fetches full order book snapshots out of band, e.g. over REST.
 * Exchanges that push snapshots on the WebSocket after subscribing have no snapshot source.
 */
public interface SnapshotSource {

    /**
     * Starts fetching a snapshot.
     *
     * @param symbol trading pair
     * @param depth  number of levels requested per side
     * @return future completed with the snapshot, or exceptionally when the fetch fails
     */
    CompletableFuture<OrderBook> fetchSnapshot(Symbol symbol, int depth);
}
