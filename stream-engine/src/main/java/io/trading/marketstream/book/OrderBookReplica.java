package io.trading.marketstream.book;

import io.trading.marketstream.parser.model.DepthDiff;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.OrderBook;
import io.trading.marketstream.parser.model.OrderBookLevel;
import io.trading.marketstream.parser.model.Symbol;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;

/**
 * Immutable local copy of an exchange order book at one watermark.
 *
 * Bids are strictly descending by price, asks strictly ascending, no price appears twice on a
 * side and no level has zero quantity. Applying a diff builds a new replica; an existing
 * instance never changes, so any number of readers may hold one without locking.
 */
public final class OrderBookReplica {

    private static final Comparator<BigDecimal> ASCENDING = Comparator.naturalOrder();
    private static final Comparator<BigDecimal> DESCENDING = Comparator.reverseOrder();

    private final Exchange exchange;
    private final Symbol symbol;
    private final List<OrderBookLevel> bids;
    private final List<OrderBookLevel> asks;
    private final long lastUpdateId;
    private final long sequence;
    private final long timestamp;

    private OrderBookReplica(
        Exchange exchange,
        Symbol symbol,
        List<OrderBookLevel> bids,
        List<OrderBookLevel> asks,
        long lastUpdateId,
        long sequence,
        long timestamp
    ) {
        this.exchange = exchange;
        this.symbol = symbol;
        this.bids = bids;
        this.asks = asks;
        this.lastUpdateId = lastUpdateId;
        this.sequence = sequence;
        this.timestamp = timestamp;
    }

    /**
     * Builds a replica from an exchange snapshot, normalizing level order and dropping
     * zero-quantity levels.
     */
    public static OrderBookReplica fromSnapshot(OrderBook snapshot) {
        return new OrderBookReplica(
            snapshot.exchange(),
            snapshot.symbol(),
            normalize(snapshot.bids(), DESCENDING),
            normalize(snapshot.asks(), ASCENDING),
            snapshot.lastUpdateId(),
            1L,
            snapshot.timestamp()
        );
    }

    /**
     * Returns a new replica with the diff applied and the watermark moved to its final id.
     * The caller is responsible for checking that the diff is applicable.
     */
    public OrderBookReplica apply(DepthDiff diff) {
        return new OrderBookReplica(
            exchange,
            symbol,
            merge(bids, diff.bids(), DESCENDING),
            merge(asks, diff.asks(), ASCENDING),
            diff.finalUpdateId(),
            sequence + 1,
            diff.timestamp()
        );
    }

    /**
     * Returns this replica as an immutable order book record.
     */
    public OrderBook toOrderBook() {
        return new OrderBook(exchange, symbol, timestamp, bids, asks, lastUpdateId, sequence);
    }

    /**
     * Sorts levels by price, keeping the last entry for a repeated price and dropping zero quantities.
     */
    private static List<OrderBookLevel> normalize(List<OrderBookLevel> levels, Comparator<BigDecimal> order) {
        TreeMap<BigDecimal, OrderBookLevel> byPrice = new TreeMap<>(order);
        for (OrderBookLevel level : levels) {
            if (level.isRemoval()) {
                byPrice.remove(level.price());
            } else {
                byPrice.put(level.price(), level);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(byPrice.values()));
    }

    /**
     * Merges sorted current levels with changes in one pass.
     * A change with quantity zero removes its price; any other change inserts or replaces it.
     */
    private static List<OrderBookLevel> merge(
        List<OrderBookLevel> current,
        List<OrderBookLevel> changes,
        Comparator<BigDecimal> order
    ) {
        if (changes.isEmpty()) {
            return current;
        }
        // last change for a price wins; removals are kept so they can cancel existing levels
        TreeMap<BigDecimal, OrderBookLevel> sortedChanges = new TreeMap<>(order);
        for (OrderBookLevel change : changes) {
            sortedChanges.put(change.price(), change);
        }

        List<OrderBookLevel> merged = new ArrayList<>(current.size() + sortedChanges.size());
        int i = 0;
        for (OrderBookLevel change : sortedChanges.values()) {
            while (i < current.size() && order.compare(current.get(i).price(), change.price()) < 0) {
                merged.add(current.get(i++));
            }
            if (i < current.size() && order.compare(current.get(i).price(), change.price()) == 0) {
                i++;
            }
            if (!change.isRemoval()) {
                merged.add(change);
            }
        }
        while (i < current.size()) {
            merged.add(current.get(i++));
        }
        return Collections.unmodifiableList(merged);
    }

    public Exchange getExchange() {
        return exchange;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public List<OrderBookLevel> getBids() {
        return bids;
    }

    public List<OrderBookLevel> getAsks() {
        return asks;
    }

    public long getLastUpdateId() {
        return lastUpdateId;
    }

    /**
     * Returns the local version, incremented on every applied snapshot or diff.
     */
    public long getSequence() {
        return sequence;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "OrderBookReplica{" + exchange + " " + symbol
            + ", lastUpdateId=" + lastUpdateId
            + ", sequence=" + sequence
            + ", bids=" + bids.size()
            + ", asks=" + asks.size() + '}';
    }
}
