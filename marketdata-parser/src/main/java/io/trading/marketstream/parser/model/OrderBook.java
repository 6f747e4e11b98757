package io.trading.marketstream.parser.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Immutable order book view.
 * Used both for exchange snapshots and for the state of a locally maintained replica.
 *
 * @param exchange     The exchange identifier
 * @param symbol       Trading pair symbol
 * @param timestamp    Exchange or local timestamp in milliseconds
 * @param bids         Bid levels, sorted descending by price
 * @param asks         Ask levels, sorted ascending by price
 * @param lastUpdateId Highest exchange update id reflected in this book
 * @param sequence     Local version counter, 0 for books straight from the exchange
 */
public record OrderBook(
    Exchange exchange,
    Symbol symbol,
    long timestamp,
    List<OrderBookLevel> bids,
    List<OrderBookLevel> asks,
    long lastUpdateId,
    long sequence
) implements MarketEvent {

    public OrderBook {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        if (bids == null) {
            throw new IllegalArgumentException("bids cannot be null");
        }
        if (asks == null) {
            throw new IllegalArgumentException("asks cannot be null");
        }
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }

    @Override
    public FeedKind feedKind() {
        return FeedKind.ORDER_BOOK;
    }

    /**
     * Returns the best (highest) bid.
     */
    public Optional<OrderBookLevel> bestBid() {
        return bids.isEmpty() ? Optional.empty() : Optional.of(bids.get(0));
    }

    /**
     * Returns the best (lowest) ask.
     */
    public Optional<OrderBookLevel> bestAsk() {
        return asks.isEmpty() ? Optional.empty() : Optional.of(asks.get(0));
    }

    /**
     * Returns the bid-ask spread, empty when either side has no depth.
     */
    public Optional<BigDecimal> spread() {
        if (bids.isEmpty() || asks.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(asks.get(0).price().subtract(bids.get(0).price()));
    }

    public int bidDepth() {
        return bids.size();
    }

    public int askDepth() {
        return asks.size();
    }

    /**
     * Returns a copy limited to the given number of levels per side.
     *
     * @param levels levels to keep, 0 for full depth
     */
    public OrderBook truncate(int levels) {
        if (levels < 0) {
            throw new IllegalArgumentException("levels cannot be negative");
        }
        if (levels == 0 || (bids.size() <= levels && asks.size() <= levels)) {
            return this;
        }
        return new OrderBook(
            exchange,
            symbol,
            timestamp,
            bids.subList(0, Math.min(levels, bids.size())),
            asks.subList(0, Math.min(levels, asks.size())),
            lastUpdateId,
            sequence
        );
    }
}
