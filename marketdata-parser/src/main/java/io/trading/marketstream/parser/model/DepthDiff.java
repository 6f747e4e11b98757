package io.trading.marketstream.parser.model;

import java.util.List;

/**
 * Incremental order book update covering exchange update ids
 * {@code [firstUpdateId, finalUpdateId]}.
 *
 * @param exchange      The exchange identifier
 * @param symbol        Trading pair symbol
 * @param timestamp     Exchange event time in milliseconds
 * @param firstUpdateId First update id in this diff
 * @param finalUpdateId Last update id in this diff
 * @param bids          Changed bid levels, quantity zero removes the level
 * @param asks          Changed ask levels, quantity zero removes the level
 */
public record DepthDiff(
    Exchange exchange,
    Symbol symbol,
    long timestamp,
    long firstUpdateId,
    long finalUpdateId,
    List<OrderBookLevel> bids,
    List<OrderBookLevel> asks
) implements MarketEvent {

    public DepthDiff {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        if (firstUpdateId > finalUpdateId) {
            throw new IllegalArgumentException(
                "firstUpdateId " + firstUpdateId + " is after finalUpdateId " + finalUpdateId);
        }
        bids = bids == null ? List.of() : List.copyOf(bids);
        asks = asks == null ? List.of() : List.copyOf(asks);
    }

    @Override
    public FeedKind feedKind() {
        return FeedKind.ORDER_BOOK;
    }
}
