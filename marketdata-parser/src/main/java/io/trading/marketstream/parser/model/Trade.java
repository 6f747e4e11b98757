package io.trading.marketstream.parser.model;

import java.math.BigDecimal;

/**
 * Unified trade data model across all exchanges.
 *
 * @param exchange     The exchange identifier
 * @param symbol       Trading pair symbol
 * @param timestamp    Trade timestamp in milliseconds
 * @param tradeId      Unique trade identifier
 * @param price        Trade price
 * @param quantity     Trade quantity
 * @param side         Taker side
 * @param buyerMaker   Whether the buyer was the maker
 */
public record Trade(
    Exchange exchange,
    Symbol symbol,
    long timestamp,
    String tradeId,
    BigDecimal price,
    BigDecimal quantity,
    Side side,
    boolean buyerMaker
) implements MarketEvent {

    public Trade {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        if (tradeId == null) {
            throw new IllegalArgumentException("tradeId cannot be null");
        }
        if (price == null || quantity == null) {
            throw new IllegalArgumentException("price and quantity cannot be null");
        }
        if (side == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
    }

    @Override
    public FeedKind feedKind() {
        return FeedKind.TRADE;
    }

    /**
     * Returns the trade value (price * quantity).
     */
    public BigDecimal value() {
        return price.multiply(quantity);
    }
}
