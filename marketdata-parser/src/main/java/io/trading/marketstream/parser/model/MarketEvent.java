package io.trading.marketstream.parser.model;

/**
 * Common view of every decoded market data payload.
 */
public interface MarketEvent {

    /**
     * Returns the exchange this event came from.
     */
    Exchange exchange();

    /**
     * Returns the trading pair of this event.
     */
    Symbol symbol();

    /**
     * Returns the feed this event belongs to.
     */
    FeedKind feedKind();
}
