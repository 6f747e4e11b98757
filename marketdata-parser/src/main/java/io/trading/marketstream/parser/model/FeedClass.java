package io.trading.marketstream.parser.model;

/**
 * Groups feed kinds that may share one physical exchange connection.
 */
public enum FeedClass {
    /** Ticker, trade and kline streams. */
    MARKET,
    /** Incremental depth streams feeding a local order book. */
    DEPTH
}
