package io.trading.marketstream.parser.model;

/**
 * Category of normalized market data.
 */
public enum FeedKind {
    TICKER("ticker", FeedClass.MARKET),
    ORDER_BOOK("orderbook", FeedClass.DEPTH),
    TRADE("trade", FeedClass.MARKET),
    KLINE("kline", FeedClass.MARKET);

    private final String displayName;
    private final FeedClass feedClass;

    FeedKind(String displayName, FeedClass feedClass) {
        this.displayName = displayName;
        this.feedClass = feedClass;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Returns the connection class this feed kind is multiplexed on.
     */
    public FeedClass feedClass() {
        return feedClass;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
