package io.trading.marketstream.parser.model;

/**
 * Supported cryptocurrency exchanges.
 */
public enum Exchange {
    BINANCE("Binance"),
    BYBIT("Bybit");

    private final String displayName;

    Exchange(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
