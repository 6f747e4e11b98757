package io.trading.marketstream.parser.model;

import java.util.Locale;

/**
 * Trade side.
 */
public enum Side {
    BUY,
    SELL;

    /**
     * Parses a side, accepting "buy"/"bid" and "sell"/"ask" in any case.
     *
     * @throws IllegalArgumentException if the text is not a known side
     */
    public static Side parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "buy", "bid" -> BUY;
            case "sell", "ask" -> SELL;
            default -> throw new IllegalArgumentException("Invalid side: " + text);
        };
    }
}
