package io.trading.marketstream.parser.model;

import java.util.List;
import java.util.Locale;

/**
 * Trading pair identifier, normalized to upper case (e.g. "BTCUSDT").
 *
 * @param value the normalized symbol text
 */
public record Symbol(String value) {

    private static final List<String> QUOTE_ASSETS = List.of("USDT", "USDC", "USD", "BTC", "ETH", "BNB", "BUSD");

    public Symbol {
        if (value == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        value = value.trim().toUpperCase(Locale.ROOT);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be empty");
        }
    }

    /**
     * Creates a normalized symbol.
     */
    public static Symbol of(String value) {
        return new Symbol(value);
    }

    /**
     * Returns whether the text would make a valid symbol.
     */
    public static boolean isValid(String value) {
        return value != null && !value.trim().isEmpty();
    }

    /**
     * Returns the base asset, e.g. "BTC" for "BTCUSDT".
     * Heuristic on well-known quote suffixes; the whole symbol when none matches.
     */
    public String base() {
        String quote = quote();
        return quote.isEmpty() ? value : value.substring(0, value.length() - quote.length());
    }

    /**
     * Returns the quote asset, e.g. "USDT" for "BTCUSDT", or an empty string when unknown.
     */
    public String quote() {
        for (String quote : QUOTE_ASSETS) {
            if (value.endsWith(quote) && value.length() > quote.length()) {
                return quote;
            }
        }
        return "";
    }

    /**
     * Returns the lower-case form used in exchange stream names.
     */
    public String lowerCase() {
        return value.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return value;
    }
}
