package io.trading.marketstream.parser.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Unified ticker data model across all exchanges.
 *
 * @param exchange           The exchange identifier
 * @param symbol             Trading pair symbol
 * @param timestamp          Exchange timestamp in milliseconds
 * @param lastPrice          Last traded price
 * @param bidPrice           Best bid price
 * @param askPrice           Best ask price
 * @param bidQuantity        Best bid quantity
 * @param askQuantity        Best ask quantity
 * @param high24h            24-hour high
 * @param low24h             24-hour low
 * @param volume24h          24-hour base volume
 * @param quoteVolume24h     24-hour quote volume
 * @param change24h          24-hour price change
 * @param changePercent24h   24-hour price change percentage
 */
public record Ticker(
    Exchange exchange,
    Symbol symbol,
    long timestamp,
    BigDecimal lastPrice,
    BigDecimal bidPrice,
    BigDecimal askPrice,
    BigDecimal bidQuantity,
    BigDecimal askQuantity,
    BigDecimal high24h,
    BigDecimal low24h,
    BigDecimal volume24h,
    BigDecimal quoteVolume24h,
    BigDecimal change24h,
    BigDecimal changePercent24h
) implements MarketEvent {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public Ticker {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        if (lastPrice == null || bidPrice == null || askPrice == null) {
            throw new IllegalArgumentException("prices cannot be null");
        }
    }

    @Override
    public FeedKind feedKind() {
        return FeedKind.TICKER;
    }

    /**
     * Returns the bid-ask spread (ask - bid).
     */
    public BigDecimal spread() {
        return askPrice.subtract(bidPrice);
    }

    /**
     * Returns the mid price ((bid + ask) / 2).
     */
    public BigDecimal midPrice() {
        return bidPrice.add(askPrice).divide(TWO, MathContext.DECIMAL64);
    }

    /**
     * Returns the spread as a fraction of the mid price.
     *
     * @throws ArithmeticException if the mid price is zero
     */
    public BigDecimal spreadPercent() {
        BigDecimal mid = midPrice();
        if (mid.signum() == 0) {
            throw new ArithmeticException("mid price is zero");
        }
        return spread().divide(mid, 10, RoundingMode.HALF_UP);
    }
}
