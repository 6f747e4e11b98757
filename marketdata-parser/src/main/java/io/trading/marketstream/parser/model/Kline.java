package io.trading.marketstream.parser.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Candlestick (OHLCV) data point.
 *
 * @param exchange    The exchange identifier
 * @param symbol      Trading pair symbol
 * @param interval    Candle interval
 * @param openTime    Open time in milliseconds
 * @param closeTime   Close time in milliseconds
 * @param open        Open price
 * @param high        High price
 * @param low         Low price
 * @param close       Close (or latest) price
 * @param volume      Base asset volume
 * @param quoteVolume Quote asset volume
 * @param tradeCount  Number of trades
 * @param closed      Whether the candle is final
 */
public record Kline(
    Exchange exchange,
    Symbol symbol,
    KlineInterval interval,
    long openTime,
    long closeTime,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    BigDecimal quoteVolume,
    long tradeCount,
    boolean closed
) implements MarketEvent {

    private static final int RATIO_SCALE = 10;

    public Kline {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        if (interval == null) {
            throw new IllegalArgumentException("interval cannot be null");
        }
        if (open == null || high == null || low == null || close == null) {
            throw new IllegalArgumentException("prices cannot be null");
        }
        if (volume == null || quoteVolume == null) {
            throw new IllegalArgumentException("volumes cannot be null");
        }
    }

    @Override
    public FeedKind feedKind() {
        return FeedKind.KLINE;
    }

    /**
     * Returns close - open.
     */
    public BigDecimal change() {
        return close.subtract(open);
    }

    /**
     * Returns the change as a fraction of the open price.
     *
     * @throws ArithmeticException if the open price is zero
     */
    public BigDecimal changePercent() {
        if (open.signum() == 0) {
            throw new ArithmeticException("open price is zero");
        }
        return change().divide(open, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Returns high - low.
     */
    public BigDecimal range() {
        return high.subtract(low);
    }

    /**
     * Returns the volume-weighted average price.
     *
     * @throws ArithmeticException if the volume is zero
     */
    public BigDecimal vwap() {
        if (volume.signum() == 0) {
            throw new ArithmeticException("volume is zero");
        }
        return quoteVolume.divide(volume, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    public boolean isBullish() {
        return close.compareTo(open) > 0;
    }

    public boolean isBearish() {
        return close.compareTo(open) < 0;
    }
}
