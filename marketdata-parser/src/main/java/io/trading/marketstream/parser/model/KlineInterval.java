package io.trading.marketstream.parser.model;

import java.time.Duration;

/**
 * Kline/candlestick interval.
 */
public enum KlineInterval {
    ONE_MINUTE("1m", Duration.ofMinutes(1)),
    THREE_MINUTES("3m", Duration.ofMinutes(3)),
    FIVE_MINUTES("5m", Duration.ofMinutes(5)),
    FIFTEEN_MINUTES("15m", Duration.ofMinutes(15)),
    THIRTY_MINUTES("30m", Duration.ofMinutes(30)),
    ONE_HOUR("1h", Duration.ofHours(1)),
    TWO_HOURS("2h", Duration.ofHours(2)),
    FOUR_HOURS("4h", Duration.ofHours(4)),
    SIX_HOURS("6h", Duration.ofHours(6)),
    EIGHT_HOURS("8h", Duration.ofHours(8)),
    TWELVE_HOURS("12h", Duration.ofHours(12)),
    ONE_DAY("1d", Duration.ofDays(1)),
    THREE_DAYS("3d", Duration.ofDays(3)),
    ONE_WEEK("1w", Duration.ofDays(7)),
    ONE_MONTH("1M", Duration.ofDays(30));

    private final String code;
    private final Duration approximateLength;

    KlineInterval(String code, Duration approximateLength) {
        this.code = code;
        this.approximateLength = approximateLength;
    }

    /**
     * Returns the interval code used in stream names, e.g. "1m".
     */
    public String code() {
        return code;
    }

    public Duration approximateLength() {
        return approximateLength;
    }

    /**
     * Looks up an interval by its code. Codes are case-sensitive ("1m" vs "1M").
     */
    public static KlineInterval fromCode(String code) {
        for (KlineInterval interval : values()) {
            if (interval.code.equals(code)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Unknown kline interval: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
