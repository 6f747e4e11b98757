package io.trading.marketstream.parser.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Kline and KlineInterval.
 */
class KlineTest {

    private static Kline kline(String open, String close, String volume, String quoteVolume) {
        return new Kline(Exchange.BINANCE, Symbol.of("BTCUSDT"), KlineInterval.ONE_MINUTE,
            0L, 59_999L,
            new BigDecimal(open), new BigDecimal("110"), new BigDecimal("90"), new BigDecimal(close),
            new BigDecimal(volume), new BigDecimal(quoteVolume), 10L, true);
    }

    @Test
    void testDerivedValues() {
        Kline kline = kline("100", "105", "2", "205");

        assertEquals(new BigDecimal("5"), kline.change());
        assertEquals(0, new BigDecimal("0.05").compareTo(kline.changePercent()));
        assertEquals(new BigDecimal("20"), kline.range());
        assertEquals(0, new BigDecimal("102.5").compareTo(kline.vwap()));
        assertTrue(kline.isBullish());
        assertFalse(kline.isBearish());
    }

    @Test
    void testZeroDivisorsFail() {
        assertThrows(ArithmeticException.class, () -> kline("0", "1", "1", "1").changePercent());
        assertThrows(ArithmeticException.class, () -> kline("1", "1", "0", "0").vwap());
    }

    @Test
    void testIntervalCodesAreCaseSensitive() {
        assertEquals(KlineInterval.ONE_MINUTE, KlineInterval.fromCode("1m"));
        assertEquals(KlineInterval.ONE_MONTH, KlineInterval.fromCode("1M"));
        assertThrows(IllegalArgumentException.class, () -> KlineInterval.fromCode("2m"));
    }
}
