package io.trading.marketstream.parser.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Symbol.
 */
class SymbolTest {

    @Test
    void testNormalizesToUpperCase() {
        Symbol symbol = Symbol.of(" btcusdt ");

        assertEquals("BTCUSDT", symbol.value());
        assertEquals("btcusdt", symbol.lowerCase());
        assertEquals(Symbol.of("BTCUSDT"), symbol);
    }

    @Test
    void testBaseAndQuote() {
        assertEquals("BTC", Symbol.of("BTCUSDT").base());
        assertEquals("USDT", Symbol.of("BTCUSDT").quote());
        assertEquals("ETH", Symbol.of("ETHBTC").base());
        assertEquals("", Symbol.of("XYZ").quote());
        assertEquals("XYZ", Symbol.of("XYZ").base());
    }

    @Test
    void testRejectsEmpty() {
        assertThrows(IllegalArgumentException.class, () -> Symbol.of(""));
        assertThrows(IllegalArgumentException.class, () -> Symbol.of("   "));
        assertThrows(IllegalArgumentException.class, () -> Symbol.of(null));
        assertFalse(Symbol.isValid(" "));
        assertTrue(Symbol.isValid("BTCUSDT"));
    }
}
