package io.trading.marketstream.config;

import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.Symbol;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ClientConfig.
 */
class ClientConfigTest {

    @Test
    void testFromEnvDefaults() {
        ClientConfig config = ClientConfig.fromEnv(Map.<String, String>of()::get);

        assertEquals(Exchange.BINANCE, config.exchange());
        assertFalse(config.testnet());
        assertEquals(1, config.transportThreads());
        assertEquals(9090, config.metricsPort());
        assertEquals(List.of(Symbol.of("BTCUSDT"), Symbol.of("ETHUSDT")), config.symbols());
    }

    @Test
    void testFromEnvOverrides() {
        Map<String, String> env = Map.of(
            "EXCHANGE", "bybit",
            "TESTNET", "true",
            "TRANSPORT_THREADS", "2",
            "METRICS_PORT", "0",
            "SYMBOLS", "solusdt",
            "STREAM_BUFFER_SIZE", "16"
        );

        ClientConfig config = ClientConfig.fromEnv(env::get);

        assertEquals(Exchange.BYBIT, config.exchange());
        assertTrue(config.testnet());
        assertEquals(2, config.transportThreads());
        assertEquals(0, config.metricsPort());
        assertEquals(List.of(Symbol.of("SOLUSDT")), config.symbols());
        assertEquals(16, config.stream().bufferSize());
    }

    @Test
    void testParseSymbolsSkipsBlanksAndDuplicates() {
        assertEquals(List.of(Symbol.of("BTCUSDT"), Symbol.of("ETHUSDT")),
            ClientConfig.parseSymbols(" btcusdt, ,ETHUSDT,BTCUSDT,"));
    }

    @Test
    void testUnknownExchangeFails() {
        Map<String, String> env = Map.of("EXCHANGE", "kraken");

        assertThrows(IllegalArgumentException.class, () -> ClientConfig.fromEnv(env::get));
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.builder().transportThreads(0).build());
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.builder().metricsPort(70000).build());
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.builder().exchange(null).build());
    }
}
