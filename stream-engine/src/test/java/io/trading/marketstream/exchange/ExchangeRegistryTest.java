package io.trading.marketstream.exchange;

import io.trading.marketstream.exchange.binance.BinanceAdapter;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.FeedClass;
import io.trading.marketstream.support.FakeTransport;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ExchangeRegistry.
 */
class ExchangeRegistryTest {

    @Test
    void testDefaultsRegisterBuiltInExchanges() {
        ExchangeRegistry registry = ExchangeRegistry.withDefaults();

        assertEquals(Set.of(Exchange.BINANCE, Exchange.BYBIT), registry.exchanges());
        assertTrue(registry.isRegistered(Exchange.BYBIT));
    }

    @Test
    void testCreateUsesTestnetEndpoints() {
        ExchangeRegistry registry = ExchangeRegistry.withDefaults();
        FakeTransport transport = new FakeTransport();

        ExchangeAdapter binance = registry.create(Exchange.BINANCE, transport, true);
        ExchangeAdapter bybit = registry.create(Exchange.BYBIT, transport, false);

        assertEquals(Exchange.BINANCE, binance.exchange());
        assertEquals("testnet.binance.vision", binance.endpoint(FeedClass.MARKET).getHost());
        assertTrue(binance.snapshotSource().isPresent());
        assertEquals("stream.bybit.com", bybit.endpoint(FeedClass.DEPTH).getHost());
        assertTrue(bybit.snapshotSource().isEmpty());
        assertSame(transport, bybit.transport());
    }

    @Test
    void testCompressionSupport() {
        ExchangeRegistry registry = ExchangeRegistry.withDefaults();

        assertTrue(registry.factory(Exchange.BINANCE).supportsCompression());
        assertFalse(registry.factory(Exchange.BYBIT).supportsCompression());
    }

    @Test
    void testDuplicateRegistrationFails() {
        ExchangeRegistry registry = ExchangeRegistry.withDefaults();

        assertThrows(IllegalStateException.class,
            () -> registry.register(Exchange.BINANCE, BinanceAdapter.factory()));
    }

    @Test
    void testUnknownExchangeFails() {
        ExchangeRegistry registry = new ExchangeRegistry();

        assertTrue(registry.exchanges().isEmpty());
        assertThrows(IllegalArgumentException.class,
            () -> registry.create(Exchange.BYBIT, new FakeTransport(), false));
    }
}
