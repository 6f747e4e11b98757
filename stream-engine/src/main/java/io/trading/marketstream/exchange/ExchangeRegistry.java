package io.trading.marketstream.exchange;

import io.trading.marketstream.exchange.binance.BinanceAdapter;
import io.trading.marketstream.exchange.bybit.BybitAdapter;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.transport.Transport;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps exchanges to adapter factories. Owned by the caller; there is no global instance.
 */
public final class ExchangeRegistry {

    private final Map<Exchange, ExchangeAdapterFactory> factories = new EnumMap<>(Exchange.class);

    /**
     * Returns a registry with every built-in exchange registered.
     */
    public static ExchangeRegistry withDefaults() {
        ExchangeRegistry registry = new ExchangeRegistry();
        registry.register(Exchange.BINANCE, BinanceAdapter.factory());
        registry.register(Exchange.BYBIT, BybitAdapter.factory());
        return registry;
    }

    /**
     * @throws IllegalStateException if the exchange is already registered
     */
    public synchronized ExchangeRegistry register(Exchange exchange, ExchangeAdapterFactory factory) {
        if (exchange == null || factory == null) {
            throw new IllegalArgumentException("exchange and factory cannot be null");
        }
        if (factories.containsKey(exchange)) {
            throw new IllegalStateException("Exchange already registered: " + exchange);
        }
        factories.put(exchange, factory);
        return this;
    }

    /**
     * @throws IllegalArgumentException if the exchange is not registered
     */
    public synchronized ExchangeAdapterFactory factory(Exchange exchange) {
        ExchangeAdapterFactory factory = factories.get(exchange);
        if (factory == null) {
            throw new IllegalArgumentException("Exchange not registered: " + exchange);
        }
        return factory;
    }

    public ExchangeAdapter create(Exchange exchange, Transport transport, boolean testnet) {
        return factory(exchange).create(transport, testnet);
    }

    public synchronized boolean isRegistered(Exchange exchange) {
        return factories.containsKey(exchange);
    }

    public synchronized Set<Exchange> exchanges() {
        return Set.copyOf(factories.keySet());
    }
}
