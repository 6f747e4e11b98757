package io.trading.marketstream.exchange;

import io.trading.marketstream.transport.Transport;

/**
 * Creates the adapter of one exchange.
 */
@FunctionalInterface
public interface ExchangeAdapterFactory {

    /**
     * @param transport transport the adapter opens its connections with
     * @param testnet   whether to use the exchange's test endpoints
     */
    ExchangeAdapter create(Transport transport, boolean testnet);

    /**
     * Whether the exchange handles permessage-deflate correctly.
     */
    default boolean supportsCompression() {
        return true;
    }
}
