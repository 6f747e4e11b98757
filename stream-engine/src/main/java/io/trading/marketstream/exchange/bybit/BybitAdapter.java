package io.trading.marketstream.exchange.bybit;

import io.trading.marketstream.book.SnapshotSource;
import io.trading.marketstream.exchange.ExchangeAdapter;
import io.trading.marketstream.exchange.ExchangeAdapterFactory;
import io.trading.marketstream.exchange.ExchangeProtocol;
import io.trading.marketstream.parser.api.MarketDataDecoder;
import io.trading.marketstream.parser.impl.bybit.BybitMarketDataDecoder;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.FeedClass;
import io.trading.marketstream.transport.Transport;

import java.net.URI;
import java.util.Optional;

/**
 * Bybit spot public streams.
 * Connects to wss://stream.bybit.com/v5/public/spot. Book snapshots arrive on the stream.
 */
public class BybitAdapter implements ExchangeAdapter {

    static final URI WS_URL = URI.create("wss://stream.bybit.com/v5/public/spot");
    static final URI TESTNET_WS_URL = URI.create("wss://stream-testnet.bybit.com/v5/public/spot");

    private final Transport transport;
    private final URI endpoint;
    private final BybitMarketDataDecoder decoder = new BybitMarketDataDecoder();
    private final BybitProtocol protocol = new BybitProtocol();

    public BybitAdapter(Transport transport, boolean testnet) {
        this(transport, testnet ? TESTNET_WS_URL : WS_URL);
    }

    public BybitAdapter(Transport transport, URI endpoint) {
        this.transport = transport;
        this.endpoint = endpoint;
    }

    /**
     * Bybit has a non-standard permessage-deflate implementation, so compression stays off.
     */
    public static ExchangeAdapterFactory factory() {
        return new ExchangeAdapterFactory() {
            @Override
            public ExchangeAdapter create(Transport transport, boolean testnet) {
                return new BybitAdapter(transport, testnet);
            }

            @Override
            public boolean supportsCompression() {
                return false;
            }
        };
    }

    @Override
    public Exchange exchange() {
        return Exchange.BYBIT;
    }

    @Override
    public URI endpoint(FeedClass feedClass) {
        return endpoint;
    }

    @Override
    public Transport transport() {
        return transport;
    }

    @Override
    public MarketDataDecoder decoder() {
        return decoder;
    }

    @Override
    public ExchangeProtocol protocol() {
        return protocol;
    }

    @Override
    public Optional<SnapshotSource> snapshotSource() {
        return Optional.empty();
    }
}
