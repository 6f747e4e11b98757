package io.trading.marketstream.exchange.binance;

import io.trading.marketstream.book.SnapshotSource;
import io.trading.marketstream.exchange.ExchangeAdapter;
import io.trading.marketstream.exchange.ExchangeAdapterFactory;
import io.trading.marketstream.exchange.ExchangeProtocol;
import io.trading.marketstream.parser.api.MarketDataDecoder;
import io.trading.marketstream.parser.impl.binance.BinanceMarketDataDecoder;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.FeedClass;
import io.trading.marketstream.transport.Transport;

import java.net.URI;
import java.util.Optional;

/**
 * Binance spot market streams.
 * Connects to wss://stream.binance.com:9443/stream and fetches book snapshots over REST.
 */
public class BinanceAdapter implements ExchangeAdapter {

    static final URI WS_URL = URI.create("wss://stream.binance.com:9443/stream");
    static final URI REST_URL = URI.create("https://api.binance.com");
    static final URI TESTNET_WS_URL = URI.create("wss://testnet.binance.vision/stream");
    static final URI TESTNET_REST_URL = URI.create("https://testnet.binance.vision");

    private final Transport transport;
    private final URI endpoint;
    private final BinanceMarketDataDecoder decoder;
    private final BinanceProtocol protocol;
    private final SnapshotSource snapshotSource;

    public BinanceAdapter(Transport transport, boolean testnet) {
        this(transport, testnet ? TESTNET_WS_URL : WS_URL, testnet ? TESTNET_REST_URL : REST_URL);
    }

    public BinanceAdapter(Transport transport, URI endpoint, URI restBaseUri) {
        this(transport, endpoint, new BinanceDepthSnapshotSource(restBaseUri, new BinanceMarketDataDecoder()));
    }

    /**
     * @param snapshotSource where depth snapshots come from
     */
    public BinanceAdapter(Transport transport, URI endpoint, SnapshotSource snapshotSource) {
        this.transport = transport;
        this.endpoint = endpoint;
        this.decoder = new BinanceMarketDataDecoder();
        this.protocol = new BinanceProtocol();
        this.snapshotSource = snapshotSource;
    }

    public static ExchangeAdapterFactory factory() {
        return BinanceAdapter::new;
    }

    @Override
    public Exchange exchange() {
        return Exchange.BINANCE;
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
        return Optional.of(snapshotSource);
    }
}
