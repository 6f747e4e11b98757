package io.trading.marketstream.exchange;

import io.trading.marketstream.book.SnapshotSource;
import io.trading.marketstream.parser.api.MarketDataDecoder;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.FeedClass;
import io.trading.marketstream.transport.Transport;

import java.net.URI;
import java.util.Optional;

/**
 * Everything the stream engine needs to talk to one exchange.
 */
public interface ExchangeAdapter {

    Exchange exchange();

    /**
     * Returns the WebSocket endpoint serving a feed class.
     */
    URI endpoint(FeedClass feedClass);

    Transport transport();

    MarketDataDecoder decoder();

    ExchangeProtocol protocol();

    /**
     * Returns the out-of-band snapshot source, or empty when snapshots arrive on the stream
     * after subscribing to the depth topic.
     */
    Optional<SnapshotSource> snapshotSource();
}
