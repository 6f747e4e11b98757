package io.trading.marketstream.support;

import io.trading.marketstream.book.SnapshotSource;
import io.trading.marketstream.exchange.ExchangeAdapter;
import io.trading.marketstream.exchange.binance.BinanceAdapter;
import io.trading.marketstream.exchange.bybit.BybitAdapter;
import io.trading.marketstream.transport.Transport;

import java.net.URI;

/**
 * Exchange adapters wired to fake transports.
 */
public final class TestAdapters {

    public static final URI BINANCE_WS = URI.create("wss://binance.test/stream");
    public static final URI BYBIT_WS = URI.create("wss://bybit.test/v5/public/spot");

    private TestAdapters() {
    }

    public static ExchangeAdapter bybit(Transport transport) {
        return new BybitAdapter(transport, BYBIT_WS);
    }

    /**
     * Binance adapter whose depth snapshots come from the given source instead of REST.
     */
    public static ExchangeAdapter binance(Transport transport, SnapshotSource snapshots) {
        return new BinanceAdapter(transport, BINANCE_WS, snapshots);
    }
}
