package io.trading.marketstream.exchange.binance;

import io.trading.marketstream.book.SnapshotSource;
import io.trading.marketstream.parser.api.DecodeException;
import io.trading.marketstream.parser.impl.binance.BinanceMarketDataDecoder;
import io.trading.marketstream.parser.model.OrderBook;
import io.trading.marketstream.parser.model.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fetches depth snapshots from the Binance REST API ({@code GET /api/v3/depth}).
 */
public class BinanceDepthSnapshotSource implements SnapshotSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinanceDepthSnapshotSource.class);
    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final int[] ALLOWED_LIMITS = {5, 10, 20, 50, 100, 500, 1000, 5000};

    private final URI baseUri;
    private final HttpClient httpClient;
    private final BinanceMarketDataDecoder decoder;

    public BinanceDepthSnapshotSource(URI baseUri, BinanceMarketDataDecoder decoder) {
        this(baseUri, HttpClient.newBuilder().connectTimeout(TIMEOUT).build(), decoder);
    }

    public BinanceDepthSnapshotSource(URI baseUri, HttpClient httpClient, BinanceMarketDataDecoder decoder) {
        this.baseUri = baseUri;
        this.httpClient = httpClient;
        this.decoder = decoder;
    }

    /**
     * Rounds a requested depth up to the nearest limit the endpoint accepts.
     */
    static int limitFor(int depth) {
        for (int limit : ALLOWED_LIMITS) {
            if (depth <= limit) {
                return limit;
            }
        }
        return ALLOWED_LIMITS[ALLOWED_LIMITS.length - 1];
    }

    @Override
    public CompletableFuture<OrderBook> fetchSnapshot(Symbol symbol, int depth) {
        URI uri = baseUri.resolve("/api/v3/depth?symbol=" + symbol.value() + "&limit=" + limitFor(depth));
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(TIMEOUT)
            .header("Accept", "application/json")
            .GET()
            .build();

        LOGGER.debug("[Binance] Fetching depth snapshot {}", uri);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> {
                if (response.statusCode() != 200) {
                    throw new CompletionException(new IOException(
                        "Depth snapshot for " + symbol + " failed with HTTP " + response.statusCode()));
                }
                try {
                    return decoder.decodeDepthSnapshot(symbol, response.body());
                } catch (DecodeException e) {
                    throw new CompletionException(e);
                }
            });
    }
}
