package io.trading.marketstream.stream;

import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.FeedKind;
import io.trading.marketstream.parser.model.Symbol;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identifies one logical feed requested by a caller.
 * Two handles for the same feed are distinct; each gets its own id.
 *
 * @param id        Unique handle id
 * @param exchange  Exchange the feed comes from
 * @param feedKind  Feed kind
 * @param symbol    Trading pair
 * @param parameter Optional feed parameter (kline interval code, book depth), may be null
 */
public record SubscriptionHandle(
    long id,
    Exchange exchange,
    FeedKind feedKind,
    Symbol symbol,
    String parameter
) {
    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    public SubscriptionHandle {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (feedKind == null) {
            throw new IllegalArgumentException("feedKind cannot be null");
        }
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
    }

    /**
     * Creates a handle with a fresh id.
     */
    public static SubscriptionHandle create(Exchange exchange, FeedKind feedKind, Symbol symbol, String parameter) {
        return new SubscriptionHandle(NEXT_ID.getAndIncrement(), exchange, feedKind, symbol, parameter);
    }

    /**
     * Returns the stream name used in logs and errors, e.g. "kline:BTCUSDT:1m#7".
     */
    public String name() {
        StringBuilder name = new StringBuilder(feedKind.getDisplayName()).append(':').append(symbol);
        if (parameter != null) {
            name.append(':').append(parameter);
        }
        return name.append('#').append(id).toString();
    }

    @Override
    public String toString() {
        return exchange.getDisplayName() + "/" + name();
    }
}
