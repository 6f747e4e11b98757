package io.trading.marketstream.exchange;

import io.trading.marketstream.parser.api.DecodedMessage;
import io.trading.marketstream.parser.model.FeedKind;
import io.trading.marketstream.parser.model.Symbol;

import java.util.List;
import java.util.Optional;

/**
 * Exchange-specific naming of stream topics and the control messages that manage them.
 */
public interface ExchangeProtocol {

    /**
     * Returns the exchange topic carrying a feed, e.g. {@code btcusdt@trade}.
     * Equal requests map to equal topics so that subscribers can share them.
     *
     * @param parameter kline interval code or book depth, may be null
     */
    String topic(FeedKind feedKind, Symbol symbol, String parameter);

    /**
     * Returns the topic a decoded event belongs to.
     */
    default String topicOf(DecodedMessage message) {
        return topic(message.feedKind(), message.symbol(), message.parameter());
    }

    String subscribeMessage(List<String> topics, long requestId);

    String unsubscribeMessage(List<String> topics, long requestId);

    /**
     * Returns the application-level ping, or empty when WebSocket ping frames are used.
     */
    Optional<String> pingMessage();
}
