package io.trading.marketstream.exchange.binance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.marketstream.exchange.ExchangeProtocol;
import io.trading.marketstream.parser.model.FeedKind;
import io.trading.marketstream.parser.model.KlineInterval;
import io.trading.marketstream.parser.model.Symbol;

import java.util.List;
import java.util.Optional;

/**
 * Binance combined-stream topics and SUBSCRIBE/UNSUBSCRIBE requests.
 * Liveness uses WebSocket ping frames, so there is no application-level ping.
 */
public class BinanceProtocol implements ExchangeProtocol {

    private static final String DEPTH_SUFFIX = "@depth@100ms";

    private final ObjectMapper objectMapper;

    public BinanceProtocol() {
        this(new ObjectMapper());
    }

    public BinanceProtocol(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Topics: {@code btcusdt@ticker}, {@code btcusdt@trade}, {@code btcusdt@kline_1m},
     * {@code btcusdt@depth@100ms}. The depth parameter does not change the diff topic.
     */
    @Override
    public String topic(FeedKind feedKind, Symbol symbol, String parameter) {
        String stream = symbol.lowerCase();
        return switch (feedKind) {
            case TICKER -> stream + "@ticker";
            case TRADE -> stream + "@trade";
            case KLINE -> stream + "@kline_" + klineCode(parameter);
            case ORDER_BOOK -> stream + DEPTH_SUFFIX;
        };
    }

    private static String klineCode(String parameter) {
        if (parameter == null) {
            throw new IllegalArgumentException("kline topic needs an interval");
        }
        return KlineInterval.fromCode(parameter).code();
    }

    @Override
    public String subscribeMessage(List<String> topics, long requestId) {
        return request("SUBSCRIBE", topics, requestId);
    }

    @Override
    public String unsubscribeMessage(List<String> topics, long requestId) {
        return request("UNSUBSCRIBE", topics, requestId);
    }

    private String request(String method, List<String> topics, long requestId) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("method", method);
        ArrayNode params = request.putArray("params");
        topics.forEach(params::add);
        request.put("id", requestId);
        return request.toString();
    }

    @Override
    public Optional<String> pingMessage() {
        return Optional.empty();
    }
}
