package io.trading.marketstream.exchange.bybit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.marketstream.exchange.ExchangeProtocol;
import io.trading.marketstream.parser.impl.bybit.BybitMarketDataDecoder;
import io.trading.marketstream.parser.model.FeedKind;
import io.trading.marketstream.parser.model.KlineInterval;
import io.trading.marketstream.parser.model.Symbol;

import java.util.List;
import java.util.Optional;

/**
 * Bybit v5 public topics and op requests. Bybit expects {"op":"ping"} as keepalive.
 */
public class BybitProtocol implements ExchangeProtocol {

    static final int DEFAULT_BOOK_DEPTH = 50;
    private static final int[] BOOK_DEPTHS = {1, 50, 200};

    private final ObjectMapper objectMapper;

    public BybitProtocol() {
        this(new ObjectMapper());
    }

    public BybitProtocol(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String topic(FeedKind feedKind, Symbol symbol, String parameter) {
        return switch (feedKind) {
            case TICKER -> "tickers." + symbol;
            case TRADE -> "publicTrade." + symbol;
            case KLINE -> "kline." + klineCode(parameter) + "." + symbol;
            case ORDER_BOOK -> "orderbook." + bookDepth(parameter) + "." + symbol;
        };
    }

    private static String klineCode(String parameter) {
        if (parameter == null) {
            throw new IllegalArgumentException("kline topic needs an interval");
        }
        return BybitMarketDataDecoder.intervalCode(KlineInterval.fromCode(parameter));
    }

    /**
     * Rounds a requested depth up to the nearest depth Bybit publishes for spot.
     */
    static int bookDepth(String parameter) {
        if (parameter == null || parameter.isEmpty()) {
            return DEFAULT_BOOK_DEPTH;
        }
        int requested = Integer.parseInt(parameter);
        if (requested <= 0) {
            return DEFAULT_BOOK_DEPTH;
        }
        for (int depth : BOOK_DEPTHS) {
            if (requested <= depth) {
                return depth;
            }
        }
        return BOOK_DEPTHS[BOOK_DEPTHS.length - 1];
    }

    @Override
    public String subscribeMessage(List<String> topics, long requestId) {
        return request("subscribe", topics, requestId);
    }

    @Override
    public String unsubscribeMessage(List<String> topics, long requestId) {
        return request("unsubscribe", topics, requestId);
    }

    private String request(String op, List<String> topics, long requestId) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("req_id", String.valueOf(requestId));
        request.put("op", op);
        ArrayNode args = request.putArray("args");
        topics.forEach(args::add);
        return request.toString();
    }

    @Override
    public Optional<String> pingMessage() {
        return Optional.of("{\"op\":\"ping\"}");
    }
}
