package io.trading.marketstream.parser.impl.binance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.marketstream.parser.api.DecodeException;
import io.trading.marketstream.parser.api.DecodedMessage;
import io.trading.marketstream.parser.api.MarketDataDecoder;
import io.trading.marketstream.parser.model.DepthDiff;
import io.trading.marketstream.parser.model.Exchange;
import io.trading.marketstream.parser.model.Kline;
import io.trading.marketstream.parser.model.KlineInterval;
import io.trading.marketstream.parser.model.OrderBook;
import io.trading.marketstream.parser.model.OrderBookLevel;
import io.trading.marketstream.parser.model.Side;
import io.trading.marketstream.parser.model.Symbol;
import io.trading.marketstream.parser.model.Ticker;
import io.trading.marketstream.parser.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Decoder for Binance spot WebSocket streams.
 *
 * Handles both raw stream payloads and combined-stream envelopes
 * ({"stream":"btcusdt@ticker","data":{...}}), subscription acknowledgements
 * and error replies. Also decodes the REST depth snapshot used to seed local order books.
 */
public class BinanceMarketDataDecoder implements MarketDataDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinanceMarketDataDecoder.class);

    private static final String EVENT_TICKER = "24hrTicker";
    private static final String EVENT_TRADE = "trade";
    private static final String EVENT_KLINE = "kline";
    private static final String EVENT_DEPTH = "depthUpdate";

    private final ObjectMapper objectMapper;

    public BinanceMarketDataDecoder() {
        this(new ObjectMapper());
    }

    public BinanceMarketDataDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Exchange getExchange() {
        return Exchange.BINANCE;
    }

    @Override
    public DecodedMessage decode(String message) throws DecodeException {
        JsonNode root = readTree(message);

        if (root.has("result") && root.has("id")) {
            return DecodedMessage.control("ack id=" + root.get("id").asText());
        }
        if (root.has("error")) {
            JsonNode error = root.get("error");
            return rejected("code=" + error.path("code").asText() + ": " + error.path("msg").asText());
        }
        if (root.has("code") && root.has("msg")) {
            return rejected("code=" + root.get("code").asText() + ": " + root.get("msg").asText());
        }

        JsonNode data = root.has("stream") && root.has("data") ? root.get("data") : root;
        String eventType = data.path("e").asText(null);
        if (eventType == null) {
            throw new DecodeException("Missing event type", message);
        }

        try {
            return switch (eventType) {
                case EVENT_TICKER -> DecodedMessage.event(parseTicker(data), null);
                case EVENT_TRADE -> DecodedMessage.event(parseTrade(data), null);
                case EVENT_KLINE -> {
                    Kline kline = parseKline(data);
                    yield DecodedMessage.event(kline, kline.interval().code());
                }
                case EVENT_DEPTH -> DecodedMessage.event(parseDepthDiff(data), null);
                default -> throw new DecodeException("Unsupported event type: " + eventType, message);
            };
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new DecodeException("Invalid " + eventType + " payload: " + e.getMessage(), message, e);
        }
    }

    /**
     * Decodes a REST depth snapshot ({"lastUpdateId":..,"bids":[..],"asks":[..]}).
     *
     * @param symbol  The symbol the snapshot was requested for
     * @param message The raw JSON body
     */
    public OrderBook decodeDepthSnapshot(Symbol symbol, String message) throws DecodeException {
        JsonNode root = readTree(message);
        if (!root.has("lastUpdateId")) {
            throw new DecodeException("Missing lastUpdateId in depth snapshot", message);
        }
        try {
            return new OrderBook(
                Exchange.BINANCE,
                symbol,
                System.currentTimeMillis(),
                parseLevels(root.path("bids")),
                parseLevels(root.path("asks")),
                root.get("lastUpdateId").asLong(),
                0L
            );
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Invalid depth snapshot: " + e.getMessage(), message, e);
        }
    }

    private static DecodedMessage rejected(String detail) {
        LOGGER.warn("Request rejected: {}", detail);
        return DecodedMessage.rejected(detail);
    }

    private JsonNode readTree(String message) throws DecodeException {
        if (message == null || message.isEmpty()) {
            throw new DecodeException("Empty message", message);
        }
        try {
            JsonNode root = objectMapper.readTree(message);
            if (root == null || !root.isObject()) {
                throw new DecodeException("Message is not a JSON object", message);
            }
            return root;
        } catch (JsonProcessingException e) {
            LOGGER.debug("Malformed JSON: {}", e.getOriginalMessage());
            throw new DecodeException("Malformed JSON", message, e);
        }
    }

    /**
     * Binance ticker: {"e":"24hrTicker","E":..,"s":"BTCUSDT","c":"..","b":"..","a":"..",...}
     */
    private Ticker parseTicker(JsonNode node) {
        return new Ticker(
            Exchange.BINANCE,
            Symbol.of(node.path("s").asText()),
            node.path("E").asLong(),
            decimal(node, "c"),
            decimal(node, "b"),
            decimal(node, "a"),
            decimal(node, "B"),
            decimal(node, "A"),
            decimal(node, "h"),
            decimal(node, "l"),
            decimal(node, "v"),
            decimal(node, "q"),
            decimal(node, "p"),
            decimal(node, "P")
        );
    }

    /**
     * Binance trade: {"e":"trade","E":..,"s":"BTCUSDT","t":12345,"p":"..","q":"..","T":..,"m":true}
     * "m" means the buyer is the maker, so the taker sold.
     */
    private Trade parseTrade(JsonNode node) {
        boolean buyerMaker = node.path("m").asBoolean();
        return new Trade(
            Exchange.BINANCE,
            Symbol.of(node.path("s").asText()),
            node.has("T") ? node.get("T").asLong() : node.path("E").asLong(),
            node.path("t").asText(),
            decimal(node, "p"),
            decimal(node, "q"),
            buyerMaker ? Side.SELL : Side.BUY,
            buyerMaker
        );
    }

    /**
     * Binance kline: {"e":"kline","E":..,"s":"BTCUSDT","k":{"t":..,"T":..,"i":"1m","o":..,...,"x":false}}
     */
    private Kline parseKline(JsonNode node) {
        JsonNode k = node.path("k");
        return new Kline(
            Exchange.BINANCE,
            Symbol.of(node.path("s").asText()),
            KlineInterval.fromCode(k.path("i").asText()),
            k.path("t").asLong(),
            k.path("T").asLong(),
            decimal(k, "o"),
            decimal(k, "h"),
            decimal(k, "l"),
            decimal(k, "c"),
            decimal(k, "v"),
            decimal(k, "q"),
            k.path("n").asLong(),
            k.path("x").asBoolean()
        );
    }

    /**
     * Binance diff depth: {"e":"depthUpdate","E":..,"s":"BTCUSDT","U":157,"u":160,"b":[["p","q"]],"a":[..]}
     */
    private DepthDiff parseDepthDiff(JsonNode node) {
        return new DepthDiff(
            Exchange.BINANCE,
            Symbol.of(node.path("s").asText()),
            node.path("E").asLong(),
            node.path("U").asLong(),
            node.path("u").asLong(),
            parseLevels(node.path("b")),
            parseLevels(node.path("a"))
        );
    }

    private static List<OrderBookLevel> parseLevels(JsonNode array) {
        List<OrderBookLevel> levels = new ArrayList<>(array.size());
        for (JsonNode level : array) {
            if (!level.isArray() || level.size() < 2) {
                throw new IllegalArgumentException("level must be a [price, quantity] pair");
            }
            levels.add(new OrderBookLevel(
                new BigDecimal(level.get(0).asText()),
                new BigDecimal(level.get(1).asText())
            ));
        }
        return levels;
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(value.asText());
    }
}
