package io.trading.marketstream.parser.impl.bybit;

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
import io.trading.marketstream.parser.model.MarketEvent;
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
import java.util.Map;

/**
 * Decoder for Bybit v5 public WebSocket streams.
 *
 * Topics: tickers.{symbol}, publicTrade.{symbol}, kline.{interval}.{symbol}, orderbook.{depth}.{symbol}.
 * Order book topics deliver an in-band snapshot after every subscribe, followed by deltas whose
 * update id "u" increases by one per message.
 */
public class BybitMarketDataDecoder implements MarketDataDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(BybitMarketDataDecoder.class);

    private static final String TOPIC_TICKERS = "tickers.";
    private static final String TOPIC_TRADES = "publicTrade.";
    private static final String TOPIC_KLINE = "kline.";
    private static final String TOPIC_ORDERBOOK = "orderbook.";

    private static final Map<String, KlineInterval> INTERVALS = Map.ofEntries(
        Map.entry("1", KlineInterval.ONE_MINUTE),
        Map.entry("3", KlineInterval.THREE_MINUTES),
        Map.entry("5", KlineInterval.FIVE_MINUTES),
        Map.entry("15", KlineInterval.FIFTEEN_MINUTES),
        Map.entry("30", KlineInterval.THIRTY_MINUTES),
        Map.entry("60", KlineInterval.ONE_HOUR),
        Map.entry("120", KlineInterval.TWO_HOURS),
        Map.entry("240", KlineInterval.FOUR_HOURS),
        Map.entry("360", KlineInterval.SIX_HOURS),
        Map.entry("720", KlineInterval.TWELVE_HOURS),
        Map.entry("D", KlineInterval.ONE_DAY),
        Map.entry("W", KlineInterval.ONE_WEEK),
        Map.entry("M", KlineInterval.ONE_MONTH)
    );

    private final ObjectMapper objectMapper;

    public BybitMarketDataDecoder() {
        this(new ObjectMapper());
    }

    public BybitMarketDataDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Maps a kline interval to the code Bybit uses in topic names.
     *
     * @throws IllegalArgumentException if Bybit has no such interval
     */
    public static String intervalCode(KlineInterval interval) {
        for (Map.Entry<String, KlineInterval> entry : INTERVALS.entrySet()) {
            if (entry.getValue() == interval) {
                return entry.getKey();
            }
        }
        throw new IllegalArgumentException("Bybit does not support kline interval " + interval);
    }

    @Override
    public Exchange getExchange() {
        return Exchange.BYBIT;
    }

    @Override
    public DecodedMessage decode(String message) throws DecodeException {
        JsonNode root = readTree(message);

        String op = root.path("op").asText("");
        if ("pong".equals(op) || "pong".equals(root.path("ret_msg").asText(""))) {
            return DecodedMessage.pong();
        }
        if (!op.isEmpty()) {
            if (root.has("success") && !root.get("success").asBoolean()) {
                String detail = op + ": " + root.path("ret_msg").asText();
                LOGGER.warn("Request rejected: {}", detail);
                return DecodedMessage.rejected(detail);
            }
            return DecodedMessage.control(op);
        }

        String topic = root.path("topic").asText(null);
        if (topic == null) {
            throw new DecodeException("Missing topic", message);
        }

        try {
            if (topic.startsWith(TOPIC_TICKERS)) {
                return DecodedMessage.event(parseTicker(root), null);
            }
            if (topic.startsWith(TOPIC_TRADES)) {
                return DecodedMessage.events(parseTrades(root), null);
            }
            if (topic.startsWith(TOPIC_KLINE)) {
                List<Kline> klines = parseKlines(topic, root);
                return DecodedMessage.events(klines, klines.get(0).interval().code());
            }
            if (topic.startsWith(TOPIC_ORDERBOOK)) {
                String depth = topic.substring(TOPIC_ORDERBOOK.length(), topic.lastIndexOf('.'));
                return DecodedMessage.event(parseOrderBook(root), depth);
            }
        } catch (IllegalArgumentException | ArithmeticException | IndexOutOfBoundsException e) {
            throw new DecodeException("Invalid " + topic + " payload: " + e.getMessage(), message, e);
        }
        LOGGER.debug("Unsupported topic {}", topic);
        throw new DecodeException("Unsupported topic: " + topic, message);
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
     * {"topic":"tickers.BTCUSDT","ts":..,"type":"snapshot","data":{"symbol":..,"lastPrice":..,...}}
     */
    private Ticker parseTicker(JsonNode root) {
        JsonNode data = root.path("data");
        BigDecimal lastPrice = decimal(data, "lastPrice");
        BigDecimal prevPrice = decimal(data, "prevPrice24h");
        return new Ticker(
            Exchange.BYBIT,
            Symbol.of(data.path("symbol").asText()),
            root.path("ts").asLong(),
            lastPrice,
            decimal(data, "bid1Price"),
            decimal(data, "ask1Price"),
            decimal(data, "bid1Size"),
            decimal(data, "ask1Size"),
            decimal(data, "highPrice24h"),
            decimal(data, "lowPrice24h"),
            decimal(data, "volume24h"),
            decimal(data, "turnover24h"),
            prevPrice.signum() == 0 ? BigDecimal.ZERO : lastPrice.subtract(prevPrice),
            decimal(data, "price24hPcnt").movePointRight(2)
        );
    }

    /**
     * {"topic":"publicTrade.BTCUSDT","data":[{"T":..,"s":"BTCUSDT","S":"Buy","v":"0.001","p":"16578.50","i":".."}]}
     */
    private List<MarketEvent> parseTrades(JsonNode root) {
        List<MarketEvent> trades = new ArrayList<>();
        for (JsonNode trade : root.path("data")) {
            Side side = Side.parse(trade.path("S").asText());
            trades.add(new Trade(
                Exchange.BYBIT,
                Symbol.of(trade.path("s").asText()),
                trade.path("T").asLong(),
                trade.path("i").asText(),
                decimal(trade, "p"),
                decimal(trade, "v"),
                side,
                side == Side.SELL
            ));
        }
        if (trades.isEmpty()) {
            throw new IllegalArgumentException("trade message has no data");
        }
        return trades;
    }

    /**
     * {"topic":"kline.1.BTCUSDT","data":[{"start":..,"end":..,"interval":"1","open":..,"confirm":false}]}
     */
    private List<Kline> parseKlines(String topic, JsonNode root) {
        Symbol symbol = Symbol.of(topic.substring(topic.lastIndexOf('.') + 1));
        List<Kline> klines = new ArrayList<>();
        for (JsonNode k : root.path("data")) {
            KlineInterval interval = INTERVALS.get(k.path("interval").asText());
            if (interval == null) {
                throw new IllegalArgumentException("unknown interval " + k.path("interval").asText());
            }
            klines.add(new Kline(
                Exchange.BYBIT,
                symbol,
                interval,
                k.path("start").asLong(),
                k.path("end").asLong(),
                decimal(k, "open"),
                decimal(k, "high"),
                decimal(k, "low"),
                decimal(k, "close"),
                decimal(k, "volume"),
                decimal(k, "turnover"),
                0L,
                k.path("confirm").asBoolean()
            ));
        }
        if (klines.isEmpty()) {
            throw new IllegalArgumentException("kline message has no data");
        }
        return klines;
    }

    /**
     * {"topic":"orderbook.50.BTCUSDT","type":"snapshot|delta","ts":..,"data":{"s":..,"b":[..],"a":[..],"u":..}}
     */
    private MarketEvent parseOrderBook(JsonNode root) {
        JsonNode data = root.path("data");
        Symbol symbol = Symbol.of(data.path("s").asText());
        long updateId = data.path("u").asLong();
        List<OrderBookLevel> bids = parseLevels(data.path("b"));
        List<OrderBookLevel> asks = parseLevels(data.path("a"));
        long timestamp = root.path("ts").asLong();

        if ("snapshot".equals(root.path("type").asText())) {
            return new OrderBook(Exchange.BYBIT, symbol, timestamp, bids, asks, updateId, 0L);
        }
        return new DepthDiff(Exchange.BYBIT, symbol, timestamp, updateId, updateId, bids, asks);
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
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(value.asText());
    }
}
