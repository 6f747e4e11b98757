package io.trading.marketstream.exchange.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.marketstream.parser.api.DecodedMessage;
import io.trading.marketstream.parser.impl.binance.BinanceMarketDataDecoder;
import io.trading.marketstream.parser.model.FeedKind;
import io.trading.marketstream.parser.model.Symbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BinanceProtocol.
 */
class BinanceProtocolTest {

    private static final Symbol BTCUSDT = Symbol.of("BTCUSDT");

    private final BinanceProtocol protocol = new BinanceProtocol();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testTopics() {
        assertEquals("btcusdt@ticker", protocol.topic(FeedKind.TICKER, BTCUSDT, null));
        assertEquals("btcusdt@trade", protocol.topic(FeedKind.TRADE, BTCUSDT, null));
        assertEquals("btcusdt@kline_15m", protocol.topic(FeedKind.KLINE, BTCUSDT, "15m"));
        assertEquals("btcusdt@depth@100ms", protocol.topic(FeedKind.ORDER_BOOK, BTCUSDT, "20"));
        assertEquals("btcusdt@depth@100ms", protocol.topic(FeedKind.ORDER_BOOK, BTCUSDT, null));
    }

    @Test
    void testKlineNeedsKnownInterval() {
        assertThrows(IllegalArgumentException.class, () -> protocol.topic(FeedKind.KLINE, BTCUSDT, null));
        assertThrows(IllegalArgumentException.class, () -> protocol.topic(FeedKind.KLINE, BTCUSDT, "7m"));
    }

    @Test
    void testSubscribeMessage() throws Exception {
        JsonNode request = objectMapper.readTree(
            protocol.subscribeMessage(List.of("btcusdt@trade", "ethusdt@trade"), 7));

        assertEquals("SUBSCRIBE", request.get("method").asText());
        assertEquals(2, request.get("params").size());
        assertEquals("ethusdt@trade", request.get("params").get(1).asText());
        assertEquals(7, request.get("id").asLong());
    }

    @Test
    void testUnsubscribeMessage() throws Exception {
        JsonNode request = objectMapper.readTree(protocol.unsubscribeMessage(List.of("btcusdt@ticker"), 8));

        assertEquals("UNSUBSCRIBE", request.get("method").asText());
        assertEquals("btcusdt@ticker", request.get("params").get(0).asText());
    }

    @Test
    void testUsesWebSocketPings() {
        assertTrue(protocol.pingMessage().isEmpty());
    }

    @Test
    void testDecodedEventsMapBackToTheirTopic() throws Exception {
        BinanceMarketDataDecoder decoder = new BinanceMarketDataDecoder();
        DecodedMessage kline = decoder.decode("""
            {"e":"kline","E":1,"s":"BTCUSDT","k":{"t":0,"T":1,"i":"1h","o":"1","c":"1","h":"1","l":"1","v":"1","q":"1","n":1,"x":true}}
            """);
        DecodedMessage depth = decoder.decode("""
            {"e":"depthUpdate","E":1,"s":"BTCUSDT","U":1,"u":2,"b":[],"a":[]}
            """);

        assertEquals(protocol.topic(FeedKind.KLINE, BTCUSDT, "1h"), protocol.topicOf(kline));
        assertEquals(protocol.topic(FeedKind.ORDER_BOOK, BTCUSDT, "10"), protocol.topicOf(depth));
    }

    @Test
    void testSnapshotLimitRoundsUp() {
        assertEquals(5, BinanceDepthSnapshotSource.limitFor(1));
        assertEquals(20, BinanceDepthSnapshotSource.limitFor(11));
        assertEquals(1000, BinanceDepthSnapshotSource.limitFor(1000));
        assertEquals(5000, BinanceDepthSnapshotSource.limitFor(20000));
    }
}
