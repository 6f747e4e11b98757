package io.trading.marketstream.config;

import io.trading.marketstream.channel.OverflowPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StreamConfig.
 */
class StreamConfigTest {

    @Test
    void testDefaults() {
        StreamConfig config = StreamConfig.defaults();

        assertEquals(100, config.bufferSize());
        assertEquals(OverflowPolicy.DROP_NEWEST, config.overflowPolicy());
        assertTrue(config.reconnect());
        assertEquals(10, config.maxReconnectAttempts());
        assertEquals(Duration.ofSeconds(1), config.baseDelay());
        assertEquals(Duration.ofSeconds(60), config.maxDelay());
        assertEquals(Duration.ofSeconds(20), config.pingInterval());
        assertEquals(Duration.ofSeconds(10), config.pongTimeout());
        assertTrue(config.keepaliveEnabled());
    }

    @Test
    void testFromEnv() {
        Map<String, String> env = Map.of(
            "STREAM_BUFFER_SIZE", "5",
            "STREAM_OVERFLOW_POLICY", "drop_oldest",
            "STREAM_RECONNECT", "true",
            "STREAM_MAX_RECONNECT_ATTEMPTS", "3",
            "STREAM_BASE_DELAY_MS", "250",
            "STREAM_MAX_DELAY_MS", "2000",
            "STREAM_MAX_STREAMS_PER_CONNECTION", "4"
        );

        StreamConfig config = StreamConfig.fromEnv(env::get);

        assertEquals(5, config.bufferSize());
        assertEquals(OverflowPolicy.DROP_OLDEST, config.overflowPolicy());
        assertEquals(3, config.maxReconnectAttempts());
        assertEquals(Duration.ofMillis(250), config.baseDelay());
        assertEquals(Duration.ofMillis(2000), config.maxDelay());
        assertEquals(4, config.maxStreamsPerConnection());
        assertEquals(StreamConfig.DEFAULT_PING_INTERVAL, config.pingInterval());
    }

    @Test
    void testFromEnvFallsBackOnGarbage() {
        Map<String, String> env = Map.of("STREAM_BUFFER_SIZE", "lots", "STREAM_BASE_DELAY_MS", "soon");

        StreamConfig config = StreamConfig.fromEnv(env::get);

        assertEquals(StreamConfig.DEFAULT_BUFFER_SIZE, config.bufferSize());
        assertEquals(StreamConfig.DEFAULT_BASE_DELAY, config.baseDelay());
    }

    @Test
    void testKeepaliveDisabledWithoutReconnect() {
        StreamConfig config = StreamConfig.builder()
            .reconnect(false)
            .pingInterval(Duration.ZERO)
            .build();

        assertFalse(config.keepaliveEnabled());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> StreamConfig.builder().bufferSize(-1).build());
        assertThrows(IllegalArgumentException.class, () -> StreamConfig.builder().maxReconnectAttempts(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> StreamConfig.builder().baseDelay(Duration.ofSeconds(5)).maxDelay(Duration.ofSeconds(1)).build());
        assertThrows(IllegalArgumentException.class, () -> StreamConfig.builder().pingInterval(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> StreamConfig.builder().errorBufferSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> StreamConfig.builder().maxStreamsPerConnection(0).build());
    }

    @Test
    void testToBuilderCopies() {
        StreamConfig config = StreamConfig.builder().bufferSize(7).build();

        StreamConfig copy = config.toBuilder().maxReconnectAttempts(1).build();

        assertEquals(7, copy.bufferSize());
        assertEquals(1, copy.maxReconnectAttempts());
    }
}
